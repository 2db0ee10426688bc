package com.lambdastepper.lambda;

import java.util.List;

/**
 * Structural helpers: copying, measuring and addressing subtrees by path.
 */
public class Terms {
    // a child slot, one step of a path from a root down to a node
    public enum Slot {
        BODY,
        LEFT,
        RIGHT
    }

    /**
     * A structural copy made of fresh nodes only.
     */
    public static Term copy(Term term) {
        if (term instanceof Term.Variable) {
            return new Term.Variable(((Term.Variable)term).name);
        }
        if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            return new Term.Lambda(lambda.param, copy(lambda.body));
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            return new Term.Application(copy(app.left), copy(app.right));
        }
        throw LambdaUtil.unknownTerm(term);
    }

    public static int size(Term term) {
        if (term instanceof Term.Variable) {
            return 1;
        }
        if (term instanceof Term.Lambda) {
            return 1 + size(((Term.Lambda)term).body);
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            return 1 + size(app.left) + size(app.right);
        }
        throw LambdaUtil.unknownTerm(term);
    }

    public static int depth(Term term) {
        if (term instanceof Term.Variable) {
            return 1;
        }
        if (term instanceof Term.Lambda) {
            return 1 + depth(((Term.Lambda)term).body);
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            return 1 + Math.max(depth(app.left), depth(app.right));
        }
        throw LambdaUtil.unknownTerm(term);
    }

    public static Term subtermAt(Term root, List<Slot> path) {
        Term term = root;
        for (Slot slot : path) {
            term = child(term, slot);
        }
        return term;
    }

    /**
     * Returns a new root in which the node at {@code path} is replaced.
     * Only the nodes along the path are rebuilt; {@code root} is unchanged.
     */
    public static Term replaceAt(Term root, List<Slot> path, Term replacement) {
        return replaceAt(root, path, 0, replacement);
    }

    private static Term replaceAt(Term term, List<Slot> path, int idx, Term replacement) {
        if (idx == path.size()) {
            return replacement;
        }
        Slot slot = path.get(idx);
        Term child = replaceAt(child(term, slot), path, idx + 1, replacement);
        switch (slot) {
            case BODY:
                return new Term.Lambda(((Term.Lambda)term).param, child);
            case LEFT:
                return new Term.Application(child, ((Term.Application)term).right);
            case RIGHT:
                return new Term.Application(((Term.Application)term).left, child);
            default:
                throw new IllegalStateException("unknown slot " + slot + ". BUG");
        }
    }

    private static Term child(Term term, Slot slot) {
        if (slot == Slot.BODY && term instanceof Term.Lambda) {
            return ((Term.Lambda)term).body;
        }
        if (slot == Slot.LEFT && term instanceof Term.Application) {
            return ((Term.Application)term).left;
        }
        if (slot == Slot.RIGHT && term instanceof Term.Application) {
            return ((Term.Application)term).right;
        }
        throw new IllegalStateException("path slot " + slot + " does not match " +
            term.getClass().getSimpleName() + ". BUG");
    }
}
