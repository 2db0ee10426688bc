package com.lambdastepper.lambda;

import java.util.Collections;
import java.util.List;

/**
 * One beta reduction found by {@link Reducer#step}, not yet placed in the
 * tree. {@link #intermediate()} shows the substituted body still wrapped in
 * its redex; {@link #collapse()} commits the step.
 */
public class Reduction {
    private final Term root;
    private final Term.Application redex;
    private final Term reducedBody;
    private final List<Terms.Slot> path;

    Reduction(Term root, Term.Application redex, Term reducedBody, List<Terms.Slot> path) {
        this.root = root;
        this.redex = redex;
        this.reducedBody = reducedBody;
        this.path = Collections.unmodifiableList(path);
    }

    public Term getRoot() {
        return root;
    }

    // the application node being rewritten, a node of getRoot()
    public Term.Application getRedex() {
        return redex;
    }

    public Term.Lambda getFunction() {
        return (Term.Lambda)redex.left;
    }

    public Term getArgument() {
        return redex.right;
    }

    public Term getReducedBody() {
        return reducedBody;
    }

    public List<Terms.Slot> getPath() {
        return path;
    }

    /**
     * The tree with the substitution done but the redex not yet collapsed:
     * {@code (:x.body[x := arg]) arg} in place of {@code (:x.body) arg}.
     */
    public Term intermediate() {
        Term.Lambda pending = new Term.Lambda(getFunction().param, reducedBody);
        return Terms.replaceAt(root, path, new Term.Application(pending, redex.right));
    }

    /**
     * The tree after this step. {@link #getRoot()} is left as it was.
     */
    public Term collapse() {
        return Terms.replaceAt(root, path, reducedBody);
    }

    @Override
    public String toString() {
        return Unparser.unparse(redex) + " -> " + Unparser.unparse(reducedBody);
    }
}
