package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.List;

/**
 * Normal-order (leftmost-outermost) beta reduction, one step at a time.
 */
public class Reducer {

    /**
     * Finds the leftmost-outermost redex of {@code root} and substitutes
     * into it.
     *
     * If the redex's parameter is used more than once in its body and the
     * argument can itself be reduced, the step is taken inside the
     * argument instead, so the argument is not copied unreduced into every
     * use.
     *
     * @return the pending reduction, or null if {@code root} is in normal form
     */
    public static Reduction step(Term root) {
        return find(root, root, Scope.EMPTY, new ArrayList<Terms.Slot>());
    }

    private static Reduction find(Term root, Term term, Scope scope, List<Terms.Slot> path) {
        if (term instanceof Term.Variable) {
            return null;
        }
        if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            return findIn(root, lambda.body, scope.bind(lambda.param), path, Terms.Slot.BODY);
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            if (app.isRedex()) {
                return reduceRedex(root, app, scope, path);
            }
            Reduction reduction = findIn(root, app.left, scope, path, Terms.Slot.LEFT);
            if (reduction != null) {
                return reduction;
            }
            return findIn(root, app.right, scope, path, Terms.Slot.RIGHT);
        }
        throw LambdaUtil.unknownTerm(term);
    }

    private static Reduction findIn(Term root, Term child, Scope scope, List<Terms.Slot> path, Terms.Slot slot) {
        path.add(slot);
        Reduction reduction = find(root, child, scope, path);
        if (reduction == null) {
            path.remove(path.size() - 1);
        }
        return reduction;
    }

    private static Reduction reduceRedex(Term root, Term.Application redex, Scope scope, List<Terms.Slot> path) {
        Term.Lambda function = (Term.Lambda)redex.left;
        int uses = Names.countOccurrences(function.body, function.param);
        if (uses > 1) {
            Reduction inArgument = findIn(root, redex.right, scope, path, Terms.Slot.RIGHT);
            if (inArgument != null) {
                LambdaUtil.debug("reduce", "'" + function.param + "' used " + uses +
                    " times, reducing argument first");
                return inArgument;
            }
        }
        Term reduced = Substitution.substitute(function.body, function.param, redex.right, scope);
        LambdaUtil.debug("reduce", "redex at " + path + ": " + Unparser.unparse(redex));
        return new Reduction(root, redex, reduced, new ArrayList<Terms.Slot>(path));
    }

    /**
     * Steps until no redex is left or {@code maxSteps} steps were taken.
     */
    public static NormalizationResult normalize(Term root, int maxSteps) {
        Term term = root;
        int steps = 0;
        while (steps < maxSteps) {
            Reduction reduction = step(term);
            if (reduction == null) {
                return new NormalizationResult(term, steps, true);
            }
            term = reduction.collapse();
            steps++;
        }
        return new NormalizationResult(term, steps, step(term) == null);
    }
}
