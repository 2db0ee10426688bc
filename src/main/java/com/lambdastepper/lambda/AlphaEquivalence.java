package com.lambdastepper.lambda;

import java.util.HashMap;
import java.util.Map;

/**
 * Equality up to consistent renaming of bound variables.
 */
public class AlphaEquivalence {

    public static boolean equivalent(Term a, Term b) {
        return equivalent(a, b, new HashMap<String, Integer>(), new HashMap<String, Integer>(), 0);
    }

    // bindersA/bindersB map a bound name to the depth of the lambda that
    // binds it; a pair of variables matches when both map to the same depth
    private static boolean equivalent(Term a, Term b, Map<String, Integer> bindersA,
                                      Map<String, Integer> bindersB, int depth) {
        if (a instanceof Term.Variable && b instanceof Term.Variable) {
            String nameA = ((Term.Variable)a).name;
            String nameB = ((Term.Variable)b).name;
            Integer binderA = bindersA.get(nameA);
            Integer binderB = bindersB.get(nameB);
            if (binderA == null && binderB == null) {
                return nameA.equals(nameB);
            }
            if (binderA == null || binderB == null) {
                return false;
            }
            return binderA.intValue() == binderB.intValue();
        }
        if (a instanceof Term.Lambda && b instanceof Term.Lambda) {
            Term.Lambda lambdaA = (Term.Lambda)a;
            Term.Lambda lambdaB = (Term.Lambda)b;
            Map<String, Integer> innerA = new HashMap<>(bindersA);
            Map<String, Integer> innerB = new HashMap<>(bindersB);
            innerA.put(lambdaA.param, depth);
            innerB.put(lambdaB.param, depth);
            return equivalent(lambdaA.body, lambdaB.body, innerA, innerB, depth + 1);
        }
        if (a instanceof Term.Application && b instanceof Term.Application) {
            Term.Application appA = (Term.Application)a;
            Term.Application appB = (Term.Application)b;
            return equivalent(appA.left, appB.left, bindersA, bindersB, depth) &&
                equivalent(appA.right, appB.right, bindersA, bindersB, depth);
        }
        if (!isKnown(a)) {
            throw LambdaUtil.unknownTerm(a);
        }
        if (!isKnown(b)) {
            throw LambdaUtil.unknownTerm(b);
        }
        // different shapes
        return false;
    }

    private static boolean isKnown(Term term) {
        return term instanceof Term.Variable || term instanceof Term.Lambda ||
            term instanceof Term.Application;
    }
}
