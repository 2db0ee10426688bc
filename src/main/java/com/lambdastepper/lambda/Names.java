package com.lambdastepper.lambda;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Free-variable and name analysis. Whether a variable is free or bound is
 * never stored on the tree; every query here recomputes it from structure.
 */
public class Names {

    public static Set<String> freeVariables(Term term) {
        Set<String> free = new LinkedHashSet<>();
        collectFree(term, Scope.EMPTY, free);
        return free;
    }

    private static void collectFree(Term term, Scope bound, Set<String> free) {
        if (term instanceof Term.Variable) {
            String name = ((Term.Variable)term).name;
            if (!bound.contains(name)) {
                free.add(name);
            }
        } else if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            collectFree(lambda.body, bound.bind(lambda.param), free);
        } else if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            collectFree(app.left, bound, free);
            collectFree(app.right, bound, free);
        } else {
            throw LambdaUtil.unknownTerm(term);
        }
    }

    public static boolean isClosed(Term term) {
        return freeVariables(term).isEmpty();
    }

    /**
     * Every identifier in the term, in binding position or in use position.
     */
    public static Set<String> allNames(Term term) {
        Set<String> names = new LinkedHashSet<>();
        collectNames(term, names);
        return names;
    }

    private static void collectNames(Term term, Set<String> names) {
        if (term instanceof Term.Variable) {
            names.add(((Term.Variable)term).name);
        } else if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            names.add(lambda.param);
            collectNames(lambda.body, names);
        } else if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            collectNames(app.left, names);
            collectNames(app.right, names);
        } else {
            throw LambdaUtil.unknownTerm(term);
        }
    }

    /**
     * Counts the free uses of {@code id} in {@code term}. A lambda that
     * rebinds {@code id} hides everything below it.
     */
    public static int countOccurrences(Term term, String id) {
        if (term instanceof Term.Variable) {
            return ((Term.Variable)term).name.equals(id) ? 1 : 0;
        }
        if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            if (lambda.param.equals(id)) {
                return 0;
            }
            return countOccurrences(lambda.body, id);
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            return countOccurrences(app.left, id) + countOccurrences(app.right, id);
        }
        throw LambdaUtil.unknownTerm(term);
    }

    public static boolean occursFree(Term term, String id) {
        return countOccurrences(term, id) > 0;
    }

    /**
     * Renames the uses of {@code oldId} that are free in {@code body}, that
     * is, the uses bound by the lambda whose body this is. Inner lambdas
     * that rebind {@code oldId} are left alone. {@code newId} must not occur
     * anywhere in {@code body}. Unchanged subtrees are returned as they are.
     */
    public static Term renameBoundUses(Term body, String oldId, String newId) {
        if (body instanceof Term.Variable) {
            if (((Term.Variable)body).name.equals(oldId)) {
                return new Term.Variable(newId);
            }
            return body;
        }
        if (body instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)body;
            if (lambda.param.equals(oldId)) {
                return lambda;
            }
            Term renamed = renameBoundUses(lambda.body, oldId, newId);
            if (renamed == lambda.body) {
                return lambda;
            }
            return new Term.Lambda(lambda.param, renamed);
        }
        if (body instanceof Term.Application) {
            Term.Application app = (Term.Application)body;
            Term left = renameBoundUses(app.left, oldId, newId);
            Term right = renameBoundUses(app.right, oldId, newId);
            if (left == app.left && right == app.right) {
                return app;
            }
            return new Term.Application(left, right);
        }
        throw LambdaUtil.unknownTerm(body);
    }

    /**
     * Returns the first of base1, base2, ... that is not in {@code avoid}.
     */
    public static String freshName(String base, Set<String> avoid) {
        int suffix = 1;
        String candidate = base + suffix;
        while (avoid.contains(candidate)) {
            suffix++;
            candidate = base + suffix;
        }
        return candidate;
    }
}
