package com.lambdastepper.lambda;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Capture-avoiding substitution {@code target[id := sub]}.
 *
 * Two kinds of renaming keep the result correct:
 * <ul>
 *   <li>binder side: a lambda in the target whose parameter is free in
 *   {@code sub} is renamed before we substitute under it, so the free
 *   variable is not captured;</li>
 *   <li>copy side: every use site gets its own copy of {@code sub} whose
 *   lambdas are renamed away from the identifiers bound at that site.</li>
 * </ul>
 * The target is not modified. Subtrees without a free {@code id} are shared
 * with the result.
 */
public class Substitution {
    private final String id;
    private final Term sub;
    private final Set<String> subFree;
    private final Set<String> subNames;
    private int copies = 0;

    private Substitution(String id, Term sub) {
        this.id = id;
        this.sub = sub;
        this.subFree = Names.freeVariables(sub);
        this.subNames = Names.allNames(sub);
    }

    /**
     * @param scope the identifiers bound around {@code target} in the tree
     *              it will end up in
     */
    public static Term substitute(Term target, String id, Term sub, Scope scope) {
        Substitution substitution = new Substitution(id, sub);
        Term result = substitution.substituteIn(target, scope);
        LambdaUtil.debug("subst", "[" + id + " := " + Unparser.unparse(sub) + "] made " +
            substitution.copies + " copies");
        return result;
    }

    public static Term substitute(Term target, String id, Term sub) {
        return substitute(target, id, sub, Scope.EMPTY);
    }

    private Term substituteIn(Term target, Scope scope) {
        if (target instanceof Term.Variable) {
            if (((Term.Variable)target).name.equals(id)) {
                copies++;
                return copyFor(scope);
            }
            return target;
        }
        if (target instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)target;
            // shadowed, or nothing to replace below
            if (lambda.param.equals(id) || !Names.occursFree(lambda.body, id)) {
                return lambda;
            }
            String param = lambda.param;
            Term body = lambda.body;
            if (subFree.contains(param)) {
                Set<String> avoid = new HashSet<>(scope.names());
                avoid.addAll(subFree);
                avoid.addAll(Names.allNames(body));
                String fresh = Names.freshName(param, avoid);
                LambdaUtil.debug("subst", "renaming binder " + param + " -> " + fresh);
                body = Names.renameBoundUses(body, param, fresh);
                param = fresh;
            }
            return new Term.Lambda(param, substituteIn(body, scope.bind(param)));
        }
        if (target instanceof Term.Application) {
            Term.Application app = (Term.Application)target;
            Term left = substituteIn(app.left, scope);
            Term right = substituteIn(app.right, scope);
            if (left == app.left && right == app.right) {
                return app;
            }
            return new Term.Application(left, right);
        }
        throw LambdaUtil.unknownTerm(target);
    }

    private Term copyFor(Scope scope) {
        Set<String> avoid = new HashSet<>(scope.names());
        avoid.addAll(subNames);
        return alphaConvert(sub, scope, new HashMap<String, String>(), avoid);
    }

    // Builds a fresh copy of term, renaming each lambda whose parameter is
    // already bound in scope. renames maps old parameter names to new ones
    // for the lambdas enclosing the current position in the copy.
    private static Term alphaConvert(Term term, Scope scope, Map<String, String> renames, Set<String> avoid) {
        if (term instanceof Term.Variable) {
            String name = ((Term.Variable)term).name;
            String renamed = renames.get(name);
            return new Term.Variable(renamed != null ? renamed : name);
        }
        if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            Map<String, String> inner = new HashMap<>(renames);
            String param = lambda.param;
            if (scope.contains(param)) {
                String fresh = Names.freshName(param, avoid);
                avoid.add(fresh);
                inner.put(param, fresh);
                param = fresh;
            } else {
                inner.remove(param);
            }
            return new Term.Lambda(param, alphaConvert(lambda.body, scope, inner, avoid));
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            return new Term.Application(
                alphaConvert(app.left, scope, renames, avoid),
                alphaConvert(app.right, scope, renames, avoid));
        }
        throw LambdaUtil.unknownTerm(term);
    }
}
