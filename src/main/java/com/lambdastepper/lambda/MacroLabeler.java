package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

/**
 * Recognises sub-expressions that are alpha-equivalent to a macro body.
 * Labels are kept in a side table keyed by node identity; the terms
 * themselves carry no annotations.
 */
public class MacroLabeler {
    private final List<String> names = new ArrayList<>();
    private final List<Term> bodies = new ArrayList<>();

    public MacroLabeler(List<Macro> macros) {
        for (Macro macro : macros) {
            Term body;
            try {
                body = Parser.newFromSource(macro.getBody()).parseAll();
            } catch (ParseError e) {
                LambdaUtil.warn("macro '" + macro.getName() + "' has no label: " + e.getMessage());
                continue;
            }
            names.add(macro.getName());
            bodies.add(body);
        }
    }

    public int size() {
        return names.size();
    }

    /**
     * @return the first macro whose body is alpha-equivalent to term, or null
     */
    public String labelFor(Term term) {
        for (int i = 0; i < bodies.size(); i++) {
            if (AlphaEquivalence.equivalent(term, bodies.get(i))) {
                return names.get(i);
            }
        }
        return null;
    }

    /**
     * Labels every node of the tree that matches a macro.
     */
    public IdentityHashMap<Term, String> label(Term root) {
        IdentityHashMap<Term, String> labels = new IdentityHashMap<>();
        collectLabels(root, labels);
        return labels;
    }

    private void collectLabels(Term term, IdentityHashMap<Term, String> labels) {
        String label = labelFor(term);
        if (label != null) {
            labels.put(term, label);
        }
        if (term instanceof Term.Lambda) {
            collectLabels(((Term.Lambda)term).body, labels);
        } else if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            collectLabels(app.left, labels);
            collectLabels(app.right, labels);
        }
    }

    /**
     * Replaces the outermost matching sub-expressions with variables named
     * after their macro, for display. Variables are never replaced.
     */
    public Term abbreviate(Term term) {
        if (term instanceof Term.Variable) {
            return term;
        }
        String label = labelFor(term);
        if (label != null) {
            return new Term.Variable(label);
        }
        if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            Term body = abbreviate(lambda.body);
            return body == lambda.body ? lambda : new Term.Lambda(lambda.param, body);
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            Term left = abbreviate(app.left);
            Term right = abbreviate(app.right);
            if (left == app.left && right == app.right) {
                return app;
            }
            return new Term.Application(left, right);
        }
        throw LambdaUtil.unknownTerm(term);
    }
}
