package com.lambdastepper.lambda;

/**
 * A lambda calculus term. Terms are immutable: reduction builds a new tree
 * that shares untouched subtrees with the old one, so node identity is
 * stable for everything a step did not rewrite.
 *
 * Equality is identity. Use {@link AlphaEquivalence} to compare terms.
 */
public abstract class Term {
    public interface Visitor<R> {
        R visitVariableTerm(Variable term);
        R visitLambdaTerm(Lambda term);
        R visitApplicationTerm(Application term);
    }

    public static class Variable extends Term {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableTerm(this);
        }
    }

    public static class Lambda extends Term {
        public final String param;
        public final Term body;

        public Lambda(String param, Term body) {
            this.param = param;
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambdaTerm(this);
        }
    }

    public static class Application extends Term {
        public final Term left;
        public final Term right;

        public Application(Term left, Term right) {
            this.left = left;
            this.right = right;
        }

        // redex: (:x.body) arg
        public boolean isRedex() {
            return left instanceof Lambda;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApplicationTerm(this);
        }
    }

    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public String toString() {
        return Unparser.unparse(this);
    }
}
