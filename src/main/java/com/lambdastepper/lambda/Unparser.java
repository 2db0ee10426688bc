package com.lambdastepper.lambda;

/**
 * Turns terms back into text, in infix notation (the inverse of
 * {@link Parser}), prefix notation (the inverse of {@link PrefixParser}) or
 * an indented tree listing for the console.
 */
public class Unparser {

    public static String unparse(Term term) {
        return infix(term, true);
    }

    public static String unparsePrefix(Term term) {
        return term.accept(new PrefixPrinter());
    }

    public static String tree(Term term) {
        TreePrinter printer = new TreePrinter();
        term.accept(printer);
        return printer.builder.toString();
    }

    // atEnd: nothing follows this term inside its enclosing group, so a
    // lambda can extend to the right without parentheses
    private static String infix(Term term, boolean atEnd) {
        if (term instanceof Term.Variable) {
            return ((Term.Variable)term).name;
        }
        if (term instanceof Term.Lambda) {
            Term.Lambda lambda = (Term.Lambda)term;
            StringBuilder builder = new StringBuilder();
            builder.append(":").append(lambda.param);
            Term body = lambda.body;
            while (body instanceof Term.Lambda) {
                builder.append(" ").append(((Term.Lambda)body).param);
                body = ((Term.Lambda)body).body;
            }
            builder.append(".").append(infix(body, true));
            if (atEnd) {
                return builder.toString();
            }
            return "(" + builder.toString() + ")";
        }
        if (term instanceof Term.Application) {
            Term.Application app = (Term.Application)term;
            String left = infix(app.left, false);
            if (app.right instanceof Term.Application) {
                return left + " (" + infix(app.right, true) + ")";
            }
            return left + " " + infix(app.right, atEnd);
        }
        throw LambdaUtil.unknownTerm(term);
    }

    private static class PrefixPrinter implements Term.Visitor<String> {
        @Override
        public String visitVariableTerm(Term.Variable term) {
            return term.name;
        }

        @Override
        public String visitLambdaTerm(Term.Lambda term) {
            return ":" + term.param + " " + term.body.accept(this);
        }

        @Override
        public String visitApplicationTerm(Term.Application term) {
            return "@ " + term.left.accept(this) + " " + term.right.accept(this);
        }
    }

    private static class TreePrinter implements Term.Visitor<Void> {
        private final StringBuilder builder = new StringBuilder();
        private int indent = 0;

        @Override
        public Void visitVariableTerm(Term.Variable term) {
            builder.append(indent() + term.name + "\n");
            return null;
        }

        @Override
        public Void visitLambdaTerm(Term.Lambda term) {
            builder.append(indent() + "(lambda " + term.param + "\n");
            indent++;
            term.body.accept(this);
            indent--;
            builder.append(indent() + ")\n");
            return null;
        }

        @Override
        public Void visitApplicationTerm(Term.Application term) {
            builder.append(indent() + "(apply\n");
            indent++;
            term.left.accept(this);
            term.right.accept(this);
            indent--;
            builder.append(indent() + ")\n");
            return null;
        }

        private String indent() {
            StringBuilder spaces = new StringBuilder();
            int i = indent;
            while (i > 0) {
                spaces.append("  ");
                i--;
            }
            return spaces.toString();
        }
    }
}
