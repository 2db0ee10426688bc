package com.lambdastepper.lambda;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;

import jline.console.ConsoleReader;

/**
 * Entry point: the command-line front end and the static API used by
 * anything that drives the interpreter (renderers, tests, the console).
 */
public class LambdaCalculus {
    public static boolean silenceParseErrors = false;
    public static Map<String, Boolean> debugKeys = new HashMap<>(); // given with -D flag, comma-separated

    static final int DEFAULT_MAX_STEPS = 1000;

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 65;
    static final int EXIT_NO_NORMAL_FORM = 70;

    private static String usage =
        "Usage: lambda [-f FILENAME | -e EXPR] [-p] [-q] [-n MAXSTEPS] [-D KEY,...]";

    public static void main(String[] args) throws IOException {
        String fname = null;
        String expr = null;
        String debugKeysStr = null;
        boolean prefix = false;
        boolean quiet = false;
        int maxSteps = DEFAULT_MAX_STEPS;
        int i = 0;

        while (i < args.length) {
            if (args[i].equals("-f") && i + 1 < args.length) {
                fname = args[i+1];
                i += 2;
            } else if (args[i].equals("-e") && i + 1 < args.length) {
                expr = args[i+1];
                i += 2;
            } else if (args[i].equals("-n") && i + 1 < args.length) {
                try {
                    maxSteps = Integer.parseInt(args[i+1]);
                } catch (NumberFormatException e) {
                    System.err.println("-n expects a number, got '" + args[i+1] + "'");
                    System.exit(1);
                }
                i += 2;
            } else if (args[i].equals("-D") && i + 1 < args.length) {
                debugKeysStr = args[i+1];
                i += 2;
            } else if (args[i].equals("-p")) {
                prefix = true;
                i += 1;
            } else if (args[i].equals("-q")) {
                quiet = true;
                i += 1;
            } else {
                System.err.println(usage);
                System.exit(1);
            }
        }

        if (debugKeysStr != null) {
            String[] keyAry = debugKeysStr.split(",");
            for (String key : keyAry) {
                debugKeys.put(key, true);
            }
        }

        HashMap<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)false);
        opts.put("prefix", (Boolean)prefix);
        Session session = new Session(opts);

        if (fname != null) {
            System.exit(runBatch(session, LambdaUtil.readFile(fname), maxSteps, quiet));
        } else if (expr != null) {
            System.exit(runBatch(session, expr, maxSteps, quiet));
        } else {
            runPrompt(session, maxSteps);
        }
    }

    /**
     * Loads {@code src} and reduces it, printing every step (or only the
     * result when {@code quiet}) through the session.
     *
     * @return the process exit code
     */
    public static int runBatch(Session session, String src, int maxSteps, boolean quiet) {
        try {
            session.load(src);
        } catch (ParseError e) {
            return EXIT_PARSE_ERROR;
        }
        if (!quiet) {
            session.println("0: " + session.show());
        }
        NormalizationResult result = session.run(maxSteps, !quiet);
        if (quiet) {
            session.println(session.show());
        }
        if (!result.reachedNormalForm()) {
            System.err.println("[Warning]: no normal form after " + result.getSteps() + " steps");
            return EXIT_NO_NORMAL_FORM;
        }
        return EXIT_OK;
    }

    private static void runPrompt(Session session, int maxSteps) throws IOException {
        ConsoleReader reader = new ConsoleReader();
        PrintWriter out = new PrintWriter(reader.getOutput());
        reader.setPrompt("> ");
        Repl repl = new Repl(session, maxSteps);

        String line;
        for (;;) {
            line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.equals("cls")) {
                reader.clearScreen();
                out.println(""); // avoid double-prompt at next input
                continue;
            }
            if (!repl.handle(line)) {
                break;
            }
        }
    }

    // -- API --

    /**
     * Parses infix text. Input left over after the first complete expression
     * (an unmatched ')' and what follows) only triggers a warning.
     */
    public static Term parse(String text) {
        Parser parser = Parser.newFromSource(text);
        Term term = parser.parseExpression();
        if (!parser.isAtEnd()) {
            LambdaUtil.warn("remaining unparsed input: " + parser.remaining());
        }
        return term;
    }

    public static Term parseStrict(String text) {
        return Parser.newFromSource(text).parseAll();
    }

    public static Term parsePrefix(String text) {
        return PrefixParser.newFromSource(text).parseAll();
    }

    public static String unparse(Term term) {
        return Unparser.unparse(term);
    }

    public static String unparsePrefix(Term term) {
        return Unparser.unparsePrefix(term);
    }

    public static String expandMacros(String text) {
        return MacroExpander.expandMacros(text);
    }

    /**
     * @return the pending reduction, or null when term is in normal form
     */
    public static Reduction stepReduce(Term term) {
        return Reducer.step(term);
    }

    public static Term collapse(Reduction reduction) {
        return reduction.collapse();
    }

    public static boolean alphaEquivalent(Term a, Term b) {
        return AlphaEquivalence.equivalent(a, b);
    }

    // parse error
    static void error(String message, String remaining) {
        if (!silenceParseErrors) {
            System.err.println("Error: " + message + " at '" + remaining + "'");
        }
    }
}
