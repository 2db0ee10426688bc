package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interprets console input one line at a time. Macro definitions are
 * remembered across expressions; any other line that is not a command is
 * loaded as the expression to reduce.
 */
public class Repl {
    static String helpUsage = "Usage:\n" +
        "  NAME = EXPR        : define a macro\n" +
        "  EXPR               : load an expression (macros are expanded)\n" +
        "  :step     (:s)     : take one reduction step\n" +
        "  :run      (:r) [N] : reduce to normal form, at most N steps\n" +
        "  :back     (:b)     : undo the last step\n" +
        "  :show              : print the current expression\n" +
        "  :tree              : print the current expression as a tree\n" +
        "  :prefix            : print the current expression in prefix notation\n" +
        "  :macros            : list macro definitions\n" +
        "  :examples          : list bundled examples\n" +
        "  :load NAME         : load a bundled example\n" +
        "  :clear             : forget all macro definitions\n" +
        "  :help     (:h)     : show this message\n" +
        "  exit | quit        : leave\n";

    static final List<String> COMMANDS = Arrays.asList(
        ":step", ":s", ":run", ":r", ":back", ":b", ":show", ":tree", ":prefix",
        ":macros", ":examples", ":load", ":clear", ":help", ":h");

    static Pattern runPat = Pattern.compile("^:r(un)?\\s*(\\d*)\\s*$");
    static Pattern loadPat = Pattern.compile("^:load\\s+(.+)$");

    private final Session session;
    private final int maxSteps;
    private final List<String> definitions = new ArrayList<>();

    public Repl(Session session, int maxSteps) {
        this.session = session;
        this.maxSteps = maxSteps;
    }

    public List<String> definitions() {
        return definitions;
    }

    /**
     * @return false when the user asked to leave
     */
    public boolean handle(String rawLine) {
        String line = rawLine.trim();
        if (line.isEmpty()) {
            return true;
        }
        if (line.equals("exit") || line.equals("quit")) {
            return false;
        }
        if (line.startsWith(":") && isCommand(line)) {
            command(line);
            return true;
        }
        if (!session.isPrefix() && line.indexOf('=') != -1) {
            define(line);
            return true;
        }
        load(line);
        return true;
    }

    // ":x.x" is a lambda, ":step" is a command. In prefix notation ":x x"
    // is a lambda too, so only known command names count there.
    private boolean isCommand(String line) {
        String word = line.split("\\s+")[0];
        if (COMMANDS.contains(word)) {
            return true;
        }
        return !session.isPrefix() && line.indexOf('.') == -1;
    }

    private void define(String line) {
        MacroExpansion check = MacroExpander.expand(line + "\n_");
        if (check.getMacros().isEmpty()) {
            session.println("Ignoring malformed definition: " + line);
            return;
        }
        definitions.add(line);
        session.println("Defined " + check.getMacros().get(0).getName());
    }

    private void load(String line) {
        StringBuilder src = new StringBuilder();
        if (!session.isPrefix()) {
            for (String def : definitions) {
                src.append(def).append("\n");
            }
        }
        src.append(line);
        loadSource(src.toString());
    }

    private void loadSource(String src) {
        try {
            session.load(src);
        } catch (ParseError e) {
            session.println("Parse error: " + e.getMessage());
            return;
        }
        session.println("0: " + session.show());
    }

    private void command(String line) {
        Matcher m;
        if (line.equals(":step") || line.equals(":s")) {
            if (!checkLoaded()) return;
            Reduction reduction = session.step();
            if (reduction == null) {
                session.println("Normal form reached.");
            } else {
                session.println(session.stepCount() + ": " + session.show());
            }
        } else if ((m = runPat.matcher(line)).matches()) {
            if (!checkLoaded()) return;
            int limit = maxSteps;
            if (!m.group(2).isEmpty()) {
                try {
                    limit = Integer.parseInt(m.group(2));
                } catch (NumberFormatException e) {
                    session.println("Step count out of range: " + m.group(2));
                    return;
                }
            }
            NormalizationResult result = session.run(limit, true);
            if (result.reachedNormalForm()) {
                session.println("Normal form reached after " + session.stepCount() + " steps.");
            } else {
                session.println("Stopped after " + result.getSteps() + " steps without reaching normal form.");
            }
        } else if (line.equals(":back") || line.equals(":b")) {
            if (!checkLoaded()) return;
            if (session.back()) {
                session.println(session.stepCount() + ": " + session.show());
            } else {
                session.println("Nothing to undo.");
            }
        } else if (line.equals(":show")) {
            if (!checkLoaded()) return;
            session.println(session.stepCount() + ": " + session.show());
        } else if (line.equals(":tree")) {
            if (!checkLoaded()) return;
            session.println(Unparser.tree(session.current()).replaceAll("\n$", ""));
        } else if (line.equals(":prefix")) {
            if (!checkLoaded()) return;
            session.println(Unparser.unparsePrefix(session.current()));
        } else if (line.equals(":macros")) {
            for (String def : definitions) {
                session.println(def);
            }
        } else if (line.equals(":examples")) {
            for (Examples.Example example : Examples.all()) {
                session.println(example.name + " - " + example.description);
            }
            session.println("Encodings:");
            for (Map.Entry<String, String> entry : Examples.encodings().entrySet()) {
                session.println("  " + entry.getKey() + " = " + entry.getValue());
            }
        } else if ((m = loadPat.matcher(line)).matches()) {
            Examples.Example example = Examples.find(m.group(1));
            if (example == null) {
                session.println("No example named '" + m.group(1).trim() + "'.");
                return;
            }
            definitions.clear();
            for (String exampleLine : example.source.split("\n")) {
                if (exampleLine.indexOf('=') != -1) {
                    definitions.add(exampleLine.trim());
                }
            }
            loadSource(example.source);
        } else if (line.equals(":clear")) {
            definitions.clear();
            session.println("Macros cleared.");
        } else if (line.equals(":help") || line.equals(":h")) {
            session.println(helpUsage.replaceAll("\n$", ""));
        } else {
            session.println("Unknown command '" + line + "'. Type :help for a list.");
        }
    }

    private boolean checkLoaded() {
        if (!session.isLoaded()) {
            session.println("No expression loaded.");
            return false;
        }
        return true;
    }
}
