package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented textual macros.
 *
 * <pre>
 *   TRUE = :x y.x
 *   NOT = :p.p FALSE TRUE
 *   NOT TRUE
 * </pre>
 *
 * A line with '=' defines a macro (split at the first '='), other lines
 * make up the expression. Bodies may use macros defined above them.
 * Expansion is purely textual and knows nothing about binding, so a free
 * identifier in a macro body can be captured where it is pasted.
 */
public class MacroExpander {
    // whole-token boundary on either side of a macro name
    private static final String BEFORE = "(?<=^|[\\s():.=])";
    private static final String AFTER = "(?=$|[\\s():.=])";

    public static String expandMacros(String input) {
        return expand(input).getExpression();
    }

    public static MacroExpansion expand(String input) {
        String[] lines = input.split("\n");
        List<Macro> macros = new ArrayList<>();
        List<String> exprLines = new ArrayList<>();

        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty()) continue;

            int eqIndex = line.indexOf('=');
            if (eqIndex == -1) {
                exprLines.add(line);
                continue;
            }
            String name = line.substring(0, eqIndex).trim();
            String body = line.substring(eqIndex + 1).trim();
            if (name.isEmpty() || body.isEmpty()) {
                LambdaUtil.debug("macro", "skipping malformed definition '" + line + "'");
                continue;
            }
            for (Macro macro : macros) {
                body = expandInString(body, macro.getName(), macro.getBody());
            }
            LambdaUtil.debug("macro", "defined " + name);
            macros.add(new Macro(name, body));
        }

        if (macros.isEmpty() || exprLines.isEmpty()) {
            return new MacroExpansion(input.trim(), macros);
        }

        String expr = String.join(" ", exprLines);
        for (Macro macro : macros) {
            expr = expandInString(expr, macro.getName(), macro.getBody());
        }
        return new MacroExpansion(expr, macros);
    }

    /**
     * Replaces every whole-token occurrence of {@code name} in {@code str}
     * with {@code (body)}.
     */
    public static String expandInString(String str, String name, String body) {
        Pattern pattern = Pattern.compile(BEFORE + Pattern.quote(name) + AFTER);
        Matcher matcher = pattern.matcher(str);
        return matcher.replaceAll(Matcher.quoteReplacement("(" + body + ")"));
    }
}
