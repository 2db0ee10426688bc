package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Stack;

/**
 * A term being reduced step by step, with the history needed to go back.
 * Terms are immutable, so history is just the list of earlier roots.
 */
public class Session {
    public HashMap<String, Object> options = null;
    public StringBuffer printBuf = null;

    private final Stack<Term> history = new Stack<>();
    private MacroExpansion expansion = null;
    private MacroLabeler labeler = null;
    private Term current = null;
    private int steps = 0;

    public Session() {
        HashMap<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)false);
        opts.put("prefix", (Boolean)false);
        this.options = opts;
    }

    public Session(HashMap<String, Object> options) {
        this.options = options;
        if (this.options.get("usePrintBuf") == (Boolean)true) {
            this.printBuf = new StringBuffer();
        }
    }

    /**
     * Expands macros in {@code text}, parses the result and makes it the
     * current term. History and step count start over.
     *
     * @throws ParseError if the expanded text does not parse
     */
    public Term load(String text) {
        Term term;
        if (isPrefix()) {
            expansion = new MacroExpansion(text.trim(), new ArrayList<Macro>());
            PrefixParser parser = PrefixParser.newFromSource(expansion.getExpression());
            term = parser.parseExpression();
            warnTrailing(parser.remaining());
        } else {
            expansion = MacroExpander.expand(text);
            Parser parser = Parser.newFromSource(expansion.getExpression());
            term = parser.parseExpression();
            warnTrailing(parser.remaining());
        }
        labeler = new MacroLabeler(expansion.getMacros());
        history.clear();
        current = term;
        steps = 0;
        return term;
    }

    private void warnTrailing(String remaining) {
        if (!remaining.isEmpty()) {
            LambdaUtil.warn("remaining unparsed input: " + remaining);
        }
    }

    public boolean isLoaded() {
        return current != null;
    }

    /**
     * Takes one reduction step.
     *
     * @return the reduction taken, or null if the current term is in normal form
     */
    public Reduction step() {
        checkLoaded();
        Reduction reduction = Reducer.step(current);
        if (reduction == null) {
            return null;
        }
        history.push(current);
        current = reduction.collapse();
        steps++;
        return reduction;
    }

    /**
     * Steps until normal form or until {@code maxSteps} more steps were
     * taken, printing each intermediate term when {@code trace} is set.
     */
    public NormalizationResult run(int maxSteps, boolean trace) {
        checkLoaded();
        int taken = 0;
        while (taken < maxSteps) {
            if (step() == null) {
                return new NormalizationResult(current, taken, true);
            }
            taken++;
            if (trace) {
                println(steps + ": " + show());
            }
        }
        return new NormalizationResult(current, taken, Reducer.step(current) == null);
    }

    public boolean canGoBack() {
        return !history.isEmpty();
    }

    public boolean back() {
        if (history.isEmpty()) {
            return false;
        }
        current = history.pop();
        steps--;
        return true;
    }

    public Term current() {
        return current;
    }

    public int stepCount() {
        return steps;
    }

    public MacroExpansion expansion() {
        return expansion;
    }

    public IdentityHashMap<Term, String> labels() {
        checkLoaded();
        return labeler.label(current);
    }

    // current term with known macros folded back into their names
    public String show() {
        checkLoaded();
        if (labeler.size() == 0) {
            return format(current);
        }
        return format(labeler.abbreviate(current));
    }

    public String format(Term term) {
        return isPrefix() ? Unparser.unparsePrefix(term) : Unparser.unparse(term);
    }

    public boolean isPrefix() {
        return options.get("prefix") == (Boolean)true;
    }

    void println(String line) {
        if (printBuf != null) {
            printBuf.append(line + "\n");
        } else {
            System.out.println(line);
        }
    }

    private void checkLoaded() {
        if (current == null) {
            throw new IllegalStateException("no expression loaded");
        }
    }
}
