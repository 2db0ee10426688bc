package com.lambdastepper.lambda;

import java.util.Collections;
import java.util.List;

public class MacroExpansion {
    private final String expression;
    private final List<Macro> macros;

    MacroExpansion(String expression, List<Macro> macros) {
        this.expression = expression;
        this.macros = Collections.unmodifiableList(macros);
    }

    // the single expression left after all macros were substituted
    public String getExpression() {
        return expression;
    }

    // definitions in the order they appeared
    public List<Macro> getMacros() {
        return macros;
    }
}
