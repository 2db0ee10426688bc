package com.lambdastepper.lambda;

// a "NAME = body" line, body already expanded with earlier macros
public class Macro {
    private final String name;
    private final String body;

    Macro(String name, String body) {
        this.name = name;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return name + " = " + body;
    }
}
