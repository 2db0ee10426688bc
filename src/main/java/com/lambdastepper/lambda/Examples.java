package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Church encodings and example programs bundled with the console.
 */
public class Examples {
    public static class Example {
        public final String name;
        public final String description;
        public final String source; // possibly multi-line, with macros

        Example(String name, String description, String source) {
            this.name = name;
            this.description = description;
            this.source = source;
        }
    }

    private static final Map<String, String> encodings = new LinkedHashMap<>();
    private static final List<Example> examples = new ArrayList<>();

    static {
        // booleans
        encodings.put("TRUE", ":x y.x");
        encodings.put("FALSE", ":x y.y");
        encodings.put("AND", ":p q.p q p");
        encodings.put("OR", ":p q.p p q");
        encodings.put("NOT", ":p.p (:x y.y) (:x y.x)");
        encodings.put("IF", ":p a b.p a b");

        // numerals and arithmetic
        encodings.put("0", ":f x.x");
        encodings.put("1", ":f x.f x");
        encodings.put("2", ":f x.f (f x)");
        encodings.put("3", ":f x.f (f (f x))");
        encodings.put("SUCC", ":n f x.f (n f x)");
        encodings.put("PLUS", ":m n f x.m f (n f x)");
        encodings.put("MULT", ":m n f.m (n f)");

        // pairs
        encodings.put("PAIR", ":a b f.f a b");
        encodings.put("FST", ":p.p (:x y.x)");
        encodings.put("SND", ":p.p (:x y.y)");

        // combinators
        encodings.put("I", ":x.x");
        encodings.put("K", ":x y.x");
        encodings.put("S", ":x y z.x z (y z)");
        encodings.put("omega", ":x.x x");
        encodings.put("Y", ":f.(:x.f (x x)) (:x.f (x x))");

        examples.add(new Example("Identity",
            "Identity applied to itself, reduces to :x.x",
            "(:x.x) (:x.x)"));
        examples.add(new Example("Omega",
            "Self-application, every step reproduces the same expression",
            "(:x.x x) (:x.x x)"));
        examples.add(new Example("SKI Basis",
            "S K K is the identity, so S K K a reduces to a",
            lines(
                "S = :x y z.x z (y z)",
                "K = :x y.x",
                "S K K a")));
        examples.add(new Example("Pairs",
            "FST (PAIR a b) reduces to a",
            lines(
                "PAIR = :a b f.f a b",
                "FST = :p.p (:x y.x)",
                "SND = :p.p (:x y.y)",
                "FST (PAIR a b)")));
        examples.add(new Example("Boolean Logic",
            "NOT (AND TRUE FALSE) reduces to TRUE",
            lines(
                "TRUE = :x y.x",
                "FALSE = :x y.y",
                "NOT = :p.p FALSE TRUE",
                "AND = :p q.p q p",
                "OR = :p q.p p q",
                "NOT (AND TRUE FALSE)")));
        examples.add(new Example("Arithmetic",
            "Church numeral addition, + 2 3 reduces to 5",
            lines(
                "0 = :f x.x",
                "1 = :f x.f x",
                "2 = :f x.f (f x)",
                "3 = :f x.f (f (f x))",
                "4 = :f x.f (f (f (f x)))",
                "5 = :f x.f (f (f (f (f x))))",
                "SUCC = :n f x.f (n f x)",
                "+ = :m n f x.m f (n f x)",
                "PRED = :n f x.n (:g h.h (g f)) (:u.x) (:u.u)",
                "- = :m n.n PRED m",
                "MULT = :m n f.m (n f)",
                "EXP = :b e.e b",
                "+ 2 3")));
        examples.add(new Example("Conditional",
            "IF (ISZERO 0) 1 2 reduces to 1",
            lines(
                "TRUE = :x y.x",
                "FALSE = :x y.y",
                "0 = :f x.x",
                "1 = :f x.f x",
                "2 = :f x.f (f x)",
                "ISZERO = :n.n (:x.FALSE) TRUE",
                "IF = :p a b.p a b",
                "IF (ISZERO 0) 1 2")));
        examples.add(new Example("Factorial",
            "Y combinator factorial, FACT 2 reduces to 2 after many steps",
            lines(
                "TRUE = :x y.x",
                "FALSE = :x y.y",
                "0 = :f x.x",
                "1 = :f x.f x",
                "2 = :f x.f (f x)",
                "IF = :p a b.p a b",
                "ISZERO = :n.n (:x.FALSE) TRUE",
                "MULT = :m n f.m (n f)",
                "PRED = :n f x.n (:g h.h (g f)) (:u.x) (:u.u)",
                "Y = :f.(:x.f (x x)) (:x.f (x x))",
                "FACT = Y (:f n.IF (ISZERO n) 1 (MULT n (f (PRED n))))",
                "FACT 2")));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    public static Map<String, String> encodings() {
        return Collections.unmodifiableMap(encodings);
    }

    public static String encoding(String name) {
        return encodings.get(name);
    }

    public static List<Example> all() {
        return Collections.unmodifiableList(examples);
    }

    // case-insensitive lookup by example name
    public static Example find(String name) {
        for (Example example : examples) {
            if (example.name.equalsIgnoreCase(name.trim())) {
                return example;
            }
        }
        return null;
    }
}
