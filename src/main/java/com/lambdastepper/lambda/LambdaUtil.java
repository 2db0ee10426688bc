package com.lambdastepper.lambda;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

class LambdaUtil {
    // characters with a meaning in either notation or in macro definitions
    static final String SYNTAX_CHARS = "():.=@";

    static String readFile(String path) throws IOException {
        byte[] encoded = Files.readAllBytes(Paths.get(path));
        return new String(encoded, StandardCharsets.UTF_8);
    }

    static boolean isIdentifierChar(char c) {
        return !Character.isWhitespace(c) && SYNTAX_CHARS.indexOf(c) == -1;
    }

    // thrown when a Term subclass we don't know reaches an instanceof dispatch
    static IllegalStateException unknownTerm(Term term) {
        String className = term == null ? "null" : term.getClass().getName();
        return new IllegalStateException("unrecognized term type: " + className + ". BUG");
    }

    static void debug(String key, String msg) {
        if (LambdaCalculus.debugKeys.get(key) == (Boolean)true) {
            System.err.println("[DEBUG] (" + key + "): " + msg);
        }
    }

    static void warn(String msg) {
        System.err.println("[Warning]: " + msg);
    }
}
