package com.lambdastepper.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.HashMap;
import org.junit.Before;
import org.junit.Test;
import org.junit.BeforeClass;
import com.lambdastepper.lambda.LambdaCalculus;
import com.lambdastepper.lambda.Repl;
import com.lambdastepper.lambda.Session;

public class ReplTest {
    private Session session = null;
    private Repl repl = null;

    @BeforeClass
    public static void beforeAll() {
        LambdaCalculus.silenceParseErrors = true;
    }

    @Before
    public void setUp() {
        session = newSession(false);
        repl = new Repl(session, 100);
    }

    private static Session newSession(boolean prefix) {
        HashMap<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)true);
        opts.put("prefix", (Boolean)prefix);
        return new Session(opts);
    }

    // feeds lines to the console and returns what it printed
    private String run(Repl repl, Session session, String... lines) {
        for (String line : lines) {
            repl.handle(line);
        }
        String output = session.printBuf.toString();
        session.printBuf.setLength(0);
        return output;
    }

    private String run(String... lines) {
        return run(repl, session, lines);
    }

    @Test
    public void testDefineAndStep() {
        assertEquals("Defined I\n", run("I = :x.x"));
        assertEquals("0: I y\n", run("I y"));
        assertEquals("1: y\n", run(":step"));
        assertEquals("Normal form reached.\n", run(":s"));
        assertEquals("0: I y\n", run(":back"));
        assertEquals("Nothing to undo.\n", run(":b"));
    }

    @Test
    public void testRun() {
        run("(:x.x) ((:y.y) z)");
        assertEquals("1: (:y.y) z\n" +
                     "2: z\n" +
                     "Normal form reached after 2 steps.\n",
                     run(":run"));
    }

    @Test
    public void testRunWithLimit() {
        run("(:x.x x) (:x.x x)");
        String output = run(":r 3");
        assertTrue(output.endsWith("Stopped after 3 steps without reaching normal form.\n"));
        assertEquals(4, output.split("\n").length);
    }

    @Test
    public void testRunWithOversizedLimit() {
        run("(:x.x) y");
        assertEquals("Step count out of range: 99999999999\n", run(":run 99999999999"));
        assertEquals(0, session.stepCount());
        assertEquals("1: y\n" +
                     "Normal form reached after 1 steps.\n",
                     run(":r"));
    }

    @Test
    public void testShowTreeAndPrefix() {
        run("(:x.x) y");
        assertEquals("0: (:x.x) y\n", run(":show"));
        assertEquals("@ :x x y\n", run(":prefix"));
        assertEquals("(apply\n" +
                     "  (lambda x\n" +
                     "    x\n" +
                     "  )\n" +
                     "  y\n" +
                     ")\n",
                     run(":tree"));
    }

    @Test
    public void testCommandsNeedAnExpression() {
        assertEquals("No expression loaded.\n", run(":step"));
        assertEquals("No expression loaded.\n", run(":run"));
    }

    @Test
    public void testLambdaIsNotACommand() {
        assertEquals("0: :x.x\n", run(":x.x"));
    }

    @Test
    public void testUnknownCommand() {
        assertEquals("Unknown command ':foo'. Type :help for a list.\n", run(":foo"));
    }

    @Test
    public void testMalformedDefinition() {
        assertEquals("Ignoring malformed definition: = x\n", run("= x"));
        assertTrue(repl.definitions().isEmpty());
    }

    @Test
    public void testMacrosAndClear() {
        run("TRUE = :x y.x", "FALSE = :x y.y");
        assertEquals("TRUE = :x y.x\n" +
                     "FALSE = :x y.y\n",
                     run(":macros"));
        assertEquals("Macros cleared.\n", run(":clear"));
        assertEquals("", run(":macros"));
        assertEquals("0: TRUE\n", run("TRUE"));
    }

    @Test
    public void testParseError() {
        assertTrue(run("(x").startsWith("Parse error: "));
    }

    @Test
    public void testLoadExample() {
        assertEquals("0: (:x.x) :x.x\n", run(":load identity"));
        assertEquals("0: S K K a\n", run(":load SKI Basis"));
        assertEquals(2, repl.definitions().size());
        assertEquals("No example named 'nothing'.\n", run(":load nothing"));
    }

    @Test
    public void testExamplesListed() {
        String output = run(":examples");
        assertTrue(output.contains("Factorial - "));
        assertTrue(output.contains("  TRUE = :x y.x\n"));
    }

    @Test
    public void testExit() {
        assertTrue(repl.handle(""));
        assertFalse(repl.handle("exit"));
        assertFalse(repl.handle("quit"));
    }

    @Test
    public void testPrefixMode() {
        Session prefixSession = newSession(true);
        Repl prefixRepl = new Repl(prefixSession, 100);
        assertEquals("0: :x x\n", run(prefixRepl, prefixSession, ":x x"));
        assertEquals("0: @ :x x y\n", run(prefixRepl, prefixSession, "@ :x x y"));
        assertEquals("1: y\n", run(prefixRepl, prefixSession, ":s"));
    }
}
