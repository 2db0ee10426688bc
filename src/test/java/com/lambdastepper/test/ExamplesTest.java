package com.lambdastepper.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.BeforeClass;
import com.lambdastepper.lambda.Examples;
import com.lambdastepper.lambda.LambdaCalculus;
import com.lambdastepper.lambda.NormalizationResult;
import com.lambdastepper.lambda.Reducer;
import com.lambdastepper.lambda.Session;

public class ExamplesTest {

    @BeforeClass
    public static void beforeAll() {
        LambdaCalculus.silenceParseErrors = true;
    }

    private static NormalizationResult runExample(String name, int maxSteps) {
        Examples.Example example = Examples.find(name);
        assertNotNull(name, example);
        Session session = new Session();
        session.load(example.source);
        return session.run(maxSteps, false);
    }

    private static void assertNormalForm(String name, String expected) {
        NormalizationResult result = runExample(name, 20000);
        assertTrue(name, result.reachedNormalForm());
        assertTrue(name + " gave " + LambdaCalculus.unparse(result.getTerm()),
                   LambdaCalculus.alphaEquivalent(LambdaCalculus.parse(expected), result.getTerm()));
    }

    @Test
    public void testIdentity() {
        assertNormalForm("Identity", ":x.x");
    }

    @Test
    public void testOmega() {
        NormalizationResult result = runExample("Omega", 100);
        assertFalse(result.reachedNormalForm());
        assertEquals(100, result.getSteps());
    }

    @Test
    public void testSkiBasis() {
        assertNormalForm("SKI Basis", "a");
    }

    @Test
    public void testPairs() {
        assertNormalForm("Pairs", "a");
    }

    @Test
    public void testBooleanLogic() {
        assertNormalForm("Boolean Logic", ":x y.x");
    }

    @Test
    public void testArithmetic() {
        assertNormalForm("Arithmetic", ":f x.f (f (f (f (f x))))");
    }

    @Test
    public void testConditional() {
        assertNormalForm("Conditional", ":f x.f x");
    }

    @Test
    public void testFactorial() {
        assertNormalForm("Factorial", ":f x.f (f x)");
    }

    @Test
    public void testFindIgnoresCase() {
        assertNotNull(Examples.find("ski basis"));
        assertNotNull(Examples.find("  OMEGA "));
        assertNull(Examples.find("nothing"));
    }

    @Test
    public void testEncodingsParse() {
        Map<String, String> encodings = Examples.encodings();
        assertTrue(encodings.containsKey("Y"));
        for (Map.Entry<String, String> entry : encodings.entrySet()) {
            assertNotNull(entry.getKey(), LambdaCalculus.parseStrict(entry.getValue()));
        }
        assertEquals(":x y.x", Examples.encoding("TRUE"));
    }

    @Test
    public void testEncodingsCompute() {
        Map<String, String> enc = new HashMap<>(Examples.encodings());
        String src = "(" + enc.get("MULT") + ") (" + enc.get("2") + ") (" + enc.get("3") + ")";
        NormalizationResult result = Reducer.normalize(LambdaCalculus.parse(src), 1000);
        assertTrue(result.reachedNormalForm());
        assertTrue(LambdaCalculus.alphaEquivalent(
            LambdaCalculus.parse(":f x.f (f (f (f (f (f x)))))"), result.getTerm()));
    }
}
