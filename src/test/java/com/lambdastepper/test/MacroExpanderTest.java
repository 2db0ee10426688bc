package com.lambdastepper.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import java.util.IdentityHashMap;
import java.util.List;
import org.junit.Test;
import org.junit.BeforeClass;
import com.lambdastepper.lambda.LambdaCalculus;
import com.lambdastepper.lambda.Macro;
import com.lambdastepper.lambda.MacroExpander;
import com.lambdastepper.lambda.MacroExpansion;
import com.lambdastepper.lambda.MacroLabeler;
import com.lambdastepper.lambda.Term;
import com.lambdastepper.lambda.Unparser;

public class MacroExpanderTest {

    @BeforeClass
    public static void beforeAll() {
        LambdaCalculus.silenceParseErrors = true;
    }

    @Test
    public void testNoMacros() {
        assertEquals("x y", MacroExpander.expandMacros("  x y  "));
    }

    @Test
    public void testSimpleExpansion() {
        String src = "I = :x.x\n" +
                     "I y";
        assertEquals("(:x.x) y", MacroExpander.expandMacros(src));
    }

    @Test
    public void testWholeTokensOnly() {
        String src = "I = :x.x\n" +
                     "IF I xI";
        assertEquals("IF (:x.x) xI", MacroExpander.expandMacros(src));
    }

    @Test
    public void testTokenBoundaries() {
        String src = "K = :x y.x\n" +
                     "(K)(:z.K)";
        assertEquals("((:x y.x))(:z.(:x y.x))", MacroExpander.expandMacros(src));
    }

    @Test
    public void testBodiesUseEarlierMacros() {
        String src = "A = :x.x\n" +
                     "B = A A\n" +
                     "B";
        MacroExpansion expansion = MacroExpander.expand(src);
        assertEquals("((:x.x) (:x.x))", expansion.getExpression());
        List<Macro> macros = expansion.getMacros();
        assertEquals(2, macros.size());
        assertEquals("B", macros.get(1).getName());
        assertEquals("(:x.x) (:x.x)", macros.get(1).getBody());
    }

    @Test
    public void testBodiesExpandedWhenDefined() {
        String src = "A = B\n" +
                     "B = :x.x\n" +
                     "A";
        MacroExpansion expansion = MacroExpander.expand(src);
        assertEquals("B", expansion.getMacros().get(0).getBody());
        // the expression still sees B, since macros are applied to it in order
        assertEquals("((:x.x))", expansion.getExpression());
    }

    @Test
    public void testExpressionLinesJoined() {
        String src = "I = :x.x\n" +
                     "I\n" +
                     "\n" +
                     "y";
        assertEquals("(:x.x) y", MacroExpander.expandMacros(src));
    }

    @Test
    public void testMalformedDefinitionsSkipped() {
        String src = "= x\n" +
                     "A =\n" +
                     "I = :x.x\n" +
                     "I";
        MacroExpansion expansion = MacroExpander.expand(src);
        assertEquals(1, expansion.getMacros().size());
        assertEquals("(:x.x)", expansion.getExpression());
    }

    @Test
    public void testOnlyDefinitionsReturnsInput() {
        String src = "I = :x.x\n";
        assertEquals("I = :x.x", MacroExpander.expandMacros(src));
    }

    @Test
    public void testSplitsAtFirstEquals() {
        MacroExpansion expansion = MacroExpander.expand("A = b = c\nA");
        assertEquals("b = c", expansion.getMacros().get(0).getBody());
    }

    @Test
    public void testExpansionIsNotHygienic() {
        // y is free in the body of K1 and is captured by the lambda it lands in
        String src = "K1 = :x.y\n" +
                     ":y.K1";
        Term term = LambdaCalculus.parse(MacroExpander.expandMacros(src));
        assertEquals(":y x.y", Unparser.unparse(term));
    }

    @Test
    public void testLabelerFindsMacroBodies() {
        MacroExpansion expansion = MacroExpander.expand(
            "TRUE = :x y.x\n" +
            "FALSE = :x y.y\n" +
            "NOT = :p.p FALSE TRUE\n" +
            "NOT TRUE");
        MacroLabeler labeler = new MacroLabeler(expansion.getMacros());
        assertEquals(3, labeler.size());

        Term.Application root = (Term.Application)LambdaCalculus.parse(expansion.getExpression());
        IdentityHashMap<Term, String> labels = labeler.label(root);
        assertEquals("NOT", labels.get(root.left));
        assertEquals("TRUE", labels.get(root.right));
        assertFalse(labels.containsKey(root));
        assertEquals("NOT TRUE", Unparser.unparse(labeler.abbreviate(root)));
    }

    @Test
    public void testLabelsAreUpToRenaming() {
        MacroExpansion expansion = MacroExpander.expand("TRUE = :x y.x\nz");
        MacroLabeler labeler = new MacroLabeler(expansion.getMacros());
        assertEquals("TRUE", labeler.labelFor(LambdaCalculus.parse(":a b.a")));
        assertNull(labeler.labelFor(LambdaCalculus.parse(":a b.b")));
    }

    @Test
    public void testFirstMacroWinsOnDuplicates() {
        MacroExpansion expansion = MacroExpander.expand(
            "FALSE = :x y.y\n" +
            "0 = :f x.x\n" +
            "0");
        MacroLabeler labeler = new MacroLabeler(expansion.getMacros());
        assertEquals("FALSE", labeler.labelFor(LambdaCalculus.parse(":f x.x")));
    }

    @Test
    public void testVariablesNeverAbbreviated() {
        MacroExpansion expansion = MacroExpander.expand("V = v\nv w");
        MacroLabeler labeler = new MacroLabeler(expansion.getMacros());
        Term term = LambdaCalculus.parse("v w");
        assertEquals("v w", Unparser.unparse(labeler.abbreviate(term)));
    }

    @Test
    public void testUnparsableMacroBodyHasNoLabel() {
        MacroExpansion expansion = MacroExpander.expand("BAD = (x\nI = :x.x\ny");
        MacroLabeler labeler = new MacroLabeler(expansion.getMacros());
        assertEquals(1, labeler.size());
        assertEquals("I", labeler.labelFor(LambdaCalculus.parse(":q.q")));
    }
}
