package org.csu.sdplot.compiler;

import org.csu.sdplot.catalog.FunctionRegistry;
import org.csu.sdplot.common.exception.ParseException;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.lexer.Lexer;
import org.csu.sdplot.compiler.lexer.TokenType;
import org.csu.sdplot.compiler.parser.Parser;
import org.csu.sdplot.compiler.parser.ast.AtomType;
import org.csu.sdplot.compiler.parser.ast.TreeElement;
import org.csu.sdplot.compiler.parser.ast.atom.FunctionXAtom;
import org.csu.sdplot.compiler.parser.ast.atom.FunctionXYAtom;
import org.csu.sdplot.compiler.parser.ast.atom.MathFunctionAtom;
import org.csu.sdplot.compiler.parser.ast.atom.VariableAtom;
import org.csu.sdplot.compiler.parser.ast.atom.YVariableAtom;
import org.csu.sdplot.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.sdplot.compiler.parser.ast.expression.UnaryExpressionNode;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * @description: Parser 类的单元测试 (使用 JUnit 4)
 */
public class ParserTest {

    private static final double DELTA = 1e-12;

    private EvaluationContext context;
    private FunctionRegistry registry;

    @Before
    public void setUp() {
        context = EvaluationContext.withDefaults();
        registry = new FunctionRegistry();
    }

    private TreeElement parse(String expr) {
        System.out.println("Input expression: " + expr);
        Parser parser = new Parser(new Lexer(expr).tokenize(), context, registry);
        TreeElement tree = parser.parse();
        System.out.println("Generated tree: " + tree);
        return tree;
    }

    @Test
    public void testPrecedenceOfMultiplicationOverAddition() {
        System.out.println("--- Running test: testPrecedenceOfMultiplicationOverAddition ---");
        TreeElement tree = parse("1 + 2 * 3");

        assertTrue(tree instanceof BinaryExpressionNode);
        BinaryExpressionNode root = (BinaryExpressionNode) tree;
        assertEquals(TokenType.PLUS, root.operator().type());
        assertTrue(root.right() instanceof BinaryExpressionNode);
        assertEquals(TokenType.ASTERISK, ((BinaryExpressionNode) root.right()).operator().type());
        assertEquals(7.0, tree.getValue(), DELTA);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testSubtractionAndDivisionAreLeftAssociative() {
        assertEquals(5.0, parse("10 - 3 - 2").getValue(), DELTA);
        assertEquals(2.5, parse("20 / 4 / 2").getValue(), DELTA);
    }

    @Test
    public void testPowerIsRightAssociative() {
        assertEquals(512.0, parse("2^3^2").getValue(), DELTA);
    }

    @Test
    public void testPowerBindsTighterThanUnaryMinus() {
        TreeElement tree = parse("-2^2");

        assertTrue(tree instanceof UnaryExpressionNode);
        assertEquals(-4.0, tree.getValue(), DELTA);
        assertEquals(0.25, parse("2^-2").getValue(), DELTA);
    }

    @Test
    public void testParentheses() {
        assertEquals(9.0, parse("(1 + 2) * 3").getValue(), DELTA);
        assertEquals(-1.0, parse("-(((1)))").getValue(), DELTA);
    }

    @Test
    public void testYTokenBuildsYVariableAtom() {
        TreeElement tree = parse("y");

        assertTrue(tree instanceof YVariableAtom);
        context.setY(6.5);
        assertEquals(6.5, tree.getValue(), DELTA);
    }

    @Test
    public void testIdentifierResolution() {
        assertTrue(parse("sin(x)") instanceof MathFunctionAtom);
        assertTrue(parse("pi") instanceof VariableAtom);

        TreeElement unknownUnary = parse("f(x)");
        assertTrue(unknownUnary instanceof FunctionXAtom);
        assertEquals(AtomType.INVALID, ((FunctionXAtom) unknownUnary).getAtomType());

        TreeElement unknownBinary = parse("g(x, y)");
        assertTrue(unknownBinary instanceof FunctionXYAtom);
        assertEquals(AtomType.INVALID, ((FunctionXYAtom) unknownBinary).getAtomType());
    }

    @Test
    public void testUnknownVariableIsNotASyntaxError() {
        TreeElement tree = parse("k + 1");

        BinaryExpressionNode root = (BinaryExpressionNode) tree;
        assertEquals(AtomType.INVALID, ((VariableAtom) root.left()).getAtomType());
    }

    @Test(expected = ParseException.class)
    public void testIncompleteExpression() {
        parse("1 +");
    }

    @Test(expected = ParseException.class)
    public void testUnclosedParenthesis() {
        parse("(1 + 2");
    }

    @Test(expected = ParseException.class)
    public void testEmptyInput() {
        parse("");
    }

    @Test(expected = ParseException.class)
    public void testTrailingTokens() {
        parse("2 3");
    }

    @Test(expected = ParseException.class)
    public void testTooManyArguments() {
        parse("f(1, 2, 3)");
    }

    @Test(expected = ParseException.class)
    public void testIllegalCharacter() {
        parse("x # 2");
    }

    @Test
    public void testErrorMessageCarriesPosition() {
        try {
            parse("1 + )");
            fail("Expected a ParseException");
        } catch (ParseException e) {
            System.out.println("Caught expected error: " + e.getMessage());
            assertTrue(e.getMessage().contains("line 1, column 5"));
            assertTrue(e.getMessage().contains("')'"));
        }
    }

    private TreeElement parseQuietly(String expr) {
        return new Parser(new Lexer(expr).tokenize(), context, registry).parse();
    }

    @Test
    public void testNestingWithinLimitIsAccepted() {
        context.setX(3);
        assertEquals(3.0, parseQuietly("(".repeat(100) + "x" + ")".repeat(100)).getValue(), DELTA);
        assertEquals(2.0, parseQuietly("-".repeat(100) + "2").getValue(), DELTA);
        assertEquals(101.0, parseQuietly("1" + "+1".repeat(100)).getValue(), DELTA);
    }

    @Test(expected = ParseException.class)
    public void testDeepUnarySignsAreRejected() {
        parseQuietly("-".repeat(200000) + "1");
    }

    @Test(expected = ParseException.class)
    public void testDeepParenthesesAreRejected() {
        parseQuietly("(".repeat(200000) + "1" + ")".repeat(200000));
    }

    @Test(expected = ParseException.class)
    public void testDeepFunctionCallsAreRejected() {
        parseQuietly("sin(".repeat(Parser.MAX_DEPTH + 1) + "x" + ")".repeat(Parser.MAX_DEPTH + 1));
    }

    @Test
    public void testLongOperatorChainIsRejected() {
        System.out.println("--- Test: operator chain deeper than the tree limit ---");
        try {
            parseQuietly("1" + "+1".repeat(Parser.MAX_DEPTH));
            fail("Expected ParseException");
        } catch (ParseException e) {
            System.out.println("Caught expected exception: " + e.getMessage());
            assertTrue(e.getMessage().contains("nested more than " + Parser.MAX_DEPTH + " levels"));
        }
    }
}
