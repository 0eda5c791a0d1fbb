package org.csu.sdplot.compiler.parser.ast.atom;

import org.csu.sdplot.catalog.FunctionRegistry;
import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.common.function.Function2D;
import org.csu.sdplot.common.function.Function3D;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.parser.ast.AtomType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 其余原子节点：x 变量、命名变量、数字、内置函数和用户函数。
 */
public class AtomTest {

    private EvaluationContext context;
    private FunctionRegistry registry;

    @BeforeEach
    void setUp() {
        context = EvaluationContext.withDefaults();
        registry = new FunctionRegistry();
    }

    @Test
    void testXVariableAtom() {
        XVariableAtom atom = new XVariableAtom(context);
        context.setX(-7.25);

        assertEquals(-7.25, atom.getValue());
        assertTrue(atom.isVariable());
        assertEquals(AtomType.VARIABLE, atom.getAtomType());
    }

    @Test
    void testNumberAtom() {
        NumberAtom atom = new NumberAtom("4.5e1");

        assertEquals(45.0, atom.getValue());
        assertFalse(atom.isVariable());
        assertEquals(AtomType.NUMBER, atom.getAtomType());
    }

    @Test
    void testMalformedNumberIsInvalidAndFailsOnEvaluation() {
        NumberAtom atom = new NumberAtom("1.2.3");

        assertEquals(AtomType.INVALID, atom.getAtomType());
        assertFalse(atom.isValid());
        ExpressionFormatException e = assertThrows(ExpressionFormatException.class, atom::getValue);
        assertTrue(e.getMessage().contains("1.2.3"));
    }

    @Test
    void testNamedVariableReadsCurrentValue() {
        context.setVariable("a", 2);
        VariableAtom atom = new VariableAtom("a", context);
        assertEquals(2.0, atom.getValue());

        context.setVariable("a", 5);
        assertEquals(5.0, atom.getValue());
        assertFalse(atom.isVariable());
    }

    @Test
    void testUnknownVariableStaysInvalid() {
        VariableAtom atom = new VariableAtom("k", context);
        assertEquals(AtomType.INVALID, atom.getAtomType());

        // 标签在构造时确定，之后再定义变量也不会让节点变得有效
        context.setVariable("k", 1);
        assertThrows(ExpressionFormatException.class, atom::getValue);
    }

    @Test
    void testMathFunctionAtom() {
        MathFunctionAtom sqrt = new MathFunctionAtom("SQRT", new NumberAtom("16"));
        assertEquals(4.0, sqrt.getValue());
        assertFalse(sqrt.isVariable());

        MathFunctionAtom sinOfX = new MathFunctionAtom("sin", new XVariableAtom(context));
        assertTrue(sinOfX.isVariable());
        context.setX(0);
        assertEquals(0.0, sinOfX.getValue());
    }

    @Test
    void testUnknownMathFunctionIsInvalid() {
        MathFunctionAtom atom = new MathFunctionAtom("foo", new NumberAtom("1"));

        assertEquals(AtomType.INVALID, atom.getAtomType());
        assertThrows(ExpressionFormatException.class, atom::getValue);
    }

    @Test
    void testFunctionXAtomDelegatesToRegisteredFunction() {
        Function2D square = mock(Function2D.class);
        when(square.f(3.0)).thenReturn(9.0);
        registry.register("sq", square);

        FunctionXAtom atom = new FunctionXAtom("sq", new NumberAtom("3"), registry);

        assertEquals(AtomType.FUNCTION_X, atom.getAtomType());
        assertEquals(9.0, atom.getValue());
        verify(square).f(3.0);
    }

    @Test
    void testFunctionXYAtom() {
        registry.register("add", (Function3D) (a, b) -> a + b);
        FunctionXYAtom atom = new FunctionXYAtom("add", new XVariableAtom(context), new NumberAtom("1"), registry);
        context.setX(41);

        assertEquals(42.0, atom.getValue());
        assertTrue(atom.isVariable());
    }

    @Test
    void testUnregisteredUserFunctionsAreInvalid() {
        registry.register("one", (Function2D) v -> 1);

        // 只注册了单参数版本，双参数调用无效
        FunctionXYAtom twoArgs = new FunctionXYAtom("one", new NumberAtom("1"), new NumberAtom("2"), registry);
        assertEquals(AtomType.INVALID, twoArgs.getAtomType());
        assertThrows(ExpressionFormatException.class, twoArgs::getValue);

        FunctionXAtom noRegistry = new FunctionXAtom("one", new NumberAtom("1"), null);
        assertEquals(AtomType.INVALID, noRegistry.getAtomType());
    }
}
