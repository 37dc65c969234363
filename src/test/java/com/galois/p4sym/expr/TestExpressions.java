package com.galois.p4sym.expr;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.p4sym.BitvectorValue;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.ComplexValue;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.IntValue;
import com.galois.p4sym.engine.ListValue;
import com.galois.p4sym.engine.MapValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramRegistry;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.types.P4Type;
import com.galois.p4sym.types.PrimitiveType;
import com.galois.p4sym.types.StructType;

public class TestExpressions {
    ProgramRegistry registry;
    TermBuilder b;
    ProgramState state;
    Term x;
    Term y;
    Term flag;

    /** Counts how often it is evaluated. */
    static class Probe implements Expression {
        int evaluations;

        public Value evaluate(ProgramState s) {
            ++evaluations;
            return Value.of(true);
        }
    }

    @Before
    public void setUp() {
        registry = new ProgramRegistry();
        b = registry.builder();
        Map<String, P4Type> members = new LinkedHashMap<String, P4Type>();
        members.put("x", PrimitiveType.bits(8));
        members.put("y", PrimitiveType.bits(16));
        members.put("flag", PrimitiveType.BOOL);
        state = registry.newState("ingress", members);
        x = b.freshConstant("ingress_x", Sort.bitvector(8));
        y = b.freshConstant("ingress_y", Sort.bitvector(16));
        flag = b.freshConstant("ingress_flag", Sort.BOOL);
    }

    private Term eval(Expression e) {
        return e.evaluate(state).toTerm(b);
    }

    private static Operand path(String name) {
        return new PathExpression(name);
    }

    @Test
    public void alignedArithmeticTest() {
        Term sum = eval(new BinaryExpression(BinaryOperator.ADD, path("x"), path("y")));
        Assert.assertEquals(b.bvAdd(b.bvZext(x, 16), y), sum);

        Term inc = eval(new BinaryExpression(BinaryOperator.ADD, path("x"), Value.integer(1)));
        Assert.assertEquals(b.bvAdd(x, b.bvLiteral(8, 1)), inc);

        Term quot = eval(new BinaryExpression(BinaryOperator.DIV, path("x"), Value.bits(8, 2)));
        Assert.assertEquals(b.bvUdiv(x, b.bvLiteral(8, 2)), quot);
    }

    @Test
    public void integerLiteralTest() {
        Value v = new BinaryExpression(BinaryOperator.MUL, Value.integer(6), Value.integer(7)).evaluate(state);
        Assert.assertEquals(Value.Kind.INTEGER, v.kind());
        Assert.assertEquals(Value.integer(42), v);

        Value lt = new BinaryExpression(BinaryOperator.LT, Value.integer(6), Value.integer(7)).evaluate(state);
        Assert.assertEquals(Value.of(true), lt);
    }

    @Test
    public void comparisonTest() {
        Assert.assertEquals(Value.of(true), new BinaryExpression(BinaryOperator.GT, Value.bits(8, 3),
                                                                 Value.bits(8, 2)).evaluate(state));
        Assert.assertEquals(b.not(b.eq(x, b.bvLiteral(8, 4))),
                            eval(new BinaryExpression(BinaryOperator.NE, path("x"), Value.integer(4))));
        Assert.assertEquals(b.bvUle(b.bvZext(x, 16), y),
                            eval(new BinaryExpression(BinaryOperator.LE, path("x"), path("y"))));
    }

    @Test
    public void saturatingTest() {
        Assert.assertEquals(new BitvectorValue(8, 255),
                            eval(new BinaryExpression(BinaryOperator.ADD_SAT, Value.bits(8, 250), Value.bits(8, 10))));
        Assert.assertEquals(new BitvectorValue(8, 12),
                            eval(new BinaryExpression(BinaryOperator.ADD_SAT, Value.bits(8, 2), Value.bits(8, 10))));
        Assert.assertEquals(new BitvectorValue(8, 0),
                            eval(new BinaryExpression(BinaryOperator.SUB_SAT, Value.bits(8, 5), Value.bits(8, 10))));
        Assert.assertEquals(new BitvectorValue(8, 5),
                            eval(new BinaryExpression(BinaryOperator.SUB_SAT, Value.bits(8, 15), Value.bits(8, 10))));
    }

    @Test
    public void shortCircuitTest() {
        Probe probe = new Probe();
        Assert.assertEquals(Value.of(false),
                            new BinaryExpression(BinaryOperator.LAND, Value.of(false), probe).evaluate(state));
        Assert.assertEquals(Value.of(true),
                            new BinaryExpression(BinaryOperator.LOR, Value.of(true), probe).evaluate(state));
        Assert.assertEquals(0, probe.evaluations);

        Assert.assertEquals(flag, eval(new BinaryExpression(BinaryOperator.LAND, path("flag"), probe)));
        Assert.assertEquals(1, probe.evaluations);
    }

    @Test
    public void unaryTest() {
        Assert.assertEquals(new BitvectorValue(8, 255),
                            eval(new UnaryExpression(UnaryExpression.Operator.NEG, Value.bits(8, 1))));
        Assert.assertEquals(new BitvectorValue(8, 0xf0),
                            eval(new UnaryExpression(UnaryExpression.Operator.BNOT, Value.bits(8, 0x0f))));
        Assert.assertEquals(b.not(flag), eval(new UnaryExpression(UnaryExpression.Operator.LNOT, path("flag"))));
        Value neg = new UnaryExpression(UnaryExpression.Operator.NEG, Value.integer(5)).evaluate(state);
        Assert.assertEquals(-5, ((IntValue) neg).getValue().intValue());
    }

    @Test
    public void muxTest() {
        Term t = eval(new MuxExpression(path("flag"), path("x"), Value.integer(0)));
        Assert.assertEquals(b.ite(flag, x, b.bvLiteral(8, 0)), t);
    }

    @Test
    public void sliceConcatCastTest() {
        Assert.assertEquals(new BitvectorValue(4, 0xa), eval(new SliceExpression(Value.bits(8, 0xa5), 7, 4)));
        Assert.assertEquals(new BitvectorValue(8, 0xff), eval(new SliceExpression(Value.integer(0x1ff), 8, 1)));
        Assert.assertEquals(b.bvExtract(3, 0, x), eval(new SliceExpression(path("x"), 3, 0)));

        Assert.assertEquals(new BitvectorValue(8, 0xa5),
                            eval(new ConcatExpression(Value.bits(4, 0xa), Value.bits(4, 5))));
        Assert.assertEquals(Sort.bitvector(24), eval(new ConcatExpression(path("x"), path("y"))).sort());

        Assert.assertEquals(new BitvectorValue(16, 1),
                            eval(new CastExpression(PrimitiveType.bits(16), Value.of(true))));
        Assert.assertEquals(b.bvZext(x, 16), eval(new CastExpression(PrimitiveType.bits(16), path("x"))));
    }

    @Test
    public void memberTest() {
        StructType pair = new StructType("pair_t").addField("a", PrimitiveType.bits(8))
            .addField("b", PrimitiveType.bits(8));
        state.declareVar("p", pair.instantiate("p", b));
        MemberExpression pa = new MemberExpression(path("p"), "a");
        Assert.assertEquals("p.a", pa.referenceName(state));
        Assert.assertEquals(b.freshConstant("p.a", Sort.bitvector(8)), eval(pa));
    }

    @Test
    public void indexTest() {
        StructType stack = new StructType("stack_t").addField("0", PrimitiveType.bits(8))
            .addField("1", PrimitiveType.bits(8));
        state.declareVar("s", stack.instantiate("s", b));
        IndexExpression second = new IndexExpression(new PathExpression("s"), Value.integer(1));
        Assert.assertEquals("s.1", second.referenceName(state));

        state.setOrAddVar(second.referenceName(state), Value.integer(9));
        Assert.assertEquals(new BitvectorValue(8, 9), eval(second));
        Assert.assertEquals(b.freshConstant("s.0", Sort.bitvector(8)),
                            eval(new IndexExpression(new PathExpression("s"), Value.bits(8, 0))));
    }

    @Test(expected = UnsupportedValueException.class)
    public void symbolicIndexTest() {
        StructType stack = new StructType("stack_t").addField("0", PrimitiveType.bits(8));
        state.declareVar("s", stack.instantiate("s", b));
        new IndexExpression(new PathExpression("s"), path("x")).evaluate(state);
    }

    @Test
    public void structInitializerTest() {
        StructType pair = new StructType("pair_t").addField("a", PrimitiveType.bits(8))
            .addField("b", PrimitiveType.bits(8));

        Value fromList = new StructInitializer(pair, new ListValue(Arrays.asList(Value.integer(1), Value.integer(2))))
            .evaluate(state);
        Assert.assertEquals(b.structLiteral(pair.sort(), b.bvLiteral(8, 1), b.bvLiteral(8, 2)), fromList.toTerm(b));

        Value fromMap = new StructInitializer(pair, new MapValue(Collections.singletonMap("b", path("x"))))
            .evaluate(state);
        ComplexValue c = (ComplexValue) fromMap;
        Assert.assertEquals(Value.of(b.freshConstant("pair_t.a", Sort.bitvector(8))), c.member("a"));
        Assert.assertEquals(Value.of(x), c.member("b"));
    }
}
