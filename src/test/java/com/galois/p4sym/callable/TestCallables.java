package com.galois.p4sym.callable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.p4sym.EvaluatorOptions;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramRegistry;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.expr.BinaryExpression;
import com.galois.p4sym.expr.BinaryOperator;
import com.galois.p4sym.expr.MethodCallExpression;
import com.galois.p4sym.expr.PathExpression;
import com.galois.p4sym.expr.SliceExpression;
import com.galois.p4sym.stmt.AssignmentStatement;
import com.galois.p4sym.stmt.BlockStatement;
import com.galois.p4sym.stmt.ExitStatement;
import com.galois.p4sym.stmt.IfStatement;
import com.galois.p4sym.stmt.MethodCallStatement;
import com.galois.p4sym.stmt.ReturnStatement;
import com.galois.p4sym.types.P4Type;
import com.galois.p4sym.types.PrimitiveType;

public class TestCallables {
    static final P4Type BIT8 = PrimitiveType.bits(8);

    ProgramRegistry registry;
    TermBuilder b;
    BlockStatement body;
    Control ingress;
    Sort formulaSort;
    Term x;
    Term y;

    /** Records whether a name is bound when it runs, and the open calls. */
    static class BindingProbe implements Statement {
        final String var;
        Boolean bound;
        int depth = -1;

        BindingProbe(String var) {
            this.var = var;
        }

        public Term execute(ProgramState state) {
            bound = state.hasVar(var);
            depth = state.getCallDepth();
            return null;
        }
    }

    @Before
    public void setUp() {
        registry = new ProgramRegistry();
        setUp(registry);
    }

    private void setUp(ProgramRegistry r) {
        registry = r;
        b = registry.builder();
        body = new BlockStatement();
        ingress = new Control("ingress", body);
        ingress.addParameter(Direction.INOUT, "x", BIT8);
        ingress.addParameter(Direction.INOUT, "y", BIT8);
        Map<String, P4Type> members = new LinkedHashMap<String, P4Type>();
        members.put("x", BIT8);
        members.put("y", BIT8);
        formulaSort = registry.newState("ingress", members).formulaSort();
        x = b.freshConstant("ingress_x", Sort.bitvector(8));
        y = b.freshConstant("ingress_y", Sort.bitvector(8));
    }

    private Term formula(Term xv, Term yv) {
        return b.structLiteral(formulaSort, xv, yv);
    }

    private Term bits(long v) {
        return b.bvLiteral(8, v);
    }

    private static Operand path(String name) {
        return new PathExpression(name);
    }

    private static Statement assign(String var, Operand v) {
        return new AssignmentStatement(path(var), v);
    }

    private static Statement call(String callee, Operand... args) {
        return new MethodCallStatement(new MethodCallExpression(callee, args));
    }

    @Test
    public void inParameterTest() {
        Action a = new Action("A", new BlockStatement(assign("y", path("v"))));
        a.addParameter(Direction.IN, "v", BIT8);
        registry.declare("A", a);
        BindingProbe probe = new BindingProbe("v");
        body.add(call("A", Value.integer(5))).add(probe);

        Assert.assertEquals(formula(x, bits(5)), ingress.evaluate(registry));
        Assert.assertEquals(Boolean.FALSE, probe.bound);
        Assert.assertEquals(1, a.getCallCounter());
        Assert.assertEquals(0, probe.depth);
    }

    @Test
    public void shadowedParameterTest() {
        Action a = new Action("A", new BlockStatement(assign("x", path("x"))));
        a.addParameter(Direction.IN, "x", BIT8);
        registry.declare("A", a);
        body.add(call("A", Value.integer(3)));

        // The parameter shadows the caller's x and is dropped afterwards.
        Assert.assertEquals(formula(x, y), ingress.evaluate(registry));
    }

    @Test
    public void outParameterTest() {
        Action a = new Action("A", new BlockStatement(assign("p", Value.integer(3))));
        a.addParameter(Direction.OUT, "p", BIT8);
        registry.declare("A", a);
        body.add(call("A", path("x")));

        Assert.assertEquals(formula(bits(3), y), ingress.evaluate(registry));
    }

    @Test
    public void unassignedOutParameterTest() {
        Action a = new Action("A", new BlockStatement());
        a.addParameter(Direction.OUT, "p", BIT8);
        registry.declare("A", a);
        body.add(call("A", path("x")));

        Term p = b.freshConstant("p", Sort.bitvector(8));
        Assert.assertEquals(formula(p, y), ingress.evaluate(registry));
    }

    @Test
    public void sliceOutParameterTest() {
        Action a = new Action("A", new BlockStatement(assign("p", Value.integer(0xa))));
        a.addParameter(Direction.OUT, "p", PrimitiveType.bits(4));
        registry.declare("A", a);
        body.add(assign("x", Value.integer(0x05)))
            .add(call("A", new SliceExpression(path("x"), 7, 4)));

        Assert.assertEquals(formula(bits(0xa5), y), ingress.evaluate(registry));
    }

    @Test
    public void inoutParameterTest() {
        Action a = new Action("A", new BlockStatement(
            assign("v", new BinaryExpression(BinaryOperator.ADD, path("v"), Value.integer(1)))));
        a.addParameter(Direction.INOUT, "v", BIT8);
        registry.declare("A", a);
        body.add(assign("x", Value.integer(4))).add(call("A", path("x"))).add(assign("y", path("x")));

        Assert.assertEquals(formula(bits(5), bits(5)), ingress.evaluate(registry));
    }

    @Test
    public void functionTest() {
        Function f = new Function("f", BIT8, new BlockStatement(
            assign("x", Value.integer(99)),
            new ReturnStatement(new BinaryExpression(BinaryOperator.ADD, path("a"), Value.integer(1)))));
        f.addParameter(Direction.IN, "a", BIT8);
        registry.declare("f", f);
        body.add(assign("x", Value.integer(2)))
            .add(assign("y", new MethodCallExpression("f", path("x"))));

        Assert.assertEquals(formula(bits(2), bits(3)), ingress.evaluate(registry));
        Assert.assertFalse(f.consumesContinuation());
    }

    @Test(expected = MalformedProgramException.class)
    public void functionWithoutReturnTest() {
        Function f = new Function("f", BIT8, new BlockStatement(assign("x", Value.integer(1))));
        registry.declare("f", f);
        body.add(assign("y", new MethodCallExpression("f")));
        ingress.evaluate(registry);
    }

    @Test
    public void externReturnTest() {
        Extern hash = new Extern("hash", PrimitiveType.bits(16));
        hash.addParameter(Direction.IN, "a", BIT8);
        registry.declare("hash", hash);
        body.add(assign("y", new MethodCallExpression("hash", path("x"))));

        Term h = b.freshConstant("hash_ingress_x", Sort.bitvector(16));
        Assert.assertEquals(formula(x, b.bvExtract(7, 0, h)), ingress.evaluate(registry));
    }

    @Test
    public void externNameTest() {
        List<Value> inputs = Arrays.asList(Value.bits(8, 5), Value.of(b.freshConstant("k", Sort.bitvector(8))));
        Assert.assertEquals("hash_0x5:[8]_k", Extern.returnName("hash", inputs, b));
        Assert.assertEquals("hash", Extern.returnName("hash", Collections.<Value>emptyList(), b));
    }

    @Test
    public void externOutTest() {
        Extern rand = new Extern("rand");
        rand.addParameter(Direction.OUT, "r", BIT8);
        Extern counter = new Extern("counter");
        counter.addMethod("count", rand);
        registry.declare("counter", counter);
        body.add(call("counter.count", path("x"))).add(assign("y", Value.integer(1)));

        Term r = b.freshConstant("rand_r", Sort.bitvector(8));
        Assert.assertEquals(formula(r, bits(1)), ingress.evaluate(registry));
        Assert.assertFalse(rand.consumesContinuation());
    }

    @Test
    public void controlNestingTest() {
        Control inner = new Control("inner", new BlockStatement(
            assign("v", new BinaryExpression(BinaryOperator.ADD, path("v"), Value.integer(1)))));
        inner.addParameter(Direction.INOUT, "v", BIT8);
        registry.declare("inner", inner);
        body.add(assign("x", Value.integer(1)))
            .add(call("inner.apply", path("x")))
            .add(assign("y", path("x")));

        Assert.assertEquals(formula(bits(2), bits(2)), ingress.evaluate(registry));
    }

    @Test
    public void exitInNestedControlTest() {
        Control inner = new Control("inner", new BlockStatement(ExitStatement.INSTANCE));
        inner.addParameter(Direction.INOUT, "v", BIT8);
        registry.declare("inner", inner);
        body.add(assign("y", Value.integer(3)))
            .add(call("inner.apply", path("x")))
            .add(assign("x", Value.integer(9)));

        Term result = ingress.evaluate(registry);
        Assert.assertEquals(formulaSort, result.sort());
        Assert.assertEquals(formula(x, bits(3)), result);
    }

    @Test
    public void conditionalExitInNestedControlTest() {
        // inner(inout v) { if (v == 1) exit; v = v + 1; }
        Control inner = new Control("inner", new BlockStatement(
            new IfStatement(new BinaryExpression(BinaryOperator.EQ, path("v"), Value.integer(1)),
                            ExitStatement.INSTANCE, null),
            assign("v", new BinaryExpression(BinaryOperator.ADD, path("v"), Value.integer(1)))));
        inner.addParameter(Direction.INOUT, "v", BIT8);
        registry.declare("inner", inner);
        body.add(call("inner.apply", path("x"))).add(assign("y", Value.integer(7)));

        Term expected = b.ite(b.eq(x, bits(1)),
                              formula(x, y),
                              formula(b.bvAdd(x, bits(1)), bits(7)));
        Assert.assertEquals(expected, ingress.evaluate(registry));
    }

    @Test
    public void exitInActionTest() {
        // The action's parameter shadows x; exit still restores the binding.
        Action a = new Action("A", new BlockStatement(ExitStatement.INSTANCE));
        a.addParameter(Direction.IN, "x", BIT8);
        registry.declare("A", a);
        body.add(call("A", Value.integer(4))).add(assign("y", Value.integer(1)));

        Assert.assertEquals(formula(x, y), ingress.evaluate(registry));
    }

    @Test
    public void parserOutTest() {
        Parser prs = new Parser("prs", new BlockStatement(assign("v", Value.integer(7))));
        prs.addParameter(Direction.OUT, "v", BIT8);
        registry.declare("prs", prs);
        body.add(call("prs.apply", path("y")));

        Assert.assertEquals(formula(x, bits(7)), ingress.evaluate(registry));
    }

    @Test(expected = MalformedProgramException.class)
    public void maxCallDepthTest() {
        setUp(new ProgramRegistry(new EvaluatorOptions().setMaxCallDepth(2)));
        BlockStatement loopBody = new BlockStatement();
        Action loop = new Action("loop", loopBody);
        loopBody.add(call("loop"));
        registry.declare("loop", loop);
        body.add(call("loop"));
        ingress.evaluate(registry);
    }

    @Test
    public void sequentialCallsTest() {
        Action a = new Action("A", new BlockStatement(
            assign("x", new BinaryExpression(BinaryOperator.ADD, path("x"), Value.integer(1)))));
        registry.declare("A", a);
        BindingProbe probe = new BindingProbe("x");
        body.add(assign("x", Value.integer(0)));
        for (int i = 0; i != 300; ++i) {
            body.add(call("A"));
        }
        body.add(probe);

        Assert.assertEquals(formula(bits(300 % 256), y), ingress.evaluate(registry));
        Assert.assertEquals(300, a.getCallCounter());
        Assert.assertEquals(0, probe.depth);
    }

    @Test
    public void mergeParametersTest() {
        Action a = new Action("A", new BlockStatement());
        a.addParameter(Direction.IN, "a", BIT8);
        a.addParameter(Direction.IN, "b", BIT8);

        List<BoundArgument> bound = a.mergeParameters(Arrays.<Operand>asList(Value.integer(1)),
                                                      Collections.<String, Operand>singletonMap("b", Value.integer(2)));
        Assert.assertEquals(2, bound.size());
        Assert.assertEquals("a", bound.get(0).getParameter().getName());
        Assert.assertEquals("b", bound.get(1).getParameter().getName());

        Map<String, Operand> none = Collections.emptyMap();
        try {
            a.mergeParameters(Arrays.<Operand>asList(Value.integer(1), Value.integer(2), Value.integer(3)), none);
            Assert.fail("surplus argument accepted");
        } catch (MalformedProgramException e) {
            // expected
        }
        try {
            a.mergeParameters(Collections.<Operand>emptyList(),
                              Collections.<String, Operand>singletonMap("c", Value.integer(1)));
            Assert.fail("unknown parameter accepted");
        } catch (MalformedProgramException e) {
            // expected
        }
        try {
            a.mergeParameters(Arrays.<Operand>asList(Value.integer(1)),
                              Collections.<String, Operand>singletonMap("a", Value.integer(1)));
            Assert.fail("repeated parameter accepted");
        } catch (MalformedProgramException e) {
            // expected
        }
    }
}
