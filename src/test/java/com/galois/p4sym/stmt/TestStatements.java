package com.galois.p4sym.stmt;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.MissingNodeException;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Engine;
import com.galois.p4sym.engine.ProgramRegistry;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.expr.BinaryExpression;
import com.galois.p4sym.expr.BinaryOperator;
import com.galois.p4sym.expr.PathExpression;
import com.galois.p4sym.expr.SliceExpression;
import com.galois.p4sym.types.P4Type;
import com.galois.p4sym.types.PrimitiveType;

public class TestStatements {
    ProgramRegistry registry;
    TermBuilder b;
    ProgramState state;
    Term x;
    Term y;

    @Before
    public void setUp() {
        registry = new ProgramRegistry();
        b = registry.builder();
        Map<String, P4Type> members = new LinkedHashMap<String, P4Type>();
        members.put("x", PrimitiveType.bits(8));
        members.put("y", PrimitiveType.bits(8));
        state = registry.newState("ingress", members);
        x = b.freshConstant("ingress_x", Sort.bitvector(8));
        y = b.freshConstant("ingress_y", Sort.bitvector(8));
    }

    private Term formula(Term xv, Term yv) {
        return b.structLiteral(state.formulaSort(), xv, yv);
    }

    private Term bits(long v) {
        return b.bvLiteral(8, v);
    }

    private static AssignmentStatement assign(String var, long v) {
        return new AssignmentStatement(new PathExpression(var), Value.integer(v));
    }

    private Term run(Statement... stmts) {
        state.push(new BlockStatement(stmts));
        return Engine.step(state);
    }

    @Test
    public void emptyProgramTest() {
        Assert.assertEquals(formula(x, y), Engine.step(state));
    }

    @Test
    public void assignmentTest() {
        Term result = run(assign("x", 3),
                          new AssignmentStatement(new PathExpression("y"),
                                                  new BinaryExpression(BinaryOperator.ADD,
                                                                       new PathExpression("x"),
                                                                       Value.integer(1))));
        Assert.assertEquals(formula(bits(3), bits(4)), result);
    }

    @Test
    public void branchTest() {
        IfStatement branch = new IfStatement(new BinaryExpression(BinaryOperator.EQ, new PathExpression("x"),
                                                                  Value.integer(1)),
                                             assign("y", 1), assign("y", 2));
        Term result = run(branch, new AssignmentStatement(new PathExpression("x"), new PathExpression("y")));

        Term expected = b.ite(b.eq(x, bits(1)), formula(bits(1), bits(1)), formula(bits(2), bits(2)));
        Assert.assertEquals(expected, result);
        // The else side ran on the original state.
        Assert.assertEquals(Value.bits(8, 2), state.resolve("y"));
    }

    @Test
    public void branchWithoutElseTest() {
        IfStatement branch = new IfStatement().setCondition(new PathExpression("x")).setThen(assign("y", 7));
        Term result = run(branch);
        Term c = b.eq(b.bvExtract(0, 0, x), b.bvLiteral(1, 1));
        Assert.assertEquals(b.ite(c, formula(x, bits(7)), formula(x, y)), result);
    }

    @Test(expected = MissingNodeException.class)
    public void missingConditionTest() {
        new IfStatement().setThen(NoopStatement.INSTANCE).execute(state);
    }

    @Test(expected = MissingNodeException.class)
    public void missingThenTest() {
        new IfStatement().setCondition(Value.of(true)).execute(state);
    }

    @Test
    public void exitTest() {
        Assert.assertEquals(formula(bits(1), y), run(assign("x", 1), ExitStatement.INSTANCE, assign("x", 2)));
    }

    @Test
    public void exitInBranchTest() {
        IfStatement branch = new IfStatement(new PathExpression("y"), ExitStatement.INSTANCE, null);
        Term result = run(branch, assign("x", 9));
        Term c = b.eq(b.bvExtract(0, 0, y), b.bvLiteral(1, 1));
        Assert.assertEquals(b.ite(c, formula(x, y), formula(bits(9), y)), result);
    }

    @Test
    public void returnTest() {
        Assert.assertEquals(formula(bits(1), y), run(assign("x", 1), new ReturnStatement(), assign("x", 2)));
        Assert.assertEquals(bits(5), new ReturnStatement(Value.bits(8, 5)).execute(state));
    }

    @Test
    public void sliceAssignmentTest() {
        Term result = run(assign("x", 0x0f),
                          new AssignmentStatement(new SliceExpression(new PathExpression("x"), 7, 4),
                                                  Value.integer(0xe)));
        Assert.assertEquals(formula(bits(0xef), y), result);
    }

    @Test
    public void nestedSliceAssignmentTest() {
        SliceExpression upper = new SliceExpression(new PathExpression("x"), 7, 4);
        Term result = run(assign("x", 0xff),
                          new AssignmentStatement(new SliceExpression(upper, 1, 0), Value.integer(0)));
        Assert.assertEquals(formula(bits(0xcf), y), result);
    }

    @Test(expected = MalformedProgramException.class)
    public void nestedSliceOutOfRangeTest() {
        SliceExpression upper = new SliceExpression(new PathExpression("x"), 5, 4);
        AssignmentStatement.assign(state, new SliceExpression(upper, 3, 0), Value.integer(0));
    }

    @Test(expected = MalformedProgramException.class)
    public void assignToValueTest() {
        AssignmentStatement.assign(state, Value.integer(1), Value.integer(2));
    }

    @Test
    public void lazyDeclarationTest() {
        Term result = run(new DeclarationStatement("t", new PathExpression("x")),
                          assign("x", 5),
                          new AssignmentStatement(new PathExpression("y"), new PathExpression("t")));
        Assert.assertEquals(formula(bits(5), bits(5)), result);
    }

    @Test
    public void typedDeclarationTest() {
        new DeclarationStatement("tmp", PrimitiveType.bits(4)).execute(state);
        Assert.assertEquals(Value.of(b.freshConstant("tmp", Sort.bitvector(4))), state.resolve("tmp"));
    }

    @Test(expected = MissingNodeException.class)
    public void untypedDeclarationTest() {
        new DeclarationStatement("tmp", null, null).execute(state);
    }

    @Test
    public void blockOrderTest() {
        BlockStatement block = new BlockStatement().add(assign("x", 1)).add(assign("x", 2));
        Assert.assertEquals(2, block.getStatements().size());
        Assert.assertEquals(formula(bits(2), y), run(block, NoopStatement.INSTANCE));
    }
}
