package com.galois.p4sym.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.p4sym.BitvectorValue;
import com.galois.p4sym.BoolValue;
import com.galois.p4sym.EvaluatorOptions;
import com.galois.p4sym.FreshConstant;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnresolvedReferenceException;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.callable.Action;
import com.galois.p4sym.expr.MethodCallExpression;
import com.galois.p4sym.expr.PathExpression;
import com.galois.p4sym.types.EnumType;
import com.galois.p4sym.types.HeaderType;
import com.galois.p4sym.types.P4Type;
import com.galois.p4sym.types.PrimitiveType;

public class TestProgramState {
    ProgramRegistry registry;
    TermBuilder b;
    ProgramState state;

    @Before
    public void setUp() {
        registry = new ProgramRegistry();
        b = registry.builder();
        HeaderType eth = new HeaderType("ethernet_t");
        eth.addField("dst", PrimitiveType.bits(8));
        eth.addField("type", PrimitiveType.bits(16));
        Map<String, P4Type> members = new LinkedHashMap<String, P4Type>();
        members.put("hdr", eth);
        members.put("x", PrimitiveType.bits(8));
        state = registry.newState("ingress", members);
    }

    private Term dst() {
        return b.freshConstant("ingress_hdr.dst", Sort.bitvector(8));
    }

    @Test
    public void instanceNamingTest() {
        Assert.assertEquals(Value.of(dst()), state.resolve("hdr.dst"));
        Assert.assertEquals(Value.of(b.freshConstant("ingress_x", Sort.bitvector(8))), state.resolve("x"));
        Term valid = state.resolve("hdr").toTerm(b);
        Assert.assertEquals(b.freshConstant("ingress_hdr.$valid", Sort.BOOL), b.structGet("$valid", valid));
    }

    @Test
    public void widthNormalisationTest() {
        state.setOrAddVar("x", Value.integer(300));
        Assert.assertEquals(Value.bits(8, 44), state.resolve("x"));

        state.setOrAddVar("hdr.dst", Value.bits(16, 0x1234));
        Assert.assertEquals(Value.bits(8, 0x34), state.resolve("hdr.dst"));

        state.setOrAddVar("x", Value.of(true));
        Assert.assertEquals(Value.bits(8, 1), state.resolve("x"));
    }

    @Test
    public void newVariableTest() {
        state.setOrAddVar("tmp", Value.bits(4, 3));
        Assert.assertTrue(state.hasVar("tmp"));
        state.setOrAddVar("tmp", Value.bits(16, 0xffff));
        Assert.assertEquals(Value.bits(4, 0xf), state.resolve("tmp"));
        state.delVar("tmp");
        Assert.assertFalse(state.hasVar("tmp"));
    }

    @Test
    public void deepCopyIsolationTest() {
        ProgramState copy = state.deepCopy();
        copy.setOrAddVar("hdr.dst", Value.bits(8, 1));
        copy.setOrAddVar("x", Value.bits(8, 2));

        Assert.assertEquals(Value.of(dst()), state.resolve("hdr.dst"));
        Assert.assertEquals(Value.bits(8, 1), copy.resolve("hdr.dst"));

        state.setOrAddVar("hdr.type", Value.bits(16, 3));
        Assert.assertEquals(Value.of(b.freshConstant("ingress_hdr.type", Sort.bitvector(16))),
                            copy.resolve("hdr.type"));
    }

    @Test
    public void resolveCopiesComplexValuesTest() {
        ComplexValue hdr = (ComplexValue) state.resolve("hdr");
        hdr.setMember(b, "dst", Value.bits(8, 9));
        Assert.assertEquals(Value.of(dst()), state.resolve("hdr.dst"));
    }

    @Test(expected = UnresolvedReferenceException.class)
    public void unresolvedTest() {
        state.resolve("nope");
    }

    @Test(expected = UnresolvedReferenceException.class)
    public void unresolvedMemberTest() {
        state.resolve("hdr.src");
    }

    @Test(expected = UnsupportedValueException.class)
    public void unsupportedTest() {
        registry.declare("act", Action.noAction());
        state.resolve("act");
    }

    @Test
    public void registryFallbackTest() {
        registry.declare("MAX", Value.bits(8, 0xff));
        Assert.assertEquals(Value.bits(8, 0xff), state.resolve("MAX"));
        state.declareVar("MAX", Value.bits(8, 1));
        Assert.assertEquals(Value.bits(8, 1), state.resolve("MAX"));
    }

    @Test
    public void formulaTest() {
        state.setOrAddVar("x", Value.bits(8, 7));
        Term f = state.getFormula();
        Assert.assertEquals(state.formulaSort(), f.sort());
        Assert.assertEquals(new BitvectorValue(8, 7), b.structGet("x", f));
        Assert.assertEquals(Sort.bitvector(8), b.structGet("dst", b.structGet("hdr", f)).sort());
    }

    @Test
    public void headerMethodTest() {
        Assert.assertEquals(Value.of(b.freshConstant("ingress_hdr.$valid", Sort.BOOL)),
                            new MethodCallExpression("hdr.isValid").evaluate(state));
        new MethodCallExpression("hdr.setValid").evaluate(state);
        Assert.assertEquals(Value.of(true), new MethodCallExpression("hdr.isValid").evaluate(state));
        new MethodCallExpression("hdr.setInvalid").evaluate(state);
        Term hdr = state.resolve("hdr").toTerm(b);
        Assert.assertEquals(BoolValue.FALSE, b.structGet("$valid", hdr));
    }

    @Test
    public void enumTest() {
        registry.declare(new EnumType("Color", Arrays.asList("RED", "GREEN")));
        Assert.assertEquals(Value.bits(32, 0), state.resolve("Color.RED"));
        Assert.assertEquals(Value.bits(32, 1), state.resolve("Color.GREEN"));
    }

    @Test
    public void containerResolutionTest() {
        ListValue list = new ListValue(Arrays.asList(new PathExpression("x"), Value.integer(1)));
        ListValue resolved = (ListValue) state.resolve(list);
        List<Operand> elements = resolved.getElements();
        Assert.assertEquals(Value.of(new FreshConstant("ingress_x", Sort.bitvector(8))), elements.get(0));
        Assert.assertEquals(Value.integer(1), elements.get(1));

        MapValue map = new MapValue(Collections.singletonMap("k", new PathExpression("hdr.dst")));
        MapValue resolvedMap = (MapValue) state.resolve(map);
        Assert.assertEquals(Value.of(dst()), resolvedMap.getEntries().get("k"));
    }

    @Test
    public void continuationTest() {
        Statement s1 = new Statement() {
                public Term execute(ProgramState st) {
                    st.setOrAddVar("x", Value.bits(8, 1));
                    return null;
                }
            };
        Statement s2 = new Statement() {
                public Term execute(ProgramState st) {
                    st.setOrAddVar("x", st.resolve(new PathExpression("x")).toTerm(b) instanceof BitvectorValue
                                   ? Value.bits(8, 2) : Value.bits(8, 3));
                    return null;
                }
            };
        state.pushAll(Arrays.asList(s1, s2));
        Assert.assertFalse(state.isChainEmpty());
        Term f = Engine.step(state);
        Assert.assertTrue(state.isChainEmpty());
        Assert.assertEquals(new BitvectorValue(8, 2), b.structGet("x", f));
    }

    @Test
    public void unwindTest() {
        Statement plain = new Statement() {
                public Term execute(ProgramState st) {
                    return null;
                }
            };
        CallFrame frame = new CallFrame() {
                public Term execute(ProgramState st) {
                    return null;
                }
            };
        state.pushAll(Arrays.asList(plain, frame, plain));
        state.unwindChain();
        Assert.assertEquals(Collections.<Statement>singletonList(frame), state.getChain());
    }

    @Test
    public void callDepthTest() {
        ProgramState s = new ProgramRegistry(new EvaluatorOptions().setMaxCallDepth(1))
            .newState("p", Collections.<String, P4Type>emptyMap());
        s.enterCall("A");
        Assert.assertEquals(1, s.getCallDepth());
        ProgramState copy = s.deepCopy();
        s.exitCall();
        Assert.assertEquals(0, s.getCallDepth());
        Assert.assertEquals(1, copy.getCallDepth());
        try {
            copy.enterCall("B");
            Assert.fail("call above the maximum depth accepted");
        } catch (MalformedProgramException e) {
            // expected
        }
    }
}
