package io.github.eutro.pseudoc.test;

import io.github.eutro.pseudoc.cond.*;
import io.github.eutro.pseudoc.expr.Value;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.pseudoc.test.Utils.reg;
import static io.github.eutro.pseudoc.test.Utils.val;
import static org.junit.jupiter.api.Assertions.*;

public class ConditionTest {
    private static final SimpleCondition C1 = new SimpleCondition(reg("r1"), "==", val(0));
    private static final SimpleCondition C2 = new SimpleCondition(reg("r2"), CmpOp.LT, val(5));
    private static final SimpleCondition C3 = new SimpleCondition(reg("r3"), CmpOp.GE, reg("r4"));

    @Test
    void testSimpleRendering() {
        assertEquals("(r1 == 0)", C1.toString());
        assertEquals("(r1 != 0)", C1.negate().toString());
        assertEquals("SCond(r1 == 0)", C1.toDiagnosticString());
    }

    @Test
    void testOperatorTable() {
        for (CmpOp op : CmpOp.values()) {
            assertNotEquals(op, op.negate());
            assertEquals(op, op.negate().negate());
        }
        assertEquals(CmpOp.LE, CmpOp.GT.negate());
        assertEquals(CmpOp.GE, CmpOp.LT.negate());
        assertEquals(CmpOp.GE, CmpOp.fromSymbol(">="));
        assertThrows(IllegalArgumentException.class, () -> CmpOp.fromSymbol("=~"));
        assertThrows(IllegalArgumentException.class, () -> new SimpleCondition(reg("r1"), "<>", val(1)));
    }

    @Test
    void testSimpleNegation() {
        SimpleCondition neg = C1.negate();
        assertNotEquals(C1, neg);
        assertEquals(C1, neg.negate());
        // the original is untouched
        assertEquals(CmpOp.EQ, C1.op);
        assertEquals(new SimpleCondition(reg("r1"), CmpOp.NE, new Value(0, Value.DEC)), neg);
    }

    @Test
    void testCompoundNegation() {
        CompoundCondition cc = new CompoundCondition(C1, Connective.AND, C2);
        CompoundCondition neg = cc.negate();
        assertEquals(new CompoundCondition(C1.negate(), Connective.OR, C2.negate()), neg);
        assertEquals("((r1 == 0) && (r2 < 5))", cc.toString());
        assertEquals("((r1 != 0) || (r2 >= 5))", neg.toString());
        assertEquals(cc, neg.negate());
    }

    @Test
    void testNestedCompound() {
        CompoundCondition inner = new CompoundCondition(C2, Connective.OR, C3);
        CompoundCondition outer = new CompoundCondition(C1, Connective.AND, inner);
        assertEquals("((r1 == 0) && ((r2 < 5) || (r3 >= r4)))", outer.toString());
        assertEquals("((r1 != 0) || ((r2 >= 5) && (r3 < r4)))", outer.negate().toString());
        assertEquals(outer, outer.negate().negate());
        assertEquals("CCond((r1 == 0) && ((r2 < 5) || (r3 >= r4)))", outer.toDiagnosticString());
    }

    @Test
    void testAppend() {
        CompoundCondition cc = new CompoundCondition(C1);
        cc.append(Connective.AND, C2);
        cc.append(Connective.OR, C3);
        assertEquals(Arrays.asList(C1, Connective.AND, C2, Connective.OR, C3), cc.flatten());
        assertEquals(
                Arrays.asList(C1.negate(), Connective.OR, C2.negate(), Connective.AND, C3.negate()),
                cc.negate().flatten()
        );
    }

    @Test
    void testFlatten() {
        assertEquals(Collections.singletonList(C1), C1.flatten());
        CompoundCondition cc = new CompoundCondition(C1, Connective.OR, C2);
        assertEquals(Arrays.asList(C1, Connective.OR, C2), cc.flatten());
        assertThrows(UnsupportedOperationException.class, () -> cc.flatten().clear());
    }

    @Test
    void testMalformedCompound() {
        assertThrows(IllegalArgumentException.class, () -> new CompoundCondition(C1, Connective.AND));
        assertThrows(IllegalArgumentException.class, () -> new CompoundCondition(C1, C2, C3));
        assertThrows(IllegalArgumentException.class, () -> new CompoundCondition(Connective.AND, C1, Connective.OR));
        assertThrows(IllegalArgumentException.class, () -> new CompoundCondition(Collections.emptyList()));
    }

    @Test
    void testAppendChangesEquality() {
        CompoundCondition a = new CompoundCondition(C1, Connective.AND, C2);
        CompoundCondition b = new CompoundCondition(C1, Connective.AND, C2);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        b.append(Connective.OR, C3);
        assertNotEquals(a, b);
        assertNotEquals(a, a.negate());
    }
}
