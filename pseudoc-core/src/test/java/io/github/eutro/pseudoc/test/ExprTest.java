package io.github.eutro.pseudoc.test;

import io.github.eutro.pseudoc.expr.*;
import io.github.eutro.pseudoc.util.NaturalOrder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static io.github.eutro.pseudoc.test.Utils.reg;
import static org.junit.jupiter.api.Assertions.*;

public class ExprTest {
    @Test
    void testEquality() {
        assertEquals(reg("r1"), reg("r1"));
        assertEquals(reg("r1").hashCode(), reg("r1").hashCode());
        assertNotEquals(reg("r1"), reg("r2"));
        assertNotEquals(reg("r1"), new Address("r1"));
        assertNotEquals(new Address("1"), new Value(1));
        assertNotEquals(reg("1"), new Value(1));
        assertNotEquals(new SyntheticFunc("f"), new Address("f"));
        assertEquals(new MemoryRef("u32", reg("sp"), 4), new MemoryRef("u32", reg("sp"), 4));
        assertEquals(new MemoryRef("u32", reg("sp"), 4).hashCode(), new MemoryRef("u32", reg("sp"), 4).hashCode());
        assertNotEquals(new MemoryRef("u32", reg("sp"), 4), new MemoryRef("u16", reg("sp"), 4));
        assertNotEquals(new MemoryRef("u32", reg("sp")), new MemoryRef("u32", reg("sp"), 4));
    }

    @Test
    void testValueBaseIsDisplayOnly() {
        Value hex = new Value(16, Value.HEX);
        Value dec = new Value(16, Value.DEC);
        assertEquals(hex, dec);
        assertEquals(hex.hashCode(), dec.hashCode());
        assertEquals("0x10", hex.toString());
        assertEquals("16", dec.toString());
        assertEquals("VALUE(0x10)", dec.toDiagnosticString());
        assertThrows(IllegalArgumentException.class, () -> new Value(1, 8));
    }

    @Test
    void testRendering() {
        assertEquals("r1", reg("r1").toString());
        assertEquals("REG(r1)", reg("r1").toDiagnosticString());
        assertEquals("0", new Value(0).toString());
        assertEquals("7", new Value(7).toString());
        assertEquals("0xff", new Value(255).toString());
        assertEquals("-0x10", new Value(-16).toString());
        assertEquals("label_1", new Address("label_1").toString());
        assertEquals("ADDR(label_1)", new Address("label_1").toDiagnosticString());
        assertEquals("*(u32*)r1", new MemoryRef("u32", reg("r1")).toString());
        assertEquals("*(u8*)(r1 + 0x8)", new MemoryRef("u8", reg("r1"), 8).toString());
        assertEquals("*(u8*)(r1 + 0x8)", new MemoryRef("u8", reg("r1"), 8).toDiagnosticString());
        assertEquals("bswap", new SyntheticFunc("bswap").toString());
        assertEquals("(SFUNC)bswap", new SyntheticFunc("bswap").toDiagnosticString());
    }

    @Test
    void testTags() {
        Register tagged = reg("r1").withTag("/*arg*/");
        assertEquals("/*arg*/r1", tagged.toString());
        assertEquals("/*arg*/REG(r1)", tagged.toDiagnosticString());
        assertEquals(reg("r1"), tagged);
        assertEquals("", reg("r1").getTag());
        assertEquals("~0x20", new Value(32).withTag("~").toString());
    }

    @Test
    void testReg() {
        Register r1 = reg("r1");
        assertSame(r1, r1.reg());
        assertEquals(r1, new MemoryRef("u32", r1, 4).reg());
        assertNull(new MemoryRef("u32", new Address("glob")).reg());
        assertNull(new Value(1).reg());
        assertNull(new Address("a").reg());
        assertNull(new SyntheticFunc("f").reg());
    }

    @Test
    void testRegisterOrder() {
        assertTrue(reg("r2").compareTo(reg("r10")) < 0);
        assertTrue(reg("r10").compareTo(reg("r2")) > 0);
        assertEquals(0, reg("r3").compareTo(reg("r3")));

        List<Register> regs = new ArrayList<>(Arrays.asList(reg("r10"), reg("sp"), reg("r2"), reg("r1")));
        Collections.sort(regs);
        assertEquals(Arrays.asList(reg("r1"), reg("r2"), reg("r10"), reg("sp")), regs);
    }

    @Test
    void testOrderConsistentWithEquals() {
        TreeSet<Register> regs = new TreeSet<>(Arrays.asList(reg("r1"), reg("r01"), reg("r1")));
        assertEquals(2, regs.size());
        assertEquals(Arrays.asList(reg("r01"), reg("r1")), new ArrayList<>(regs));
        assertNotEquals(0, reg("r1").compareTo(reg("r01")));
    }

    @Test
    void testMemoryRefOrder() {
        MemoryRef a = new MemoryRef("u32", reg("r1"), 8);
        MemoryRef b = new MemoryRef("u32", reg("r1"), 16);
        MemoryRef c = new MemoryRef("u32", reg("r2"));
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(c) < 0);
        assertTrue(c.compareTo(a) > 0);
    }

    @Test
    void testCrossVariantOrder() {
        MemoryRef mem = new MemoryRef("u32", reg("r1"));
        Register r1 = reg("r1");
        // MEM sorts before REG
        assertTrue(mem.compareTo(r1) < 0);
        assertTrue(r1.compareTo(mem) > 0);
    }

    @Test
    void testUndefinedOrder() {
        assertThrows(UnsupportedOperationException.class, () -> new Value(1).compareTo(new Value(2)));
        assertThrows(UnsupportedOperationException.class, () -> new Address("a").compareTo(reg("r1")));
        assertThrows(UnsupportedOperationException.class, () -> reg("r1").compareTo(new Value(1)));
        assertThrows(UnsupportedOperationException.class, () -> new MemoryRef("u8", reg("r1")).compareTo(new SyntheticFunc("f")));
        assertThrows(UnsupportedOperationException.class, () ->
                new MemoryRef("u8", new Value(0x1000)).compareTo(new MemoryRef("u8", new Value(0x2000))));
    }

    @Test
    void testNaturalOrder() {
        NaturalOrder no = NaturalOrder.INSTANCE;
        assertTrue(no.compare("blk2", "blk10") < 0);
        assertTrue(no.compare("a", "a1") < 0);
        assertTrue(no.compare("a9b", "a10a") < 0);
        assertTrue(no.compare("10", "9") > 0);
        assertTrue(no.compare("abc", "abd") < 0);
        assertTrue(no.compare("r01", "r1") < 0);
        assertTrue(no.compare("r1", "r01") > 0);
        assertTrue(no.compare("r01", "r2") < 0);
        assertEquals(0, no.compare("r01", "r01"));
        assertTrue(no.compare("x100000000000000000000000", "x99999999999999999999999") > 0);
    }
}
