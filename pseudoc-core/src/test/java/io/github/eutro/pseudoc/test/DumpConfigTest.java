package io.github.eutro.pseudoc.test;

import io.github.eutro.pseudoc.conf.DumpConfig;
import io.github.eutro.pseudoc.ext.CommonExts;
import io.github.eutro.pseudoc.ir.Insn;
import io.github.eutro.pseudoc.ops.CommonOps;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static io.github.eutro.pseudoc.test.Utils.reg;
import static org.junit.jupiter.api.Assertions.*;

public class DumpConfigTest {
    @Test
    void testDefaults() {
        assertEquals(DumpConfig.Style.CANONICAL, DumpConfig.DEFAULT.style);
        assertFalse(DumpConfig.DEFAULT.omitDead);
        Insn dead = CommonExts.markDead(new Insn(reg("r1"), CommonOps.ASSIGN, reg("r2")));
        assertTrue(DumpConfig.DEFAULT.printer().includes(dead));
        assertEquals("r1 = r2", DumpConfig.DEFAULT.printer().print(dead));
    }

    @Test
    void testFromEnvironment() {
        Map<String, String> env = new HashMap<>();
        assertEquals(DumpConfig.Style.CANONICAL, DumpConfig.fromEnvironment(env::get).style);

        env.put("PSEUDOC_DUMP_REPR", "1");
        env.put("PSEUDOC_NO_DEAD", "1");
        DumpConfig config = DumpConfig.fromEnvironment(env::get);
        assertEquals(DumpConfig.Style.DIAGNOSTIC, config.style);
        assertTrue(config.omitDead);

        Insn dead = CommonExts.markDead(new Insn(reg("r1"), CommonOps.ASSIGN, reg("r2")));
        assertFalse(config.printer().includes(dead));
        Insn live = new Insn(reg("r1"), CommonOps.ASSIGN, reg("r2"));
        assertEquals("r1 = ASSIGN([REG(r2)])", config.printer().print(live));
    }

    @Test
    void testToBuilder() {
        DumpConfig config = DumpConfig.DEFAULT.toBuilder().setOmitDead(true).build();
        assertTrue(config.omitDead);
        assertEquals(DumpConfig.Style.CANONICAL, config.style);
        assertFalse(DumpConfig.DEFAULT.omitDead);
    }
}
