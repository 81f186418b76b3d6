package io.github.eutro.pseudoc.test;

import io.github.eutro.pseudoc.expr.Expr;
import io.github.eutro.pseudoc.expr.Register;
import io.github.eutro.pseudoc.expr.Value;
import io.github.eutro.pseudoc.ir.BasicBlock;
import io.github.eutro.pseudoc.ir.Insn;
import io.github.eutro.pseudoc.ops.CommonOps;
import io.github.eutro.pseudoc.ops.Op;
import org.jetbrains.annotations.NotNull;

public class Utils {
    public static Register reg(String name) {
        return new Register(name);
    }

    public static Value val(long value) {
        return new Value(value);
    }

    /**
     * Read back a block dumped in the canonical form, for blocks of assignments and arithmetic.
     */
    @NotNull
    public static BasicBlock readCanonicalBlock(String addr, String text) {
        BasicBlock block = new BasicBlock(addr);
        for (String line : text.split("\n")) {
            line = line.trim();
            if (line.isEmpty()) continue;
            block.add(readCanonicalInsn(line));
        }
        return block;
    }

    @NotNull
    public static Insn readCanonicalInsn(String line) {
        String[] tokens = line.trim().split(" ");
        if (tokens.length == 3 && tokens[1].equals("=")) {
            return new Insn(readExpr(tokens[0]), CommonOps.ASSIGN, readExpr(tokens[2]));
        }
        if (tokens.length == 3 && tokens[1].endsWith("=")) {
            Expr dest = readExpr(tokens[0]);
            String op = tokens[1].substring(0, tokens[1].length() - 1);
            return new Insn(dest, Op.of(op), dest, readExpr(tokens[2]));
        }
        if (tokens.length == 5 && tokens[1].equals("=")) {
            return new Insn(readExpr(tokens[0]), Op.of(tokens[3]), readExpr(tokens[2]), readExpr(tokens[4]));
        }
        throw new IllegalArgumentException("Can't read: " + line);
    }

    @NotNull
    public static Expr readExpr(String token) {
        boolean negative = token.startsWith("-");
        String digits = negative ? token.substring(1) : token;
        if (digits.startsWith("0x")) {
            long value = Long.parseLong(digits.substring(2), 16);
            return new Value(negative ? -value : value, Value.HEX);
        }
        if (!digits.isEmpty() && Character.isDigit(digits.charAt(0))) {
            long value = Long.parseLong(digits);
            return new Value(negative ? -value : value, Value.DEC);
        }
        return new Register(token);
    }
}
