package com.codeguard.engine.validate;

import com.codeguard.engine.syntax.Ast;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

/**
 * Evaluates numeric constant expressions: int and float literals, booleans
 * (as 0/1), unary {@code + - ~ not} and the arithmetic binary operators.
 * Anything involving names, calls, strings or complex numbers is not folded.
 *
 * <p>Integers stay exact ({@link BigInteger}) the way Python's do; a value
 * becomes a {@code Double} only once a float literal or a true division is
 * involved.
 */
final class ConstantFolder {

    /** Larger powers are left unfolded. */
    private static final int MAX_RESULT_BITS = 1 << 16;
    private static final double MAX_FLOAT_EXPONENT = 1024;

    private ConstantFolder() {}

    /** @return a {@link BigInteger} or a {@link Double}, empty when the expression is not constant */
    static Optional<Number> fold(Ast.Expr expr) {
        if (expr instanceof Ast.Constant c) {
            return literal(c);
        }
        if (expr instanceof Ast.UnaryOp u) {
            Optional<Number> v = fold(u.operand());
            return v.isEmpty() ? v : unary(u.op(), v.get());
        }
        if (expr instanceof Ast.BinOp b) {
            Optional<Number> l = fold(b.left());
            Optional<Number> r = fold(b.right());
            if (l.isEmpty() || r.isEmpty()) {
                return Optional.empty();
            }
            if (l.get() instanceof BigInteger li && r.get() instanceof BigInteger ri) {
                return integer(b.op(), li, ri);
            }
            return real(b.op(), l.get().doubleValue(), r.get().doubleValue());
        }
        return Optional.empty();
    }

    static boolean isZero(Ast.Expr expr) {
        return fold(expr).map(ConstantFolder::zero).orElse(false);
    }

    private static boolean zero(Number n) {
        return n instanceof BigInteger i ? i.signum() == 0 : n.doubleValue() == 0.0;
    }

    private static Optional<Number> unary(String op, Number v) {
        switch (op) {
            case "+":
                return Optional.of(v);
            case "-":
                return Optional.of(v instanceof BigInteger i ? i.negate() : (Number) (-v.doubleValue()));
            case "~":
                return v instanceof BigInteger i ? Optional.of(i.not()) : Optional.empty();
            case "not":
                return Optional.of(zero(v) ? BigInteger.ONE : BigInteger.ZERO);
            default:
                return Optional.empty();
        }
    }

    private static Optional<Number> integer(String op, BigInteger l, BigInteger r) {
        switch (op) {
            case "+": return Optional.of(l.add(r));
            case "-": return Optional.of(l.subtract(r));
            case "*": return Optional.of(l.multiply(r));
            case "/":
                return r.signum() == 0 ? Optional.empty() : real("/", l.doubleValue(), r.doubleValue());
            case "//": {
                if (r.signum() == 0) {
                    return Optional.empty();
                }
                BigInteger[] qr = l.divideAndRemainder(r);
                boolean adjust = qr[1].signum() != 0 && qr[1].signum() != r.signum();
                return Optional.of(adjust ? qr[0].subtract(BigInteger.ONE) : qr[0]);
            }
            case "%": {
                if (r.signum() == 0) {
                    return Optional.empty();
                }
                BigInteger m = l.remainder(r);
                return Optional.of(m.signum() != 0 && m.signum() != r.signum() ? m.add(r) : m);
            }
            case "**": {
                if (r.signum() < 0) {
                    return real("**", l.doubleValue(), r.doubleValue());
                }
                if ((long) Math.max(1, l.bitLength()) * r.longValue() > MAX_RESULT_BITS
                        || r.bitLength() > 31) {
                    return Optional.empty();
                }
                return Optional.of(l.pow(r.intValue()));
            }
            default:
                return Optional.empty();
        }
    }

    private static Optional<Number> real(String op, double l, double r) {
        switch (op) {
            case "+": return Optional.of(l + r);
            case "-": return Optional.of(l - r);
            case "*": return Optional.of(l * r);
            case "/":
                return r == 0 ? Optional.empty() : Optional.of(l / r);
            case "//":
                return r == 0 ? Optional.empty() : Optional.of(Math.floor(l / r));
            case "%":
                return r == 0 ? Optional.empty() : Optional.of(l - r * Math.floor(l / r));
            case "**":
                if (Math.abs(r) > MAX_FLOAT_EXPONENT || (l == 0 && r < 0)) {
                    return Optional.empty();
                }
                return Optional.of(Math.pow(l, r));
            default:
                return Optional.empty();
        }
    }

    private static Optional<Number> literal(Ast.Constant c) {
        switch (c.kind()) {
            case TRUE:  return Optional.of(BigInteger.ONE);
            case FALSE: return Optional.of(BigInteger.ZERO);
            case INT:   return parseInt(c.text());
            case FLOAT:
                try {
                    return Optional.of(Double.parseDouble(c.text().replace("_", "")));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            default:    return Optional.empty();
        }
    }

    private static Optional<Number> parseInt(String text) {
        String t = text.replace("_", "").toLowerCase(Locale.ROOT);
        int radix = 10;
        if (t.startsWith("0x")) {
            radix = 16;
        } else if (t.startsWith("0o")) {
            radix = 8;
        } else if (t.startsWith("0b")) {
            radix = 2;
        }
        if (radix != 10) {
            t = t.substring(2);
        }
        try {
            return Optional.of(new BigInteger(t, radix));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
