package io.formulaxform.core.vocab;

import io.formulaxform.core.model.Invocable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The general-purpose function table of the host-builtins vocabulary. Each entry receives its
 * arguments positionally and validates their count.
 */
public final class BuiltinFunctions {

    private static final int MAX_RANGE = 10_000_000;

    private BuiltinFunctions() {
        // static utility
    }

    /** Name to function, in declaration order. */
    public static Map<String, Invocable> table() {
        Map<String, Invocable> fns = new LinkedHashMap<>();
        fns.put("abs", args -> abs(one("abs", args)));
        fns.put("all", args -> all(one("all", args)));
        fns.put("any", args -> any(one("any", args)));
        fns.put("bin", args -> radix("bin", one("bin", args), 2, "0b"));
        fns.put("bool", args -> {
            arity("bool", args, 0, 1);
            return !args.isEmpty() && Operators.truthy(args.get(0));
        });
        fns.put("chr", args -> chr(one("chr", args)));
        fns.put("divmod", args -> {
            arity("divmod", args, 2, 2);
            return List.of(Operators.floordiv(args.get(0), args.get(1)), Operators.mod(args.get(0), args.get(1)));
        });
        fns.put("float", args -> {
            arity("float", args, 0, 1);
            return args.isEmpty() ? 0.0 : toFloat(args.get(0));
        });
        fns.put("hex", args -> radix("hex", one("hex", args), 16, "0x"));
        fns.put("int", args -> {
            arity("int", args, 0, 2);
            if (args.isEmpty()) {
                return 0L;
            }
            return args.size() == 2 ? parseInt(args.get(0), integral("int", args.get(1))) : toInt(args.get(0));
        });
        fns.put("len", args -> len(one("len", args)));
        fns.put("list", args -> {
            arity("list", args, 0, 1);
            return args.isEmpty() ? List.of() : Collections.unmodifiableList(new ArrayList<>(iterate(args.get(0))));
        });
        fns.put("max", args -> extreme("max", args, 1));
        fns.put("min", args -> extreme("min", args, -1));
        fns.put("oct", args -> radix("oct", one("oct", args), 8, "0o"));
        fns.put("ord", args -> ord(one("ord", args)));
        fns.put("pow", args -> {
            arity("pow", args, 2, 3);
            if (args.size() == 3) {
                return modPow(args.get(0), args.get(1), args.get(2));
            }
            return Operators.pow(args.get(0), args.get(1));
        });
        fns.put("range", BuiltinFunctions::range);
        fns.put("repr", args -> Operators.repr(one("repr", args)));
        fns.put("reversed", args -> {
            List<Object> copy = new ArrayList<>(iterate(one("reversed", args)));
            Collections.reverse(copy);
            return Collections.unmodifiableList(copy);
        });
        fns.put("round", args -> {
            arity("round", args, 1, 2);
            return args.size() == 2 ? round(args.get(0), args.get(1)) : round(args.get(0), null);
        });
        fns.put("sorted", args -> {
            List<Object> copy = new ArrayList<>(iterate(one("sorted", args)));
            copy.sort(Operators::compare);
            return Collections.unmodifiableList(copy);
        });
        fns.put("str", args -> {
            arity("str", args, 0, 1);
            return args.isEmpty() ? "" : Operators.str(args.get(0));
        });
        fns.put("sum", args -> {
            arity("sum", args, 1, 2);
            Object total = args.size() == 2 ? args.get(1) : 0L;
            for (Object item : iterate(args.get(0))) {
                total = Operators.add(total, item);
            }
            return total;
        });
        return fns;
    }

    // ── Shared by the legacy vocabulary ──

    static Object abs(Object x) {
        if (Operators.isIntegral(x)) {
            return Math.absExact(Operators.asLong(x));
        }
        return Math.abs(Operators.asDouble(x));
    }

    /**
     * Rounds half to even. Without {@code digits} the result is integral; with it the result keeps
     * the operand's type.
     */
    static Object round(Object x, Object digits) {
        if (digits == null) {
            if (Operators.isIntegral(x)) {
                return Operators.asLong(x);
            }
            double d = Operators.asDouble(x);
            requireFinite("round", d);
            return new BigDecimal(d).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
        }
        int places = (int) integral("round", digits);
        if (Operators.isIntegral(x)) {
            BigDecimal value = BigDecimal.valueOf(Operators.asLong(x));
            return value.setScale(places, RoundingMode.HALF_EVEN).setScale(0, RoundingMode.UNNECESSARY).longValue();
        }
        double d = Operators.asDouble(x);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return d;
        }
        return new BigDecimal(d).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    static Object extreme(String name, List<Object> args, int sign) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(name + " expected at least 1 argument, got 0");
        }
        Collection<?> candidates = args.size() == 1 ? iterate(args.get(0)) : args;
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException(name + "() arg is an empty sequence");
        }
        Object best = null;
        boolean first = true;
        for (Object candidate : candidates) {
            if (first || Operators.compare(candidate, best) * sign > 0) {
                best = candidate;
                first = false;
            }
        }
        return best;
    }

    // ── Argument helpers ──

    static void arity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new IllegalArgumentException(
                    name + "() takes " + expected + " argument(s) (" + args.size() + " given)");
        }
    }

    static Object one(String name, List<Object> args) {
        arity(name, args, 1, 1);
        return args.get(0);
    }

    static long integral(String name, Object value) {
        if (!Operators.isIntegral(value)) {
            throw new IllegalArgumentException(
                    name + "(): expected an integer, got " + Operators.typeName(value));
        }
        return Operators.asLong(value);
    }

    /** The elements of a list, the characters of a string, or the keys of a map. */
    static Collection<?> iterate(Object value) {
        if (value instanceof Collection<?> c) {
            return c;
        }
        if (value instanceof String s) {
            List<Object> chars = new ArrayList<>(s.length());
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        if (value instanceof Map<?, ?> m) {
            return m.keySet();
        }
        throw new IllegalArgumentException("'" + Operators.typeName(value) + "' object is not iterable");
    }

    private static void requireFinite(String name, double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ArithmeticException(name + "(): cannot convert " + d + " to integer");
        }
    }

    // ── Implementations ──

    private static Object all(Object iterable) {
        for (Object item : iterate(iterable)) {
            if (!Operators.truthy(item)) {
                return false;
            }
        }
        return true;
    }

    private static Object any(Object iterable) {
        for (Object item : iterate(iterable)) {
            if (Operators.truthy(item)) {
                return true;
            }
        }
        return false;
    }

    private static Object radix(String name, Object value, int radix, String prefix) {
        long v = integral(name, value);
        String digits = Long.toString(Math.abs(v), radix);
        if (v == Long.MIN_VALUE) {
            digits = BigInteger.valueOf(v).abs().toString(radix);
        }
        return (v < 0 ? "-" : "") + prefix + digits;
    }

    private static Object chr(Object value) {
        long cp = integral("chr", value);
        if (cp < 0 || cp > Character.MAX_CODE_POINT) {
            throw new IllegalArgumentException("chr() arg not in range(0x110000)");
        }
        return new String(Character.toChars((int) cp));
    }

    private static Object ord(Object value) {
        if (!(value instanceof String s) || s.codePointCount(0, s.length()) != 1) {
            throw new IllegalArgumentException("ord() expected a character, got " + Operators.repr(value));
        }
        return (long) s.codePointAt(0);
    }

    private static Object len(Object value) {
        if (value instanceof String s) {
            return (long) s.codePointCount(0, s.length());
        }
        if (value instanceof Collection<?> c) {
            return (long) c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return (long) m.size();
        }
        throw new IllegalArgumentException("object of type '" + Operators.typeName(value) + "' has no len()");
    }

    private static Object toFloat(Object value) {
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("could not convert string to float: '" + s + "'", e);
            }
        }
        return Operators.asDouble(value);
    }

    private static Object toInt(Object value) {
        if (Operators.isIntegral(value)) {
            return Operators.asLong(value);
        }
        if (value instanceof String s) {
            return parseInt(s, 10);
        }
        double d = Operators.asDouble(value);
        requireFinite("int", d);
        if (d >= 0x1p63 || d < -0x1p63) {
            throw new ArithmeticException("int(): " + d + " is out of long range");
        }
        return (long) d;
    }

    private static Object parseInt(Object value, long base) {
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException("int() can't convert non-string with explicit base");
        }
        if (base < 2 || base > 36) {
            throw new IllegalArgumentException("int() base must be >= 2 and <= 36");
        }
        try {
            return Long.parseLong(s.strip().replace("_", ""), (int) base);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid literal for int() with base " + base + ": '" + s + "'", e);
        }
    }

    private static Object modPow(Object base, Object exp, Object mod) {
        long m = integral("pow", mod);
        if (m == 0) {
            throw new ArithmeticException("pow() 3rd argument cannot be 0");
        }
        long e = integral("pow", exp);
        if (e < 0) {
            throw new ArithmeticException("pow() 2nd argument cannot be negative when 3rd argument specified");
        }
        BigInteger modulus = BigInteger.valueOf(m);
        BigInteger r = BigInteger.valueOf(integral("pow", base)).modPow(BigInteger.valueOf(e), modulus.abs());
        if (m < 0 && r.signum() != 0) {
            r = r.add(modulus);
        }
        return r.longValueExact();
    }

    private static Object range(List<Object> args) {
        arity("range", args, 1, 3);
        long start = 0;
        long step = 1;
        long stop;
        if (args.size() == 1) {
            stop = integral("range", args.get(0));
        } else {
            start = integral("range", args.get(0));
            stop = integral("range", args.get(1));
            if (args.size() == 3) {
                step = integral("range", args.get(2));
            }
        }
        if (step == 0) {
            throw new IllegalArgumentException("range() arg 3 must not be zero");
        }
        List<Object> out = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            if (out.size() >= MAX_RANGE) {
                throw new IllegalArgumentException("range() is limited to " + MAX_RANGE + " elements");
            }
            out.add(i);
        }
        return Collections.unmodifiableList(out);
    }
}
