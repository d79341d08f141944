package io.formulaxform.core.vocab;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operator semantics shared by the standard vocabularies. Values follow dynamic-language rules:
 * integral numbers are {@code Long}, real numbers {@code Double}, booleans count as 1 and 0, and
 * strings and lists support {@code +} and {@code *}.
 *
 * <p>Long arithmetic is exact; overflow raises {@link ArithmeticException} instead of wrapping.
 * Type errors raise {@link IllegalArgumentException}. The evaluator turns both into {@code
 * TypeMismatchException}.
 */
public final class Operators {

    private Operators() {
        // static utility
    }

    // ── Value helpers ──

    /** Truthiness: {@code null}, {@code false}, zero, and empty strings, lists and maps are false. */
    public static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (isIntegral(value)) {
            return asLong(value) != 0L;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    /** {@code true} for booleans and the integral boxed types. */
    public static boolean isIntegral(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Boolean;
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    static long asLong(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return ((Number) value).longValue();
    }

    static double asDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("expected a number, got " + typeName(value));
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /** String form of a value for concatenation: {@code True}, {@code None}, {@code 1.0}, {@code [1, 'a']}. */
    public static String str(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof Double d) {
            return formatDouble(d);
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>(list.size());
            for (Object item : list) {
                parts.add(repr(item));
            }
            return "[" + String.join(", ", parts) + "]";
        }
        return String.valueOf(value);
    }

    /** Like {@link #str(Object)} but quotes strings. */
    public static String repr(Object value) {
        if (value instanceof String s) {
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        return str(value);
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            return (long) d + ".0";
        }
        return Double.toString(d);
    }

    // ── Unary ──

    public static Object pos(Object a) {
        requireNumeric("unary +", a);
        return a instanceof Boolean ? asLong(a) : a;
    }

    public static Object neg(Object a) {
        requireNumeric("unary -", a);
        if (isIntegral(a)) {
            return Math.negateExact(asLong(a));
        }
        return -asDouble(a);
    }

    public static Object invert(Object a) {
        if (!isIntegral(a)) {
            throw unsupported("~", a);
        }
        return ~asLong(a);
    }

    public static Object not(Object a) {
        return !truthy(a);
    }

    // ── Arithmetic ──

    public static Object add(Object a, Object b) {
        if (a instanceof String x && b instanceof String y) {
            return x + y;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            List<Object> out = new ArrayList<>(x);
            out.addAll(y);
            return Collections.unmodifiableList(out);
        }
        requireNumeric("+", a, b);
        if (isIntegral(a) && isIntegral(b)) {
            return Math.addExact(asLong(a), asLong(b));
        }
        return asDouble(a) + asDouble(b);
    }

    public static Object sub(Object a, Object b) {
        requireNumeric("-", a, b);
        if (isIntegral(a) && isIntegral(b)) {
            return Math.subtractExact(asLong(a), asLong(b));
        }
        return asDouble(a) - asDouble(b);
    }

    public static Object mul(Object a, Object b) {
        if ((a instanceof String || a instanceof List) && isIntegral(b)) {
            return repeat(a, asLong(b));
        }
        if (isIntegral(a) && (b instanceof String || b instanceof List)) {
            return repeat(b, asLong(a));
        }
        requireNumeric("*", a, b);
        if (isIntegral(a) && isIntegral(b)) {
            return Math.multiplyExact(asLong(a), asLong(b));
        }
        return asDouble(a) * asDouble(b);
    }

    /** True division, always real: {@code 7 / 2 == 3.5}. */
    public static Object truediv(Object a, Object b) {
        requireNumeric("/", a, b);
        double divisor = asDouble(b);
        if (divisor == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return asDouble(a) / divisor;
    }

    /** Floor division: rounds toward negative infinity, {@code -7 // 2 == -4}. */
    public static Object floordiv(Object a, Object b) {
        requireNumeric("//", a, b);
        if (isIntegral(a) && isIntegral(b)) {
            long divisor = asLong(b);
            if (divisor == 0L) {
                throw new ArithmeticException("integer division by zero");
            }
            return Math.floorDiv(asLong(a), divisor);
        }
        double divisor = asDouble(b);
        if (divisor == 0.0) {
            throw new ArithmeticException("float floor division by zero");
        }
        double dividend = asDouble(a);
        // derive from the remainder so that 1 // 0.2 == 4.0, matching 1 % 0.2
        double mod = dividend % divisor;
        double div = (dividend - mod) / divisor;
        if (mod != 0.0 && (divisor < 0) != (mod < 0)) {
            div -= 1.0;
        }
        if (div == 0.0) {
            return Math.copySign(0.0, dividend / divisor);
        }
        double floor = Math.floor(div);
        return div - floor > 0.5 ? floor + 1.0 : floor;
    }

    /** Modulo with the sign of the divisor: {@code -7 % 3 == 2}. */
    public static Object mod(Object a, Object b) {
        requireNumeric("%", a, b);
        if (isIntegral(a) && isIntegral(b)) {
            long divisor = asLong(b);
            if (divisor == 0L) {
                throw new ArithmeticException("integer modulo by zero");
            }
            return Math.floorMod(asLong(a), divisor);
        }
        double divisor = asDouble(b);
        if (divisor == 0.0) {
            throw new ArithmeticException("float modulo");
        }
        double r = asDouble(a) % divisor;
        if (r != 0.0 && (r < 0) != (divisor < 0)) {
            r += divisor;
        }
        return r;
    }

    /** Power; integral when both operands are integral and the exponent is not negative. */
    public static Object pow(Object a, Object b) {
        requireNumeric("**", a, b);
        if (isIntegral(a) && isIntegral(b) && asLong(b) >= 0) {
            long base = asLong(a);
            long exp = asLong(b);
            long result = 1L;
            while (exp > 0) {
                if ((exp & 1L) == 1L) {
                    result = Math.multiplyExact(result, base);
                }
                exp >>= 1;
                if (exp > 0) {
                    base = Math.multiplyExact(base, base);
                }
            }
            return result;
        }
        double base = asDouble(a);
        if (base == 0.0 && asDouble(b) < 0) {
            throw new ArithmeticException("0.0 cannot be raised to a negative power");
        }
        return Math.pow(base, asDouble(b));
    }

    /** Matrix product over nested lists; two flat lists give their dot product. */
    public static Object matmul(Object a, Object b) {
        if (!(a instanceof List<?> left) || !(b instanceof List<?> right)) {
            throw unsupported("@", a, b);
        }
        boolean leftMatrix = isMatrix(left);
        boolean rightMatrix = isMatrix(right);
        if (!leftMatrix && !rightMatrix) {
            return dot(left, right);
        }
        if (leftMatrix && !rightMatrix) {
            List<Object> out = new ArrayList<>(left.size());
            for (Object row : left) {
                out.add(dot((List<?>) row, right));
            }
            return Collections.unmodifiableList(out);
        }
        List<List<?>> columns = columns(right);
        if (!leftMatrix) {
            List<Object> out = new ArrayList<>(columns.size());
            for (List<?> column : columns) {
                out.add(dot(left, column));
            }
            return Collections.unmodifiableList(out);
        }
        List<Object> out = new ArrayList<>(left.size());
        for (Object row : left) {
            List<Object> line = new ArrayList<>(columns.size());
            for (List<?> column : columns) {
                line.add(dot((List<?>) row, column));
            }
            out.add(Collections.unmodifiableList(line));
        }
        return Collections.unmodifiableList(out);
    }

    private static boolean isMatrix(List<?> list) {
        if (list.isEmpty()) {
            return false;
        }
        for (Object item : list) {
            if (!(item instanceof List)) {
                return false;
            }
        }
        return true;
    }

    private static List<List<?>> columns(List<?> matrix) {
        int width = ((List<?>) matrix.get(0)).size();
        List<List<?>> columns = new ArrayList<>(width);
        for (int j = 0; j < width; j++) {
            List<Object> column = new ArrayList<>(matrix.size());
            for (Object row : matrix) {
                List<?> cells = (List<?>) row;
                if (cells.size() != width) {
                    throw new IllegalArgumentException("matmul: ragged matrix");
                }
                column.add(cells.get(j));
            }
            columns.add(column);
        }
        return columns;
    }

    private static Object dot(List<?> a, List<?> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("matmul: size mismatch " + a.size() + " vs " + b.size());
        }
        Object sum = 0L;
        for (int i = 0; i < a.size(); i++) {
            sum = add(sum, mul(a.get(i), b.get(i)));
        }
        return sum;
    }

    private static Object repeat(Object seq, long times) {
        if (times > Integer.MAX_VALUE) {
            throw new ArithmeticException("repeat count too large: " + times);
        }
        if (seq instanceof String s) {
            return times <= 0 ? "" : s.repeat((int) times);
        }
        List<?> list = (List<?>) seq;
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < times; i++) {
            out.addAll(list);
        }
        return Collections.unmodifiableList(out);
    }

    // ── Bitwise ──

    public static Object lshift(Object a, Object b) {
        long[] v = integralPair("<<", a, b);
        long count = requireShift(v[1]);
        long result = v[0] << count;
        if ((count >= 63 && v[0] != 0) || (result >> count) != v[0]) {
            throw new ArithmeticException("long overflow");
        }
        return result;
    }

    public static Object rshift(Object a, Object b) {
        long[] v = integralPair(">>", a, b);
        long count = requireShift(v[1]);
        return count >= 64 ? (v[0] < 0 ? -1L : 0L) : v[0] >> count;
    }

    public static Object bitAnd(Object a, Object b) {
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return x & y;
        }
        long[] v = integralPair("&", a, b);
        return v[0] & v[1];
    }

    public static Object bitOr(Object a, Object b) {
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return x | y;
        }
        long[] v = integralPair("|", a, b);
        return v[0] | v[1];
    }

    public static Object bitXor(Object a, Object b) {
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return x ^ y;
        }
        long[] v = integralPair("^", a, b);
        return v[0] ^ v[1];
    }

    private static long requireShift(long count) {
        if (count < 0) {
            throw new ArithmeticException("negative shift count");
        }
        return count;
    }

    private static long[] integralPair(String op, Object a, Object b) {
        if (!isIntegral(a) || !isIntegral(b)) {
            throw unsupported(op, a, b);
        }
        return new long[] {asLong(a), asLong(b)};
    }

    // ── Comparison ──

    /** Equality; numbers compare by value across types, {@code 1 == 1.0 == true}. */
    public static boolean valueEquals(Object a, Object b) {
        if (isNumeric(a) && isNumeric(b)) {
            if (isIntegral(a) && isIntegral(b)) {
                return asLong(a) == asLong(b);
            }
            return asDouble(a) == asDouble(b);
        }
        return Objects.equals(a, b);
    }

    public static Object eq(Object a, Object b) {
        return valueEquals(a, b);
    }

    public static Object ne(Object a, Object b) {
        return !valueEquals(a, b);
    }

    public static Object lt(Object a, Object b) {
        return compare("<", a, b) < 0;
    }

    public static Object le(Object a, Object b) {
        return compare("<=", a, b) <= 0;
    }

    public static Object gt(Object a, Object b) {
        return compare(">", a, b) > 0;
    }

    public static Object ge(Object a, Object b) {
        return compare(">=", a, b) >= 0;
    }

    /** Natural ordering used by comparisons, {@code min}, {@code max} and {@code sorted}. */
    public static int compare(Object a, Object b) {
        return compare("comparison", a, b);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(String op, Object a, Object b) {
        if (isNumeric(a) && isNumeric(b)) {
            if (isIntegral(a) && isIntegral(b)) {
                return Long.compare(asLong(a), asLong(b));
            }
            return Double.compare(asDouble(a), asDouble(b));
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            int n = Math.min(x.size(), y.size());
            for (int i = 0; i < n; i++) {
                int c = compare(op, x.get(i), y.get(i));
                if (c != 0) {
                    return c;
                }
            }
            return Integer.compare(x.size(), y.size());
        }
        if (a instanceof Comparable ca && b != null && a.getClass() == b.getClass()) {
            return ca.compareTo(b);
        }
        throw new IllegalArgumentException(
                "'" + op + "' not supported between " + typeName(a) + " and " + typeName(b));
    }

    /** Containment, {@code a in b}: substring, list element, or map key. */
    public static Object in(Object a, Object b) {
        if (b instanceof String s) {
            if (!(a instanceof String sub)) {
                throw new IllegalArgumentException("'in <string>' requires string as left operand, not " + typeName(a));
            }
            return s.contains(sub);
        }
        if (b instanceof Collection<?> c) {
            for (Object item : c) {
                if (valueEquals(a, item)) {
                    return true;
                }
            }
            return false;
        }
        if (b instanceof Map<?, ?> m) {
            return m.containsKey(a);
        }
        throw new IllegalArgumentException("argument of type " + typeName(b) + " is not iterable");
    }

    /** Identity, {@code a is b}: the same reference. {@code null} and booleans compare as singletons. */
    public static Object is(Object a, Object b) {
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return x.booleanValue() == y.booleanValue();
        }
        return a == b;
    }

    // ── Boolean ──

    /** Returns {@code a} if it is falsy, else {@code b}. */
    public static Object and(Object a, Object b) {
        return truthy(a) ? b : a;
    }

    /** Returns {@code a} if it is truthy, else {@code b}. */
    public static Object or(Object a, Object b) {
        return truthy(a) ? a : b;
    }

    /** String concatenation of the string forms, {@code 'a' || 1 == 'a1'}. */
    public static Object concat(Object a, Object b) {
        return str(a) + str(b);
    }

    // ── Errors ──

    private static void requireNumeric(String op, Object... operands) {
        for (Object operand : operands) {
            if (!isNumeric(operand)) {
                throw unsupported(op, operands);
            }
        }
    }

    private static IllegalArgumentException unsupported(String op, Object... operands) {
        List<String> types = new ArrayList<>(operands.length);
        for (Object operand : operands) {
            types.add(typeName(operand));
        }
        return new IllegalArgumentException("unsupported operand type(s) for " + op + ": " + String.join(", ", types));
    }
}
