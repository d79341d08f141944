package io.formulaxform.core.vocab;

import io.formulaxform.core.model.Invocable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;

/**
 * Numeric and string functions of the legacy vocabulary. Out-of-domain arguments, such as {@code
 * sqrt(-1)}, fail with {@link ArithmeticException} rather than returning {@code NaN}.
 */
public final class MathFunctions {

    private MathFunctions() {
        // static utility
    }

    /** Name to function, in declaration order. */
    public static Map<String, Invocable> table() {
        Map<String, Invocable> fns = new LinkedHashMap<>();
        fns.put("abs", args -> BuiltinFunctions.abs(BuiltinFunctions.one("abs", args)));
        fns.put("round", args -> {
            BuiltinFunctions.arity("round", args, 1, 2);
            return BuiltinFunctions.round(args.get(0), args.size() == 2 ? args.get(1) : null);
        });
        fns.put("min", args -> BuiltinFunctions.extreme("min", args, -1));
        fns.put("max", args -> BuiltinFunctions.extreme("max", args, 1));
        fns.put("sin", real("sin", Math::sin));
        fns.put("cos", real("cos", Math::cos));
        fns.put("tan", real("tan", Math::tan));
        fns.put("asin", real("asin", x -> Math.asin(requireUnit(x))));
        fns.put("acos", real("acos", x -> Math.acos(requireUnit(x))));
        fns.put("atan", real("atan", Math::atan));
        fns.put("sqrt", real("sqrt", x -> Math.sqrt(requireDomain(x >= 0, x))));
        fns.put("log", MathFunctions::log);
        fns.put("ceil", args -> toLong(Math.ceil(Operators.asDouble(BuiltinFunctions.one("ceil", args)))));
        fns.put("floor", args -> toLong(Math.floor(Operators.asDouble(BuiltinFunctions.one("floor", args)))));
        fns.put("exp", real("exp", Math::exp));
        fns.put("fac", args -> factorial(BuiltinFunctions.one("fac", args)));
        fns.put("pow", args -> {
            BuiltinFunctions.arity("pow", args, 2, 2);
            return power(args.get(0), args.get(1));
        });
        fns.put("atan2", args -> {
            BuiltinFunctions.arity("atan2", args, 2, 2);
            return Math.atan2(Operators.asDouble(args.get(0)), Operators.asDouble(args.get(1)));
        });
        fns.put("random", args -> {
            BuiltinFunctions.arity("random", args, 1, 1);
            return ThreadLocalRandom.current().nextDouble() * Operators.asDouble(args.get(0));
        });
        fns.put("concat", MathFunctions::concat);
        fns.put("iif", args -> {
            BuiltinFunctions.arity("iif", args, 3, 3);
            return Operators.truthy(args.get(0)) ? args.get(1) : args.get(2);
        });
        return fns;
    }

    /** Real-valued power; the legacy {@code ^} operator and {@code pow} function. */
    public static Object power(Object a, Object b) {
        double base = Operators.asDouble(a);
        double exponent = Operators.asDouble(b);
        if (base == 0.0 && exponent < 0) {
            throw new ArithmeticException("math domain error");
        }
        if (base < 0 && exponent != Math.rint(exponent)) {
            throw new ArithmeticException("math domain error");
        }
        double result = Math.pow(base, exponent);
        if (Double.isInfinite(result) && !Double.isInfinite(base)) {
            throw new ArithmeticException("math range error");
        }
        return result;
    }

    /** Joins the string forms of all arguments. */
    public static Object concat(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (Object arg : args) {
            sb.append(Operators.str(arg));
        }
        return sb.toString();
    }

    private static Invocable real(String name, DoubleUnaryOperator fn) {
        return args -> fn.applyAsDouble(Operators.asDouble(BuiltinFunctions.one(name, args)));
    }

    private static Object log(List<Object> args) {
        BuiltinFunctions.arity("log", args, 1, 2);
        double x = requireDomain(Operators.asDouble(args.get(0)) > 0, Operators.asDouble(args.get(0)));
        if (args.size() == 1) {
            return Math.log(x);
        }
        double base = Operators.asDouble(args.get(1));
        requireDomain(base > 0 && base != 1.0, base);
        return Math.log(x) / Math.log(base);
    }

    private static Object factorial(Object n) {
        long k = BuiltinFunctions.integral("fac", n);
        if (k < 0) {
            throw new ArithmeticException("factorial() not defined for negative values");
        }
        long result = 1L;
        for (long i = 2; i <= k; i++) {
            result = Math.multiplyExact(result, i);
        }
        return result;
    }

    private static double requireUnit(double x) {
        return requireDomain(x >= -1.0 && x <= 1.0, x);
    }

    private static double requireDomain(boolean ok, double x) {
        if (!ok) {
            throw new ArithmeticException("math domain error: " + x);
        }
        return x;
    }

    private static long toLong(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d) || d >= 0x1p63 || d < -0x1p63) {
            throw new ArithmeticException("cannot convert " + d + " to integer");
        }
        return (long) d;
    }
}
