package org.mbasiconjava.operators;

import org.mbasiconjava.runtime.BasicRuntime;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.util.List;

import static org.mbasiconjava.operators.BuiltinFunctions.number;
import static org.mbasiconjava.operators.BuiltinFunctions.register;

/**
 * Numeric built-ins and the type conversion functions.
 */
public final class MathFunctions {

    private MathFunctions() {
    }

    static void registerAll() {
        register("abs", 1, 1, (ctx, args) -> NumericOperators.checked(Math.abs(number(args, 0))));
        register("atn", 1, 1, (ctx, args) -> BasicValue.ofDouble(Math.atan(number(args, 0))));
        register("cos", 1, 1, (ctx, args) -> BasicValue.ofDouble(Math.cos(number(args, 0))));
        register("sin", 1, 1, (ctx, args) -> BasicValue.ofDouble(Math.sin(number(args, 0))));
        register("tan", 1, 1, (ctx, args) -> NumericOperators.checked(Math.tan(number(args, 0))));
        register("exp", 1, 1, (ctx, args) -> NumericOperators.checked(Math.exp(number(args, 0))));
        register("log", 1, 1, MathFunctions::log);
        register("sqr", 1, 1, MathFunctions::sqr);
        register("int", 1, 1, (ctx, args) -> BasicValue.ofDouble(Math.floor(number(args, 0))));
        register("fix", 1, 1, (ctx, args) -> BasicValue.ofDouble(truncate(number(args, 0))));
        register("sgn", 1, 1, (ctx, args) -> BasicValue.ofInteger((int) Math.signum(number(args, 0))));
        register("rnd", 0, 1, MathFunctions::rnd);
        register("cint", 1, 1, (ctx, args) -> BasicValue.ofInteger(BuiltinFunctions.integer(args, 0)));
        register("csng", 1, 1, (ctx, args) -> NumericOperators.checkedSingle(number(args, 0)));
        register("cdbl", 1, 1, (ctx, args) -> BasicValue.ofDouble(number(args, 0)));
    }

    static double truncate(double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    private static BasicValue log(BuiltinContext ctx, List<BasicValue> args) {
        double x = number(args, 0);
        if (x <= 0) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "LOG(" + x + ")");
        }
        return BasicValue.ofDouble(Math.log(x));
    }

    private static BasicValue sqr(BuiltinContext ctx, List<BasicValue> args) {
        double x = number(args, 0);
        if (x < 0) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "SQR(" + x + ")");
        }
        return BasicValue.ofDouble(Math.sqrt(x));
    }

    /**
     * RND: a positive or missing argument draws the next number, zero repeats
     * the last one, a negative argument reseeds from its value first.
     */
    private static BasicValue rnd(BuiltinContext ctx, List<BasicValue> args) {
        BasicRuntime runtime = ctx.runtime();
        double x = args.isEmpty() ? 1 : number(args, 0);
        if (x == 0) {
            return BasicValue.ofSingle(runtime.getLastRandom());
        }
        if (x < 0) {
            runtime.random().setSeed(Double.doubleToLongBits(x));
        }
        double r = runtime.random().nextFloat();
        runtime.setLastRandom(r);
        return BasicValue.ofSingle(r);
    }
}
