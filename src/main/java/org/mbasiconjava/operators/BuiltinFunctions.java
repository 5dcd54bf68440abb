package org.mbasiconjava.operators;

import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of the built-in functions, keyed by lower-case name including
 * the {@code $} suffix. Each entry declares how many arguments it accepts.
 */
public final class BuiltinFunctions {

    /**
     * A built-in function body. Arguments arrive already evaluated.
     */
    @FunctionalInterface
    public interface Builtin {
        BasicValue apply(BuiltinContext context, List<BasicValue> args);
    }

    private record Entry(Builtin function, int minArgs, int maxArgs) {
    }

    private static final Map<String, Entry> functions = new HashMap<>();

    static {
        MathFunctions.registerAll();
        StringFunctions.registerAll();
        FileFunctions.registerAll();
        SystemFunctions.registerAll();
        BinaryConversions.registerAll();
    }

    private BuiltinFunctions() {
    }

    static void register(String name, int minArgs, int maxArgs, Builtin function) {
        functions.put(name, new Entry(function, minArgs, maxArgs));
    }

    public static boolean isBuiltin(String name) {
        return functions.containsKey(name);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    /**
     * Calls a built-in. Unknown names raise "Undefined user function", a
     * wrong argument count raises "Syntax error".
     */
    public static BasicValue call(String name, BuiltinContext context, List<BasicValue> args) {
        Entry entry = functions.get(name);
        if (entry == null) {
            throw new BasicRuntimeException(ErrorCode.UNDEFINED_USER_FUNCTION, name);
        }
        if (args.size() < entry.minArgs() || args.size() > entry.maxArgs()) {
            throw new BasicRuntimeException(ErrorCode.SYNTAX_ERROR,
                    name + " takes " + entry.minArgs() + ".." + entry.maxArgs() + " arguments");
        }
        return entry.function().apply(context, args);
    }

    // Argument helpers shared by the function groups

    static double number(List<BasicValue> args, int index) {
        BasicValue value = args.get(index);
        if (value.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "numeric argument expected");
        }
        return value.toNumber();
    }

    static int integer(List<BasicValue> args, int index) {
        BasicValue value = args.get(index);
        if (value.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "numeric argument expected");
        }
        return value.toInteger();
    }

    static String string(List<BasicValue> args, int index) {
        BasicValue value = args.get(index);
        if (!value.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "string argument expected");
        }
        return value.getString();
    }

    /**
     * Integer argument restricted to {@code min..max}, otherwise an illegal
     * function call.
     */
    static int integerInRange(List<BasicValue> args, int index, int min, int max) {
        int value = integer(args, index);
        if (value < min || value > max) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "argument " + value);
        }
        return value;
    }
}
