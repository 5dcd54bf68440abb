package org.mbasiconjava.operators;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.runtime.BasicRuntime;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import static org.mbasiconjava.operators.BuiltinFunctions.integer;
import static org.mbasiconjava.operators.BuiltinFunctions.integerInRange;
import static org.mbasiconjava.operators.BuiltinFunctions.register;

/**
 * Cursor, error, clock, environment and hardware built-ins.
 */
public final class SystemFunctions {
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MM-dd-yyyy");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private SystemFunctions() {
    }

    static void registerAll() {
        register("tab", 1, 1, SystemFunctions::tab);
        register("spc", 1, 1, (ctx, args) ->
                BasicValue.ofString(" ".repeat(integerInRange(args, 0, 0, Configuration.maxStringLength))));
        register("pos", 0, 1, (ctx, args) -> BasicValue.ofInteger(ctx.console().getColumn() + 1));
        register("lpos", 0, 1, (ctx, args) -> BasicValue.ofInteger(ctx.printer().getColumn() + 1));
        register("fre", 0, 1, (ctx, args) -> BasicValue.ofDouble(Configuration.freeMemory));
        // no memory or ports to look at
        register("peek", 1, 1, (ctx, args) -> BasicValue.ZERO);
        register("inp", 1, 1, (ctx, args) -> BasicValue.ZERO);
        register("inkey$", 0, 0, (ctx, args) -> {
            Character key = ctx.console().inkey();
            return key == null ? BasicValue.EMPTY_STRING : BasicValue.ofString(String.valueOf(key.charValue()));
        });
        register("err", 0, 0, (ctx, args) -> ctx.runtime().getVariable(BasicRuntime.ERR_VARIABLE));
        register("erl", 0, 0, (ctx, args) -> ctx.runtime().getVariable(BasicRuntime.ERL_VARIABLE));
        register("error$", 0, 1, (ctx, args) -> {
            int code = args.isEmpty()
                    ? ctx.runtime().getVariable(BasicRuntime.ERR_VARIABLE).toInteger()
                    : integer(args, 0);
            return BasicValue.ofString(ErrorCode.message(code));
        });
        register("timer", 0, 0, (ctx, args) -> {
            LocalTime now = LocalTime.now();
            return BasicValue.ofDouble(now.toSecondOfDay() + now.getNano() / 1e9);
        });
        register("date$", 0, 0, (ctx, args) -> BasicValue.ofString(LocalDate.now().format(DATE_FORMAT)));
        register("time$", 0, 0, (ctx, args) -> BasicValue.ofString(LocalTime.now().format(TIME_FORMAT)));
        register("environ$", 1, 1, SystemFunctions::environ);
    }

    /**
     * TAB(n) moves to 1-based column n of the current print device, starting
     * a new line when the cursor is already past it.
     */
    private static BasicValue tab(BuiltinContext ctx, List<BasicValue> args) {
        int n = integerInRange(args, 0, -32768, Configuration.maxStringLength);
        int target = Math.max(n, 1) - 1;
        int column = ctx.printColumn();
        if (column <= target) {
            return BasicValue.ofString(" ".repeat(target - column));
        }
        return BasicValue.ofString("\n" + " ".repeat(target));
    }

    /**
     * ENVIRON$(name) returns the value or "", ENVIRON$(n) the n-th
     * {@code NAME=value} entry in name order.
     */
    private static BasicValue environ(BuiltinContext ctx, List<BasicValue> args) {
        BasicValue arg = args.get(0);
        if (arg.isString()) {
            String name = arg.getString();
            String value = System.getenv(name);
            if (value == null) {
                value = System.getenv(name.toUpperCase(Locale.ROOT));
            }
            return BasicValue.ofString(value == null ? "" : value);
        }
        int n = integerInRange(args, 0, 1, 255);
        List<String> entries = new ArrayList<>();
        for (Map.Entry<String, String> e : new TreeMap<>(System.getenv()).entrySet()) {
            entries.add(e.getKey() + "=" + e.getValue());
        }
        if (n > entries.size()) {
            return BasicValue.EMPTY_STRING;
        }
        String entry = entries.get(n - 1);
        if (entry.length() > Configuration.maxStringLength) {
            throw new BasicRuntimeException(ErrorCode.STRING_TOO_LONG);
        }
        return BasicValue.ofString(entry);
    }
}
