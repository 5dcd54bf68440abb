package org.mbasiconjava.operators;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.io.ConsoleIO;
import org.mbasiconjava.io.FileMode;
import org.mbasiconjava.runtime.FileTable;
import org.mbasiconjava.runtime.OpenFile;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.io.IOException;
import java.util.List;

import static org.mbasiconjava.operators.BuiltinFunctions.integer;
import static org.mbasiconjava.operators.BuiltinFunctions.integerInRange;
import static org.mbasiconjava.operators.BuiltinFunctions.register;

/**
 * File-status built-ins: EOF, LOF, LOC and INPUT$.
 */
public final class FileFunctions {
    private static final int SEQUENTIAL_BLOCK = 128;

    private FileFunctions() {
    }

    static void registerAll() {
        register("eof", 1, 1, FileFunctions::eof);
        register("lof", 1, 1, FileFunctions::lof);
        register("loc", 1, 1, FileFunctions::loc);
        register("input$", 1, 2, FileFunctions::inputChars);
    }

    private static OpenFile file(BuiltinContext ctx, List<BasicValue> args, int index) {
        return ctx.runtime().files().get(integer(args, index));
    }

    private static BasicValue eof(BuiltinContext ctx, List<BasicValue> args) {
        OpenFile file = file(ctx, args, 0);
        try {
            return switch (file.mode()) {
                case INPUT -> BasicValue.ofBoolean(file.pendingItems().isEmpty() && file.handle().isEof());
                case RANDOM -> BasicValue.ofBoolean(file.isPastEnd());
                default -> throw new BasicRuntimeException(ErrorCode.BAD_FILE_MODE, "EOF on output file");
            };
        } catch (IOException e) {
            throw FileTable.handleIOException(e, "EOF");
        }
    }

    private static BasicValue lof(BuiltinContext ctx, List<BasicValue> args) {
        OpenFile file = file(ctx, args, 0);
        try {
            return BasicValue.ofDouble(file.handle().length());
        } catch (IOException e) {
            throw FileTable.handleIOException(e, "LOF");
        }
    }

    /**
     * LOC: last record number for random files, 128-byte blocks transferred
     * for sequential ones.
     */
    private static BasicValue loc(BuiltinContext ctx, List<BasicValue> args) {
        OpenFile file = file(ctx, args, 0);
        if (file.mode() == FileMode.RANDOM) {
            return BasicValue.ofDouble(file.currentRecord());
        }
        try {
            return BasicValue.ofDouble(file.handle().position() / SEQUENTIAL_BLOCK);
        } catch (IOException e) {
            throw FileTable.handleIOException(e, "LOC");
        }
    }

    /**
     * INPUT$(n[, file]): n characters from a file, or from the keyboard
     * without echo.
     */
    private static BasicValue inputChars(BuiltinContext ctx, List<BasicValue> args) {
        int count = integerInRange(args, 0, 1, Configuration.maxStringLength);
        if (args.size() > 1) {
            OpenFile file = file(ctx, args, 1);
            if (file.mode() != FileMode.INPUT) {
                throw new BasicRuntimeException(ErrorCode.BAD_FILE_MODE, "INPUT$ needs an input file");
            }
            try {
                String text = file.handle().read(count);
                if (text.length() < count) {
                    throw new BasicRuntimeException(ErrorCode.INPUT_PAST_END);
                }
                return BasicValue.ofString(text);
            } catch (IOException e) {
                throw FileTable.handleIOException(e, "INPUT$");
            }
        }
        ConsoleIO console = ctx.console();
        StringBuilder sb = new StringBuilder();
        Character key;
        while (sb.length() < count && (key = console.inkey()) != null) {
            sb.append(key.charValue());
        }
        return BasicValue.ofString(sb.toString());
    }
}
