package org.mbasiconjava.operators;

import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.mbasiconjava.operators.BuiltinFunctions.integer;
import static org.mbasiconjava.operators.BuiltinFunctions.number;
import static org.mbasiconjava.operators.BuiltinFunctions.register;
import static org.mbasiconjava.operators.BuiltinFunctions.string;

/**
 * MKI$/MKS$/MKD$ and CVI/CVS/CVD: numbers packed into little-endian byte
 * strings for random-file fields. Floats use IEEE 754 layout.
 */
public final class BinaryConversions {

    private BinaryConversions() {
    }

    static void registerAll() {
        register("mki$", 1, 1, (ctx, args) -> BasicValue.ofString(pack(buffer(2).putShort((short) integer(args, 0)))));
        register("mks$", 1, 1, (ctx, args) -> BasicValue.ofString(pack(buffer(4).putFloat((float) number(args, 0)))));
        register("mkd$", 1, 1, (ctx, args) -> BasicValue.ofString(pack(buffer(8).putDouble(number(args, 0)))));
        register("cvi", 1, 1, (ctx, args) -> BasicValue.ofInteger(unpack(string(args, 0), 2).getShort()));
        register("cvs", 1, 1, (ctx, args) -> BasicValue.ofSingle(unpack(string(args, 0), 4).getFloat()));
        register("cvd", 1, 1, (ctx, args) -> BasicValue.ofDouble(unpack(string(args, 0), 8).getDouble()));
    }

    private static ByteBuffer buffer(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static String pack(ByteBuffer buffer) {
        return new String(buffer.array(), StandardCharsets.ISO_8859_1);
    }

    private static ByteBuffer unpack(String s, int size) {
        if (s.length() < size) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL,
                    "need " + size + " bytes, got " + s.length());
        }
        byte[] bytes = s.substring(0, size).getBytes(StandardCharsets.ISO_8859_1);
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }
}
