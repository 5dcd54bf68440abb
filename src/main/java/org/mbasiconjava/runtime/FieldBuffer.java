package org.mbasiconjava.runtime;

import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The record buffer of a random-access file, split into named fields by
 * FIELD. The buffer holds one byte per character (ISO-8859-1).
 */
public class FieldBuffer {
    private final byte[] buffer;
    private final List<Field> fields;

    /**
     * A named byte range of the buffer.
     */
    public record Field(String variable, int offset, int width) {
    }

    public FieldBuffer(List<Field> fields, int size) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.buffer = new byte[size];
        Arrays.fill(buffer, (byte) ' ');
    }

    public List<Field> fields() {
        return fields;
    }

    public int size() {
        return buffer.length;
    }

    /**
     * Finds the field bound to a variable, or null.
     */
    public Field find(String variable) {
        for (Field field : fields) {
            if (field.variable().equals(variable)) {
                return field;
            }
        }
        return null;
    }

    public String read(Field field) {
        return new String(buffer, field.offset(), field.width(), StandardCharsets.ISO_8859_1);
    }

    /**
     * Stores a string into a field, padding with spaces or truncating to the
     * field width, and returns what the field now holds.
     */
    public String write(Field field, String value, boolean rightJustify) {
        int width = field.width();
        String fitted;
        if (value.length() >= width) {
            fitted = value.substring(0, width);
        } else if (rightJustify) {
            fitted = " ".repeat(width - value.length()) + value;
        } else {
            fitted = value + " ".repeat(width - value.length());
        }
        byte[] bytes = fitted.getBytes(StandardCharsets.ISO_8859_1);
        System.arraycopy(bytes, 0, buffer, field.offset(), width);
        return fitted;
    }

    public byte[] bytes() {
        return buffer.clone();
    }

    /**
     * Replaces the buffer with {@code count} bytes of data; positions past
     * the data become spaces.
     */
    public void load(byte[] data, int count) {
        if (count > buffer.length) {
            throw new BasicRuntimeException(ErrorCode.FIELD_OVERFLOW);
        }
        Arrays.fill(buffer, (byte) ' ');
        System.arraycopy(data, 0, buffer, 0, Math.max(0, count));
    }
}
