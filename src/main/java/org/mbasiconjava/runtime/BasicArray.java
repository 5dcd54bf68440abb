package org.mbasiconjava.runtime;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;
import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.util.Arrays;

/**
 * A dimensioned array. Elements live in one flat store, the last subscript
 * varies fastest.
 */
public class BasicArray {
    private final String name;
    private final VarType type;
    private final int base;
    private final int[] bounds;
    private final BasicValue[] elements;

    public BasicArray(String name, VarType type, int[] bounds, int base) {
        this.name = name;
        this.type = type;
        this.base = base;
        this.bounds = bounds.clone();
        long size = 1;
        for (int bound : bounds) {
            if (bound < 0) {
                throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "negative bound for " + name);
            }
            size *= Math.max(0, bound + 1 - base);
            if (size > Configuration.maxArrayElements) {
                throw new BasicRuntimeException(ErrorCode.OUT_OF_MEMORY, "array " + name + " too large");
            }
        }
        this.elements = new BasicValue[(int) size];
        Arrays.fill(elements, BasicValue.defaultFor(type));
    }

    public String name() {
        return name;
    }

    public VarType type() {
        return type;
    }

    public int base() {
        return base;
    }

    public int[] bounds() {
        return bounds.clone();
    }

    public int size() {
        return elements.length;
    }

    public BasicValue get(int[] indices) {
        return elements[offset(indices)];
    }

    public void set(int[] indices, BasicValue value) {
        elements[offset(indices)] = value.coerceTo(type);
    }

    private int offset(int[] indices) {
        if (indices.length != bounds.length) {
            throw new BasicRuntimeException(ErrorCode.SUBSCRIPT_OUT_OF_RANGE,
                    name + " has " + bounds.length + " dimension(s)");
        }
        int offset = 0;
        int multiplier = 1;
        for (int i = bounds.length - 1; i >= 0; i--) {
            int index = indices[i];
            if (index < base || index > bounds[i]) {
                throw new BasicRuntimeException(ErrorCode.SUBSCRIPT_OUT_OF_RANGE,
                        name + " index " + index + " outside " + base + ".." + bounds[i]);
            }
            offset += (index - base) * multiplier;
            multiplier *= bounds[i] + 1 - base;
        }
        return offset;
    }
}
