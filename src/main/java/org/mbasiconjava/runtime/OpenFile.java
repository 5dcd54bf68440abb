package org.mbasiconjava.runtime;

import org.mbasiconjava.io.FileHandle;
import org.mbasiconjava.io.FileMode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A file slot in use: the handle plus the per-file state that the
 * sequential and random statements keep between calls.
 */
public class OpenFile {
    private final int number;
    private final String name;
    private final FileMode mode;
    private final int recordLength;
    private final FileHandle handle;

    // random access
    private boolean fixedRecordLength;
    private FieldBuffer fieldBuffer;
    private long currentRecord;
    private boolean pastEnd;

    // sequential access
    private final Deque<String> pendingItems = new ArrayDeque<>();
    private int column;

    public OpenFile(int number, String name, FileMode mode, int recordLength, FileHandle handle) {
        this.number = number;
        this.name = name;
        this.mode = mode;
        this.recordLength = recordLength;
        this.handle = handle;
    }

    public int number() {
        return number;
    }

    public String name() {
        return name;
    }

    public FileMode mode() {
        return mode;
    }

    public int recordLength() {
        return recordLength;
    }

    public FileHandle handle() {
        return handle;
    }

    /**
     * Whether OPEN named the record length. Without one, records are as long
     * as the FIELD buffer.
     */
    public boolean isFixedRecordLength() {
        return fixedRecordLength;
    }

    public void setFixedRecordLength(boolean fixedRecordLength) {
        this.fixedRecordLength = fixedRecordLength;
    }

    /**
     * Distance in bytes between consecutive records.
     */
    public int recordStride() {
        if (!fixedRecordLength && fieldBuffer != null) {
            return fieldBuffer.size();
        }
        return recordLength;
    }

    public FieldBuffer fieldBuffer() {
        return fieldBuffer;
    }

    public void setFieldBuffer(FieldBuffer fieldBuffer) {
        this.fieldBuffer = fieldBuffer;
    }

    public long currentRecord() {
        return currentRecord;
    }

    public void setCurrentRecord(long currentRecord) {
        this.currentRecord = currentRecord;
    }

    public boolean isPastEnd() {
        return pastEnd;
    }

    public void setPastEnd(boolean pastEnd) {
        this.pastEnd = pastEnd;
    }

    /**
     * Items already split off an INPUT# line but not yet consumed.
     */
    public Deque<String> pendingItems() {
        return pendingItems;
    }

    public int column() {
        return column;
    }

    public void setColumn(int column) {
        this.column = column;
    }
}
