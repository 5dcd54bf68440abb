package org.mbasiconjava.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open file as the engine sees it. Sequential modes use the line and
 * character operations; random mode uses the record operations with
 * explicit byte offsets.
 * <p>
 * Text is mapped one byte per character (ISO-8859-1).
 */
public interface FileHandle extends Closeable {

    /**
     * Reads up to the next line terminator, which is dropped along with a
     * preceding carriage return. Returns null at end of file.
     */
    String readLine() throws IOException;

    /**
     * Reads up to {@code count} characters; fewer at end of file.
     */
    String read(int count) throws IOException;

    boolean isEof() throws IOException;

    void write(String text) throws IOException;

    /**
     * Reads {@code buffer.length} bytes at {@code offset}, returning how many
     * were available before end of file.
     */
    int readRecord(long offset, byte[] buffer) throws IOException;

    void writeRecord(long offset, byte[] buffer) throws IOException;

    long length() throws IOException;

    /**
     * Current byte position for sequential access.
     */
    long position() throws IOException;

    default void flush() throws IOException {
    }

    @Override
    void close() throws IOException;
}
