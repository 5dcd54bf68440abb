package org.mbasiconjava.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;

/**
 * {@link FileHandle} backed by a {@link FileChannel}. Sequential reads go
 * through a small buffer; record access uses positional reads and writes
 * and leaves the channel position alone.
 */
public class NativeFileHandle implements FileHandle {
    private static final int BUFFER_SIZE = 8192;
    private static final int CPM_EOF = 0x1A;

    private final FileChannel fileChannel;
    private final ByteBuffer readBuffer = ByteBuffer.allocate(BUFFER_SIZE);
    private long readPosition;

    public NativeFileHandle(FileChannel fileChannel) {
        this.fileChannel = fileChannel;
        this.readBuffer.limit(0);
    }

    @Override
    public String readLine() throws IOException {
        if (peekByte() < 0) {
            return null;
        }
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b;
        while ((b = nextByte()) >= 0 && b != '\n') {
            line.write(b);
        }
        byte[] bytes = line.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
    }

    @Override
    public String read(int count) throws IOException {
        StringBuilder sb = new StringBuilder(count);
        int b;
        while (sb.length() < count && (b = nextByte()) >= 0) {
            sb.append((char) b);
        }
        return sb.toString();
    }

    @Override
    public boolean isEof() throws IOException {
        return peekByte() < 0;
    }

    @Override
    public void write(String text) throws IOException {
        ByteBuffer data = ByteBuffer.wrap(text.getBytes(StandardCharsets.ISO_8859_1));
        while (data.hasRemaining()) {
            fileChannel.write(data);
        }
    }

    @Override
    public int readRecord(long offset, byte[] buffer) throws IOException {
        ByteBuffer target = ByteBuffer.wrap(buffer);
        long position = offset;
        while (target.hasRemaining()) {
            int n = fileChannel.read(target, position);
            if (n < 0) {
                break;
            }
            position += n;
        }
        return target.position();
    }

    @Override
    public void writeRecord(long offset, byte[] buffer) throws IOException {
        ByteBuffer source = ByteBuffer.wrap(buffer);
        long position = offset;
        while (source.hasRemaining()) {
            position += fileChannel.write(source, position);
        }
    }

    @Override
    public long length() throws IOException {
        return fileChannel.size();
    }

    @Override
    public long position() throws IOException {
        if (fileChannel.isOpen() && readPosition > 0) {
            return readPosition - readBuffer.remaining();
        }
        return fileChannel.position();
    }

    @Override
    public void flush() throws IOException {
        fileChannel.force(false);
    }

    @Override
    public void close() throws IOException {
        fileChannel.close();
    }

    private int peekByte() throws IOException {
        if (!fill()) {
            return -1;
        }
        int b = readBuffer.get(readBuffer.position()) & 0xFF;
        return b == CPM_EOF ? -1 : b;
    }

    private int nextByte() throws IOException {
        int b = peekByte();
        if (b >= 0) {
            readBuffer.get();
        }
        return b;
    }

    private boolean fill() throws IOException {
        if (readBuffer.hasRemaining()) {
            return true;
        }
        readBuffer.clear();
        int n = fileChannel.read(readBuffer, readPosition);
        if (n <= 0) {
            readBuffer.limit(0);
            return false;
        }
        readPosition += n;
        readBuffer.flip();
        return true;
    }
}
