package org.mbasiconjava.io;

import java.io.IOException;

/**
 * File-system access needed by OPEN, KILL and NAME.
 * <p>
 * Failures are reported with the standard {@code java.nio.file} exceptions
 * ({@code NoSuchFileException}, {@code FileAlreadyExistsException}) so the
 * interpreter can map them to error codes.
 */
public interface FileSystem {

    FileHandle open(String name, FileMode mode, int recordLength) throws IOException;

    boolean exists(String name);

    void remove(String name) throws IOException;

    void rename(String oldName, String newName) throws IOException;
}
