package org.mbasiconjava.runtime;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.io.FileMode;
import org.mbasiconjava.io.FileSystem;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;

/**
 * File slots 1 to {@link Configuration#maxOpenFiles}. A slot holds at most
 * one open file, and no more than {@code limit} slots may be open at once.
 */
public class FileTable {
    private final OpenFile[] slots = new OpenFile[Configuration.maxOpenFiles + 1];
    private int limit = Configuration.maxOpenFiles;

    /**
     * Maps an I/O failure to the matching error code.
     */
    public static BasicRuntimeException handleIOException(IOException e, String operation) {
        if (e instanceof NoSuchFileException) {
            return new BasicRuntimeException(ErrorCode.FILE_NOT_FOUND, operation + ": " + e.getMessage(), e);
        }
        if (e instanceof FileAlreadyExistsException) {
            return new BasicRuntimeException(ErrorCode.FILE_ALREADY_EXISTS, operation + ": " + e.getMessage(), e);
        }
        return new BasicRuntimeException(ErrorCode.DISK_IO_ERROR, operation + ": " + e.getMessage(), e);
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = Math.max(1, Math.min(limit, Configuration.maxOpenFiles));
    }

    public static void checkNumber(int number) {
        if (number < 1 || number > Configuration.maxOpenFiles) {
            throw new BasicRuntimeException(ErrorCode.BAD_FILE_NUMBER, "file #" + number);
        }
    }

    public OpenFile open(int number, String name, FileMode mode, int recordLength, FileSystem fileSystem) {
        if (name == null || name.isBlank()) {
            throw new BasicRuntimeException(ErrorCode.BAD_FILE_NAME);
        }
        checkNumber(number);
        if (slots[number] != null) {
            throw new BasicRuntimeException(ErrorCode.FILE_ALREADY_OPEN, "file #" + number);
        }
        if (openCount() >= limit) {
            throw new BasicRuntimeException(ErrorCode.TOO_MANY_FILES);
        }
        if (recordLength < 1 || recordLength > 32767) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "record length " + recordLength);
        }
        try {
            OpenFile file = new OpenFile(number, name, mode, recordLength,
                    fileSystem.open(name, mode, recordLength));
            slots[number] = file;
            return file;
        } catch (InvalidPathException e) {
            throw new BasicRuntimeException(ErrorCode.BAD_FILE_NAME, name, e);
        } catch (IOException e) {
            throw handleIOException(e, "OPEN " + name);
        }
    }

    /**
     * Returns the file in a slot; an unused slot is a bad file number.
     */
    public OpenFile get(int number) {
        checkNumber(number);
        OpenFile file = slots[number];
        if (file == null) {
            throw new BasicRuntimeException(ErrorCode.BAD_FILE_NUMBER, "file #" + number + " not open");
        }
        return file;
    }

    public boolean isOpen(int number) {
        return number >= 1 && number <= Configuration.maxOpenFiles && slots[number] != null;
    }

    public boolean isOpen(String name) {
        for (OpenFile file : slots) {
            if (file != null && file.name().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Open files in slot order.
     */
    public List<OpenFile> openFiles() {
        List<OpenFile> open = new ArrayList<>();
        for (OpenFile file : slots) {
            if (file != null) {
                open.add(file);
            }
        }
        return open;
    }

    public int openCount() {
        int count = 0;
        for (OpenFile file : slots) {
            if (file != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Closes a slot. Closing an unused slot is allowed.
     */
    public void close(int number) {
        checkNumber(number);
        OpenFile file = slots[number];
        if (file == null) {
            return;
        }
        slots[number] = null;
        try {
            file.handle().close();
        } catch (IOException e) {
            throw handleIOException(e, "CLOSE #" + number);
        }
    }

    /**
     * Closes every slot. All handles are closed even when one fails; the
     * first failure is rethrown with the others suppressed.
     */
    public void closeAll() {
        List<IOException> failures = new ArrayList<>();
        for (int i = 1; i < slots.length; i++) {
            OpenFile file = slots[i];
            if (file == null) {
                continue;
            }
            slots[i] = null;
            try {
                file.handle().close();
            } catch (IOException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            BasicRuntimeException error = handleIOException(failures.get(0), "CLOSE");
            for (int i = 1; i < failures.size(); i++) {
                error.addSuppressed(failures.get(i));
            }
            throw error;
        }
    }
}
