package org.mbasiconjava.io;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.EnumSet;
import java.util.Set;

/**
 * {@link FileSystem} over the host file system. Names are resolved against
 * a base directory, the working directory by default.
 */
public class NativeFileSystem implements FileSystem {
    private final Path baseDirectory;

    public NativeFileSystem() {
        this(Paths.get(""));
    }

    public NativeFileSystem(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public FileHandle open(String name, FileMode mode, int recordLength) throws IOException {
        Path path = resolve(name);
        Set<StandardOpenOption> options = switch (mode) {
            case INPUT -> EnumSet.of(StandardOpenOption.READ);
            case OUTPUT -> EnumSet.of(StandardOpenOption.WRITE, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            case APPEND -> EnumSet.of(StandardOpenOption.WRITE, StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
            case RANDOM -> EnumSet.of(StandardOpenOption.READ, StandardOpenOption.WRITE,
                    StandardOpenOption.CREATE);
        };
        return new NativeFileHandle(FileChannel.open(path, options));
    }

    @Override
    public boolean exists(String name) {
        return Files.exists(resolve(name));
    }

    @Override
    public void remove(String name) throws IOException {
        Files.delete(resolve(name));
    }

    @Override
    public void rename(String oldName, String newName) throws IOException {
        Files.move(resolve(oldName), resolve(newName));
    }

    private Path resolve(String name) {
        return baseDirectory.resolve(name);
    }
}
