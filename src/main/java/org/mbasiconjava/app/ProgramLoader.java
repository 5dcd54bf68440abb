package org.mbasiconjava.app;

import org.mbasiconjava.frontend.astnode.Program;

import java.io.IOException;

/**
 * Turns a file name from RUN, CHAIN or MERGE into a parsed program. This is
 * where a host plugs in its tokenizer and parser.
 */
@FunctionalInterface
public interface ProgramLoader {

    /**
     * @throws java.nio.file.NoSuchFileException when the file does not exist
     * @throws org.mbasiconjava.runtime.runtimetypes.BasicSyntaxException when the source does not parse
     */
    Program load(String fileName) throws IOException;
}
