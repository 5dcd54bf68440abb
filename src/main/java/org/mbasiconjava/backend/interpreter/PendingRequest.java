package org.mbasiconjava.backend.interpreter;

import java.util.List;

/**
 * Program replacement the engine hands back to the host: CHAIN, RUN of a
 * file, or MERGE. The engine halts with reason END while one is pending.
 */
public sealed interface PendingRequest {

    String fileName();

    /**
     * CHAIN [MERGE] file [,line] [,ALL] [,DELETE from-to].
     *
     * @param commonVariables names declared by COMMON, kept when {@code all} is false
     */
    record ChainRequest(String fileName, Integer line, boolean all, boolean merge,
                        Integer deleteFrom, Integer deleteTo, List<String> commonVariables)
            implements PendingRequest {
        public ChainRequest {
            commonVariables = List.copyOf(commonVariables);
        }
    }

    /**
     * RUN "file"[,R]; {@code keepVariables} is the R option, which also
     * leaves files open.
     */
    record RunRequest(String fileName, boolean keepVariables) implements PendingRequest {
    }

    record MergeRequest(String fileName) implements PendingRequest {
    }
}
