package org.mbasiconjava;

import org.mbasiconjava.core.Configuration;

/**
 * Per-engine settings. Fields are public and mutable, the host fills them
 * in before constructing an {@link org.mbasiconjava.backend.interpreter.Interpreter}.
 */
public class EngineOptions implements Cloneable {
    public boolean debugEnabled = false;
    public boolean traceOnStart = false; // same as starting with TRON
    public int consoleWidth = Configuration.defaultConsoleWidth;
    public int defaultRecordLength = Configuration.defaultRecordLength;
    public int maxOpenFiles = Configuration.maxOpenFiles;
    public Long randomSeed = null; // null means seed from the clock

    @Override
    public EngineOptions clone() {
        try {
            return (EngineOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "EngineOptions{\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    traceOnStart=" + traceOnStart + ",\n" +
                "    consoleWidth=" + consoleWidth + ",\n" +
                "    defaultRecordLength=" + defaultRecordLength + ",\n" +
                "    maxOpenFiles=" + maxOpenFiles + ",\n" +
                "    randomSeed=" + randomSeed + "\n" +
                "}";
    }
}
