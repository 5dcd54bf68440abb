package org.mbasiconjava.operators;

import org.mbasiconjava.io.ConsoleIO;
import org.mbasiconjava.runtime.BasicRuntime;

/**
 * What built-in functions may see of the running interpreter.
 */
public interface BuiltinContext {

    BasicRuntime runtime();

    ConsoleIO console();

    ConsoleIO printer();

    /**
     * Column of the device the current PRINT writes to; the console column
     * outside PRINT.
     */
    int printColumn();
}
