package org.mbasiconjava.runtime;

/**
 * Why the program counter is (or is not) executing.
 */
public enum StopReason {
    RUNNING,
    END,
    STOP,
    BREAKPOINT,
    ERROR,
    INPUT_WAIT,
    BREAK
}
