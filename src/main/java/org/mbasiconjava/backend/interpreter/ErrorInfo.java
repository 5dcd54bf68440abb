package org.mbasiconjava.backend.interpreter;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.runtime.ProgramCounter;

/**
 * An unhandled runtime error: code, standard message, optional detail and
 * where it happened.
 */
public record ErrorInfo(int code, String message, String detail, ProgramCounter pc) {

    public int line() {
        return pc.line();
    }

    public boolean inDirectMode() {
        return pc.line() == Configuration.directModeLine;
    }

    /**
     * The report the host prints: {@code ?<message> in <line>}, or
     * {@code ?<message>} for direct mode.
     */
    public String format() {
        return inDirectMode() ? "?" + message : "?" + message + " in " + line();
    }
}
