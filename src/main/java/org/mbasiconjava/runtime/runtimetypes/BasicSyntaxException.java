package org.mbasiconjava.runtime.runtimetypes;

import java.io.Serial;

/**
 * A lexical or parse fault reported by the program loader, positioned by
 * source line and column. Fatal to a load; when it surfaces through MERGE,
 * CHAIN or RUN the interpreter turns it into a trappable syntax error.
 */
public class BasicSyntaxException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public BasicSyntaxException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at line " + line + ", column " + column;
    }
}
