package org.mbasiconjava.frontend.astnode;

import java.util.List;

/**
 * A numbered program line: its statements in source order and the text it
 * was parsed from.
 */
public record Line(int number, List<Statement> statements, String text) {
    public Line {
        statements = List.copyOf(statements);
        text = text == null ? "" : text;
    }

    public Line(int number, List<Statement> statements) {
        this(number, statements, "");
    }
}
