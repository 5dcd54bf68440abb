package org.mbasiconjava.frontend.astnode;

/**
 * What follows a PRINT item. NONE marks the last item of a statement that
 * ends without a separator, which is what produces the newline.
 */
public enum PrintSeparator {
    SEMICOLON,
    COMMA,
    NONE
}
