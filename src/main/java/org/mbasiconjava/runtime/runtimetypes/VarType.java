package org.mbasiconjava.runtime.runtimetypes;

/**
 * The four storage types of the dialect, each tied to its name suffix.
 */
public enum VarType {
    INTEGER('%'),
    SINGLE('!'),
    DOUBLE('#'),
    STRING('$');

    private final char suffix;

    VarType(char suffix) {
        this.suffix = suffix;
    }

    /**
     * Returns the type named by a variable-name suffix, or null when the
     * character is not a type suffix.
     */
    public static VarType fromSuffix(char c) {
        return switch (c) {
            case '%' -> INTEGER;
            case '!' -> SINGLE;
            case '#' -> DOUBLE;
            case '$' -> STRING;
            default -> null;
        };
    }

    /**
     * Returns the explicit type of a normalized variable name, or null when
     * the name carries no suffix.
     */
    public static VarType ofName(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        return fromSuffix(name.charAt(name.length() - 1));
    }

    public char suffix() {
        return suffix;
    }

    public boolean isNumeric() {
        return this != STRING;
    }
}
