package org.mbasiconjava.io;

/**
 * OPEN modes. The letter is the one used by the {@code OPEN "O",#1,...} form.
 */
public enum FileMode {
    INPUT('I'),
    OUTPUT('O'),
    APPEND('A'),
    RANDOM('R');

    private final char letter;

    FileMode(char letter) {
        this.letter = letter;
    }

    public static FileMode fromLetter(char c) {
        for (FileMode mode : values()) {
            if (mode.letter == Character.toUpperCase(c)) {
                return mode;
            }
        }
        return null;
    }

    public char letter() {
        return letter;
    }

    public boolean isSequential() {
        return this != RANDOM;
    }
}
