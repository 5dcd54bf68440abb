package org.mbasiconjava.io;

import org.mbasiconjava.core.Configuration;

/**
 * The console as seen by PRINT, INPUT and the cursor-related built-ins.
 * Implementations track the output column so comma zones, TAB and POS line
 * up with what is already on the line.
 */
public interface ConsoleIO {

    void print(String text);

    /**
     * Shows the prompt and reads one line without its terminator. Returns
     * null when no line is available yet, which makes INPUT wait.
     */
    String input(String prompt);

    /**
     * Non-blocking key read; null when no key is pending.
     */
    default Character inkey() {
        return null;
    }

    int getColumn();

    void setColumn(int column);

    int getWidth();

    void setWidth(int width);

    default void clearScreen() {
        print("\033[2J\033[H");
        setColumn(0);
    }

    default void flush() {
    }

    /**
     * Column after writing {@code text} starting at {@code column}: newline
     * and carriage return go to column 0, tab moves to the next print zone.
     */
    static int columnAfter(int column, String text) {
        int col = column;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n', '\r' -> col = 0;
                case '\t' -> col = (col / Configuration.printZoneWidth + 1) * Configuration.printZoneWidth;
                default -> col++;
            }
        }
        return col;
    }
}
