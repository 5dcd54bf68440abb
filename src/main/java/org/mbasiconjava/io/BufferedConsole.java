package org.mbasiconjava.io;

import org.mbasiconjava.core.Configuration;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * In-memory console: output accumulates in a buffer and input comes from
 * queued lines and keys. Used for embedding and tests.
 */
public class BufferedConsole implements ConsoleIO {
    private final StringBuilder output = new StringBuilder();
    private final Deque<String> lines = new ArrayDeque<>();
    private final Deque<Character> keys = new ArrayDeque<>();
    private int column;
    private int width = Configuration.defaultConsoleWidth;

    public BufferedConsole(String... inputLines) {
        lines.addAll(Arrays.asList(inputLines));
    }

    public void addInput(String... inputLines) {
        lines.addAll(Arrays.asList(inputLines));
    }

    public void addKeys(String typed) {
        for (char c : typed.toCharArray()) {
            keys.add(c);
        }
    }

    public String getOutput() {
        return output.toString();
    }

    public void clearOutput() {
        output.setLength(0);
    }

    @Override
    public void print(String text) {
        output.append(text);
        column = ConsoleIO.columnAfter(column, text);
    }

    @Override
    public String input(String prompt) {
        if (prompt != null && !prompt.isEmpty()) {
            print(prompt);
        }
        String line = lines.poll();
        if (line != null) {
            column = 0;
        }
        return line;
    }

    @Override
    public Character inkey() {
        return keys.poll();
    }

    @Override
    public int getColumn() {
        return column;
    }

    @Override
    public void setColumn(int column) {
        this.column = column;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public void setWidth(int width) {
        this.width = width;
    }
}
