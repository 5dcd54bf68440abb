package org.mbasiconjava.io;

import org.mbasiconjava.core.Configuration;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Console on the process streams. Input blocks until a line arrives; end of
 * input is reported as "no line available".
 */
public class StandardConsole implements ConsoleIO {
    private final InputStream inputStream;
    private final BufferedReader reader;
    private final PrintStream out;
    private int column;
    private int width = Configuration.defaultConsoleWidth;

    public StandardConsole() {
        this(System.in, System.out);
    }

    public StandardConsole(InputStream inputStream, PrintStream out) {
        this.inputStream = inputStream;
        this.reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.ISO_8859_1));
        this.out = out;
    }

    @Override
    public void print(String text) {
        out.print(text);
        out.flush();
        column = ConsoleIO.columnAfter(column, text);
    }

    @Override
    public String input(String prompt) {
        if (prompt != null && !prompt.isEmpty()) {
            print(prompt);
        }
        try {
            String line = reader.readLine();
            column = 0;
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("console read failed", e);
        }
    }

    @Override
    public Character inkey() {
        try {
            if (reader.ready() || inputStream.available() > 0) {
                int c = reader.read();
                return c < 0 ? null : (char) c;
            }
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("console read failed", e);
        }
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

    @Override
    public void flush() {
        out.flush();
    }
}
