package org.mbasiconjava.backend.interpreter;

import org.mbasiconjava.io.ConsoleIO;
import org.mbasiconjava.runtime.FileTable;
import org.mbasiconjava.runtime.OpenFile;

import java.io.IOException;

/**
 * Where PRINT, PRINT USING and WRITE output goes, with the column that
 * comma zones and TAB are measured from.
 */
public interface PrintTarget {

    void emit(String text);

    int column();

    int width();

    static PrintTarget console(ConsoleIO console) {
        return new PrintTarget() {
            @Override
            public void emit(String text) {
                console.print(text);
            }

            @Override
            public int column() {
                return console.getColumn();
            }

            @Override
            public int width() {
                return console.getWidth();
            }
        };
    }

    static PrintTarget file(OpenFile file) {
        return new PrintTarget() {
            @Override
            public void emit(String text) {
                try {
                    file.handle().write(text);
                } catch (IOException e) {
                    throw FileTable.handleIOException(e, "PRINT #" + file.number());
                }
                file.setColumn(ConsoleIO.columnAfter(file.column(), text));
            }

            @Override
            public int column() {
                return file.column();
            }

            @Override
            public int width() {
                return Integer.MAX_VALUE;
            }
        };
    }
}
