package org.mbasiconjava.runtime;

import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.Statement;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The DATA values of the whole program in line order, and a forward cursor
 * over them.
 */
public class DataCursor {
    private final List<BasicValue> values = new ArrayList<>();
    // line number -> index of the first value that line contributes
    private final TreeMap<Integer, Integer> lineStarts = new TreeMap<>();
    private int position;

    /**
     * Rebuilds the value list from every DATA statement in the table.
     * The cursor keeps its index when it is still in range.
     */
    public void collect(StatementTable table) {
        values.clear();
        lineStarts.clear();
        for (int number : table.lineNumbers()) {
            Line line = table.line(number);
            for (Statement statement : line.statements()) {
                if (statement instanceof Statement.Data data) {
                    lineStarts.putIfAbsent(number, values.size());
                    values.addAll(data.values());
                }
            }
        }
        position = Math.min(position, values.size());
    }

    public BasicValue read() {
        if (position >= values.size()) {
            throw new BasicRuntimeException(ErrorCode.OUT_OF_DATA);
        }
        return values.get(position++);
    }

    public void restore() {
        position = 0;
    }

    /**
     * Moves the cursor to the first value contributed at or after the line;
     * past the end when no DATA follows it.
     */
    public void restore(int line) {
        Map.Entry<Integer, Integer> entry = lineStarts.ceilingEntry(line);
        position = entry == null ? values.size() : entry.getValue();
    }

    public void clear() {
        values.clear();
        lineStarts.clear();
        position = 0;
    }

    public boolean hasMore() {
        return position < values.size();
    }

    public int position() {
        return position;
    }

    public int size() {
        return values.size();
    }
}
