package org.mbasiconjava.runtime;

import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.Program;
import org.mbasiconjava.frontend.astnode.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Random access to the program's statements by (line, statement index).
 * <p>
 * Lines are kept in a sorted map so {@link #next(ProgramCounter)} is a
 * ceiling lookup. Merged lines replace same-numbered lines wholesale.
 */
public class StatementTable {
    private final TreeMap<Integer, Line> lines = new TreeMap<>();

    /**
     * Replaces the table contents with the lines of a program.
     */
    public void build(Program program) {
        lines.clear();
        merge(program);
    }

    /**
     * Overlays another program's lines: same numbers are replaced, new
     * numbers are inserted in order.
     */
    public void merge(Program program) {
        for (Line line : program.lines()) {
            lines.put(line.number(), line);
        }
    }

    /**
     * Removes the lines numbered {@code from} to {@code to} inclusive.
     */
    public void deleteRange(int from, int to) {
        if (from > to) {
            return;
        }
        lines.subMap(from, true, to, true).clear();
    }

    public void clear() {
        lines.clear();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int size() {
        return lines.size();
    }

    public List<Integer> lineNumbers() {
        return new ArrayList<>(lines.keySet());
    }

    public String lineText(int number) {
        Line line = lines.get(number);
        return line == null ? null : line.text();
    }

    public Line line(int number) {
        return lines.get(number);
    }

    /**
     * The lines in ascending order, as they would be re-listed.
     */
    public Program toProgram() {
        return new Program(new ArrayList<>(lines.values()));
    }

    public boolean valid(ProgramCounter pc) {
        if (pc == null || !pc.isRunning()) {
            return false;
        }
        Line line = lines.get(pc.line());
        return line != null && pc.statement() >= 0 && pc.statement() < line.statements().size();
    }

    /**
     * Returns the statement at the counter, or null when it addresses nothing.
     */
    public Statement get(ProgramCounter pc) {
        if (!valid(pc)) {
            return null;
        }
        return lines.get(pc.line()).statements().get(pc.statement());
    }

    public ProgramCounter first() {
        return firstAtOrAfter(Integer.MIN_VALUE);
    }

    /**
     * The statement after {@code pc}: the next one on the same line, else
     * the first statement of the next higher line, else a halted counter.
     */
    public ProgramCounter next(ProgramCounter pc) {
        if (pc.isHalted()) {
            return pc;
        }
        Line line = lines.get(pc.line());
        if (line != null && pc.statement() + 1 < line.statements().size()) {
            return ProgramCounter.running(pc.line(), pc.statement() + 1);
        }
        if (pc.line() == Integer.MAX_VALUE) {
            return ProgramCounter.halted(StopReason.END);
        }
        return firstAtOrAfter(pc.line() + 1);
    }

    /**
     * Resolves a line number to its first statement. A missing line yields a
     * halted counter with reason {@link StopReason#ERROR}.
     */
    public ProgramCounter findLine(int number) {
        Line line = lines.get(number);
        if (line == null || line.statements().isEmpty()) {
            return ProgramCounter.halted(StopReason.ERROR);
        }
        return ProgramCounter.running(number, 0);
    }

    private ProgramCounter firstAtOrAfter(int number) {
        for (Map.Entry<Integer, Line> entry : lines.tailMap(number, true).entrySet()) {
            if (!entry.getValue().statements().isEmpty()) {
                return ProgramCounter.running(entry.getKey(), 0);
            }
        }
        return ProgramCounter.halted(StopReason.END);
    }
}
