package org.mbasiconjava.runtime;

/**
 * A (line, statement index) address into the {@link StatementTable} plus
 * the halting reason. Only {@link StopReason#RUNNING} counters address a
 * statement that will execute.
 */
public record ProgramCounter(int line, int statement, StopReason reason) {

    public static ProgramCounter running(int line, int statement) {
        return new ProgramCounter(line, statement, StopReason.RUNNING);
    }

    public static ProgramCounter halted(StopReason reason) {
        return new ProgramCounter(0, 0, reason);
    }

    public ProgramCounter withReason(StopReason newReason) {
        return new ProgramCounter(line, statement, newReason);
    }

    public boolean isRunning() {
        return reason == StopReason.RUNNING;
    }

    public boolean isHalted() {
        return reason != StopReason.RUNNING;
    }

    public boolean samePosition(ProgramCounter other) {
        return other != null && line == other.line && statement == other.statement;
    }

    @Override
    public String toString() {
        return line + ":" + statement + (isRunning() ? "" : " (" + reason + ")");
    }
}
