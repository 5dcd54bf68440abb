package org.mbasiconjava.backend.interpreter;

import org.mbasiconjava.runtime.ProgramCounter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-interpreter bookkeeping that is not program state: the jump target
 * set by the current statement, error and request reporting, and the
 * flags observed at tick boundaries.
 */
public class InterpreterState {
    private ProgramCounter nextPc;
    private ProgramCounter continuePc;
    private ErrorInfo error;
    private PendingRequest pendingRequest;
    private ProgramCounter requestPc;
    private boolean pauseRequested;
    private boolean skipBreakpoint;
    private boolean inputPromptShown;
    private int lastTracedLine = -1;
    private long statementsExecuted;
    private final Deque<String> inputLines = new ArrayDeque<>();

    /**
     * Forgets the results of a previous run before a new one starts.
     */
    public void prepareForRun() {
        nextPc = null;
        continuePc = null;
        error = null;
        pendingRequest = null;
        requestPc = null;
        skipBreakpoint = false;
        inputPromptShown = false;
        lastTracedLine = -1;
    }

    /**
     * Target chosen by the statement being executed, applied after it.
     */
    public ProgramCounter getNextPc() {
        return nextPc;
    }

    public void setNextPc(ProgramCounter nextPc) {
        this.nextPc = nextPc;
    }

    public ProgramCounter getContinuePc() {
        return continuePc;
    }

    public void setContinuePc(ProgramCounter continuePc) {
        this.continuePc = continuePc;
    }

    public ErrorInfo getError() {
        return error;
    }

    public void setError(ErrorInfo error) {
        this.error = error;
    }

    public PendingRequest getPendingRequest() {
        return pendingRequest;
    }

    public ProgramCounter getRequestPc() {
        return requestPc;
    }

    public void setPendingRequest(PendingRequest pendingRequest, ProgramCounter requestPc) {
        this.pendingRequest = pendingRequest;
        this.requestPc = requestPc;
    }

    public void clearPendingRequest() {
        pendingRequest = null;
        requestPc = null;
    }

    public boolean isPauseRequested() {
        return pauseRequested;
    }

    public void setPauseRequested(boolean pauseRequested) {
        this.pauseRequested = pauseRequested;
    }

    public boolean isSkipBreakpoint() {
        return skipBreakpoint;
    }

    public void setSkipBreakpoint(boolean skipBreakpoint) {
        this.skipBreakpoint = skipBreakpoint;
    }

    public boolean isInputPromptShown() {
        return inputPromptShown;
    }

    public void setInputPromptShown(boolean inputPromptShown) {
        this.inputPromptShown = inputPromptShown;
    }

    public int getLastTracedLine() {
        return lastTracedLine;
    }

    public void setLastTracedLine(int lastTracedLine) {
        this.lastTracedLine = lastTracedLine;
    }

    public long getStatementsExecuted() {
        return statementsExecuted;
    }

    public void countStatement() {
        statementsExecuted++;
    }

    /**
     * Lines supplied by the host for a waiting INPUT.
     */
    public Deque<String> inputLines() {
        return inputLines;
    }
}
