package org.mbasiconjava.backend.interpreter;

import org.mbasiconjava.runtime.ProgramCounter;
import org.mbasiconjava.runtime.StopReason;

/**
 * How a run ended: the halting reason, the unhandled error if any, and a
 * pending CHAIN/RUN/MERGE request if any.
 */
public record ExecutionOutcome(StopReason reason, ErrorInfo error, PendingRequest request, ProgramCounter pc) {

    public boolean isError() {
        return reason == StopReason.ERROR;
    }

    public boolean hasRequest() {
        return request != null;
    }

    public boolean isFinished() {
        return reason == StopReason.END && request == null;
    }
}
