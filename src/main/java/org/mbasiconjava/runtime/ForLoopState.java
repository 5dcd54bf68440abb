package org.mbasiconjava.runtime;

/**
 * An active FOR loop, keyed in the runtime by its variable name.
 *
 * @param variable loop variable
 * @param resumePc the statement following the FOR
 * @param end      terminating value
 * @param step     increment added by each NEXT
 */
public record ForLoopState(String variable, ProgramCounter resumePc, double end, double step) {
}
