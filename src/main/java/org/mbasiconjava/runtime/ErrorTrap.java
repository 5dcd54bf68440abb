package org.mbasiconjava.runtime;

/**
 * The handler registered by ON ERROR GOTO/GOSUB.
 */
public record ErrorTrap(int line, boolean gosub) {
}
