package org.mbasiconjava.runtime;

/**
 * A control-stack entry. GOSUB frames hold the return address, WHILE frames
 * hold the address of the WHILE test. {@code errorTrap} marks the frame
 * pushed by ON ERROR GOSUB.
 */
public record ControlFrame(Kind kind, ProgramCounter pc, boolean errorTrap) {

    public enum Kind {
        GOSUB,
        WHILE
    }

    public static ControlFrame gosub(ProgramCounter returnPc) {
        return new ControlFrame(Kind.GOSUB, returnPc, false);
    }

    public static ControlFrame errorGosub(ProgramCounter returnPc) {
        return new ControlFrame(Kind.GOSUB, returnPc, true);
    }

    public static ControlFrame whileLoop(ProgramCounter testPc) {
        return new ControlFrame(Kind.WHILE, testPc, false);
    }
}
