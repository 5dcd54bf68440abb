package org.mbasiconjava.core;

/**
 * Central configuration class for the BASIC execution engine.
 * Contains constants that fix the dialect's geometry and resource limits.
 * <p>
 * Values that a host may want to change per run (console width, record
 * length, seeds) have their defaults here and are overridden through
 * {@link org.mbasiconjava.EngineOptions}.
 */
public final class Configuration {

    // Version information
    public static final String engineVersion = "1.0.0";
    public static final String dialectName = "MBASIC 5.21";

    // Program geometry
    public static final int maxLineNumber = 65529;
    public static final int directModeLine = 65535;

    // Console
    public static final int defaultConsoleWidth = 80;
    public static final int printZoneWidth = 14;

    // Files
    public static final int maxOpenFiles = 15;
    public static final int defaultRecordLength = 128;

    // Storage limits
    public static final int autoDimensionBound = 10;
    public static final int maxStringLength = 255;
    public static final int freeMemory = 32767;
    public static final int maxArrayElements = 1 << 20;
    public static final int maxFunctionDepth = 100;

    // Prevent instantiation
    private Configuration() {
    }

    public static String getBanner() {
        return "MBasicOnJava " + engineVersion + " (" + dialectName + " compatible)";
    }
}
