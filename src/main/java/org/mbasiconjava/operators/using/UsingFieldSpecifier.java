package org.mbasiconjava.operators.using;

/**
 * One field of a PRINT USING format string.
 */
public class UsingFieldSpecifier {

    public enum Kind {
        NUMERIC,
        FIRST_CHARACTER, // !
        WHOLE_STRING,    // &
        FIXED_STRING     // \  \
    }

    public Kind kind = Kind.NUMERIC;
    public String raw = "";

    // Numeric fields
    public int digitPositions;       // # plus the positions taken by $$, ** and commas
    public int decimalPositions;     // # after the decimal point
    public boolean decimalPoint;
    public boolean commas;
    public boolean leadingSign;      // leading +
    public char trailingSign;        // '+', '-' or 0
    public boolean floatingDollar;   // $$ or **$
    public boolean asteriskFill;     // ** or **$
    public boolean exponential;      // ^^^^

    // String fields
    public int stringWidth;

    /**
     * Total columns the field occupies when the value fits.
     */
    public int width() {
        return switch (kind) {
            case FIRST_CHARACTER -> 1;
            case WHOLE_STRING -> 0;
            case FIXED_STRING -> stringWidth;
            case NUMERIC -> digitPositions
                    + (decimalPoint ? 1 + decimalPositions : 0)
                    + (leadingSign ? 1 : 0)
                    + (trailingSign != 0 ? 1 : 0)
                    + (exponential ? 4 : 0);
        };
    }

    public boolean isNumeric() {
        return kind == Kind.NUMERIC;
    }
}
