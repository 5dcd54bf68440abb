package org.mbasiconjava.runtime.runtimetypes;

/**
 * Legacy numeric error codes and their messages.
 */
public final class ErrorCode {
    public static final int NEXT_WITHOUT_FOR = 1;
    public static final int SYNTAX_ERROR = 2;
    public static final int RETURN_WITHOUT_GOSUB = 3;
    public static final int OUT_OF_DATA = 4;
    public static final int ILLEGAL_FUNCTION_CALL = 5;
    public static final int OVERFLOW = 6;
    public static final int OUT_OF_MEMORY = 7;
    public static final int UNDEFINED_LINE = 8;
    public static final int SUBSCRIPT_OUT_OF_RANGE = 9;
    public static final int DUPLICATE_DEFINITION = 10;
    public static final int DIVISION_BY_ZERO = 11;
    public static final int ILLEGAL_DIRECT = 12;
    public static final int TYPE_MISMATCH = 13;
    public static final int OUT_OF_STRING_SPACE = 14;
    public static final int STRING_TOO_LONG = 15;
    public static final int STRING_FORMULA_TOO_COMPLEX = 16;
    public static final int CANT_CONTINUE = 17;
    public static final int UNDEFINED_USER_FUNCTION = 18;
    public static final int NO_RESUME = 19;
    public static final int RESUME_WITHOUT_ERROR = 20;
    public static final int MISSING_OPERAND = 22;
    public static final int LINE_BUFFER_OVERFLOW = 23;
    public static final int FOR_WITHOUT_NEXT = 26;
    public static final int WHILE_WITHOUT_WEND = 29;
    public static final int WEND_WITHOUT_WHILE = 30;
    public static final int FIELD_OVERFLOW = 50;
    public static final int INTERNAL_ERROR = 51;
    public static final int BAD_FILE_NUMBER = 52;
    public static final int FILE_NOT_FOUND = 53;
    public static final int BAD_FILE_MODE = 54;
    public static final int FILE_ALREADY_OPEN = 55;
    public static final int DISK_IO_ERROR = 57;
    public static final int FILE_ALREADY_EXISTS = 58;
    public static final int DISK_FULL = 61;
    public static final int INPUT_PAST_END = 62;
    public static final int BAD_RECORD_NUMBER = 63;
    public static final int BAD_FILE_NAME = 64;
    public static final int DIRECT_STATEMENT_IN_FILE = 66;
    public static final int TOO_MANY_FILES = 67;

    private ErrorCode() {
    }

    public static String message(int code) {
        return switch (code) {
            case NEXT_WITHOUT_FOR -> "NEXT without FOR";
            case SYNTAX_ERROR -> "Syntax error";
            case RETURN_WITHOUT_GOSUB -> "RETURN without GOSUB";
            case OUT_OF_DATA -> "Out of DATA";
            case ILLEGAL_FUNCTION_CALL -> "Illegal function call";
            case OVERFLOW -> "Overflow";
            case OUT_OF_MEMORY -> "Out of memory";
            case UNDEFINED_LINE -> "Undefined line number";
            case SUBSCRIPT_OUT_OF_RANGE -> "Subscript out of range";
            case DUPLICATE_DEFINITION -> "Duplicate Definition";
            case DIVISION_BY_ZERO -> "Division by zero";
            case ILLEGAL_DIRECT -> "Illegal direct";
            case TYPE_MISMATCH -> "Type mismatch";
            case OUT_OF_STRING_SPACE -> "Out of string space";
            case STRING_TOO_LONG -> "String too long";
            case STRING_FORMULA_TOO_COMPLEX -> "String formula too complex";
            case CANT_CONTINUE -> "Can't continue";
            case UNDEFINED_USER_FUNCTION -> "Undefined user function";
            case NO_RESUME -> "No RESUME";
            case RESUME_WITHOUT_ERROR -> "RESUME without error";
            case MISSING_OPERAND -> "Missing operand";
            case LINE_BUFFER_OVERFLOW -> "Line buffer overflow";
            case FOR_WITHOUT_NEXT -> "FOR without NEXT";
            case WHILE_WITHOUT_WEND -> "WHILE without WEND";
            case WEND_WITHOUT_WHILE -> "WEND without WHILE";
            case FIELD_OVERFLOW -> "Field overflow";
            case INTERNAL_ERROR -> "Internal error";
            case BAD_FILE_NUMBER -> "Bad file number";
            case FILE_NOT_FOUND -> "File not found";
            case BAD_FILE_MODE -> "Bad file mode";
            case FILE_ALREADY_OPEN -> "File already open";
            case DISK_IO_ERROR -> "Disk I/O error";
            case FILE_ALREADY_EXISTS -> "File already exists";
            case DISK_FULL -> "Disk full";
            case INPUT_PAST_END -> "Input past end";
            case BAD_RECORD_NUMBER -> "Bad record number";
            case BAD_FILE_NAME -> "Bad file name";
            case DIRECT_STATEMENT_IN_FILE -> "Direct statement in file";
            case TOO_MANY_FILES -> "Too many files";
            default -> "Unprintable error";
        };
    }
}
