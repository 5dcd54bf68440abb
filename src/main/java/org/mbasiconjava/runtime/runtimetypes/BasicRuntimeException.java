package org.mbasiconjava.runtime.runtimetypes;

import java.io.Serial;

/**
 * A trappable runtime fault carrying a legacy error code.
 * <p>
 * {@link #getMessage()} is the standard message for the code, which is what
 * the host reports as {@code ?<message> in <line>}. The optional detail names
 * the concrete cause and only shows up in debug output.
 */
public class BasicRuntimeException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int code;
    private final String detail;

    public BasicRuntimeException(int code) {
        this(code, null);
    }

    public BasicRuntimeException(int code, String detail) {
        super(ErrorCode.message(code));
        this.code = code;
        this.detail = detail;
    }

    public BasicRuntimeException(int code, String detail, Throwable cause) {
        super(ErrorCode.message(code), cause);
        this.code = code;
        this.detail = detail;
    }

    public int getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "BasicRuntimeException{code=" + code + ", message=" + getMessage()
                + (detail == null ? "" : ", detail=" + detail) + "}";
    }
}
