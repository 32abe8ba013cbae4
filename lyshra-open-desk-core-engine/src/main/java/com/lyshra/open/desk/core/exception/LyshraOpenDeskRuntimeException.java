package com.lyshra.open.desk.core.exception;

public class LyshraOpenDeskRuntimeException extends RuntimeException {
    public LyshraOpenDeskRuntimeException(String message) {
        super(message);
    }
    public LyshraOpenDeskRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public LyshraOpenDeskRuntimeException(Throwable cause) {
        super(cause);
    }
}
