package com.lyshra.open.desk.core.exception;

public class LyshraOpenDeskException extends Exception {
    public LyshraOpenDeskException(String message) {
        super(message);
    }
    public LyshraOpenDeskException(String message, Throwable cause) {
        super(message, cause);
    }
    public LyshraOpenDeskException(Throwable cause) {
        super(cause);
    }
}
