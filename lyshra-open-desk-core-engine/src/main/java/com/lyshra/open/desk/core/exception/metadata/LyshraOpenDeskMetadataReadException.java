package com.lyshra.open.desk.core.exception.metadata;

import com.lyshra.open.desk.core.exception.LyshraOpenDeskRuntimeException;

public class LyshraOpenDeskMetadataReadException extends LyshraOpenDeskRuntimeException {
    public LyshraOpenDeskMetadataReadException(String message) {
        super(message);
    }
    public LyshraOpenDeskMetadataReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
