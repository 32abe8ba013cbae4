package com.lyshra.open.desk.integration.exception;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskErrorInfo;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Raised to the caller when an action executor fails. The message is ready to show to the user.
 */
@Getter
@ToString
public class LyshraOpenDeskActionExecutionException extends RuntimeException implements ILyshraOpenDeskException {
    protected final ILyshraOpenDeskErrorInfo errorInfo;
    protected final Map<String, String> templateVariables;
    protected final Throwable rootCause;

    public LyshraOpenDeskActionExecutionException(
            ILyshraOpenDeskErrorInfo errorInfo,
            Map<String, String> templateVariables,
            String message,
            Throwable rootCause) {
        super(message, rootCause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables;
        this.rootCause = rootCause;
    }

    public LyshraOpenDeskActionExecutionException(ILyshraOpenDeskErrorInfo errorInfo, Map<String, String> templateVariables, String message) {
        this(errorInfo, templateVariables, message, null);
    }
}
