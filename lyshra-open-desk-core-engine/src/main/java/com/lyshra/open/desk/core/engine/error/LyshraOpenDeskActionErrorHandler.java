package com.lyshra.open.desk.core.engine.error;

import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.exception.codes.LyshraOpenDeskErrorCodes;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskErrorInfo;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.exception.LyshraOpenDeskActionExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

@Slf4j
public final class LyshraOpenDeskActionErrorHandler {

    private LyshraOpenDeskActionErrorHandler() {
    }

    /**
     * Surfaces every failure of an executor as a {@link LyshraOpenDeskActionExecutionException}.
     * Failures that already carry an error code pass through unchanged. Nothing is retried.
     */
    public static Mono<Void> applyErrorHandling(
            Mono<Void> source,
            ILyshraOpenDeskAction action,
            ILyshraOpenDeskMessageSource messageSource) {

        return source.onErrorMap(
                error -> !(error instanceof LyshraOpenDeskActionExecutionException),
                error -> toExecutionException(error, action, messageSource));
    }

    public static @NotNull LyshraOpenDeskActionExecutionException toExecutionException(
            Throwable error,
            ILyshraOpenDeskAction action,
            ILyshraOpenDeskMessageSource messageSource) {

        String reason = Optional.ofNullable(error.getMessage()).orElse(error.getClass().getSimpleName());
        log.error("Action [{}] failed: [{}]", action.getId(), reason, error);
        return create(
                LyshraOpenDeskErrorCodes.ACTION_EXECUTION_FAILED,
                Map.of("action", action.getLabel(), "reason", reason),
                messageSource,
                error);
    }

    public static @NotNull LyshraOpenDeskActionExecutionException create(
            ILyshraOpenDeskErrorInfo errorInfo,
            Map<String, String> templateVariables,
            ILyshraOpenDeskMessageSource messageSource,
            Throwable rootCause) {

        String message = messageSource.getMessage(errorInfo.getErrorTemplate(), templateVariables);
        return new LyshraOpenDeskActionExecutionException(errorInfo, templateVariables, message, rootCause);
    }

    public static @NotNull LyshraOpenDeskActionExecutionException create(
            ILyshraOpenDeskErrorInfo errorInfo,
            Map<String, String> templateVariables,
            ILyshraOpenDeskMessageSource messageSource) {
        return create(errorInfo, templateVariables, messageSource, null);
    }

    public static String resolution(ILyshraOpenDeskErrorInfo errorInfo, Map<String, String> templateVariables, ILyshraOpenDeskMessageSource messageSource) {
        return messageSource.getMessage(errorInfo.getResolutionTemplate(), templateVariables);
    }
}
