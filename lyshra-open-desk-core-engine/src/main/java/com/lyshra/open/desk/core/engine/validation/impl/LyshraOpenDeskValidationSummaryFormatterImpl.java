package com.lyshra.open.desk.core.engine.validation.impl;

import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.engine.validation.ILyshraOpenDeskValidationSummaryFormatter;
import com.lyshra.open.desk.core.util.CommonUtil;
import com.lyshra.open.desk.integration.contract.validation.ILyshraOpenDeskValidationError;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskValidationErrorType;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationSummary;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders errors the way the desk's message dialog expects: missing mandatory labels as an HTML list,
 * other errors one per line.
 */
@RequiredArgsConstructor
public class LyshraOpenDeskValidationSummaryFormatterImpl implements ILyshraOpenDeskValidationSummaryFormatter {

    private static final String LINE_BREAK = "<br>";

    private final ILyshraOpenDeskMessageSource messageSource;

    @Override
    public LyshraOpenDeskValidationSummary format(List<? extends ILyshraOpenDeskValidationError> errors, String documentType) {
        List<? extends ILyshraOpenDeskValidationError> allErrors = CommonUtil.nonNullList(errors);
        List<String> missingLabels = allErrors.stream()
                .filter(error -> error.getType() == LyshraOpenDeskValidationErrorType.MANDATORY)
                .map(ILyshraOpenDeskValidationError::getLabel)
                .toList();
        List<String> otherMessages = allErrors.stream()
                .filter(error -> error.getType() != LyshraOpenDeskValidationErrorType.MANDATORY)
                .map(ILyshraOpenDeskValidationError::getMessage)
                .toList();

        StringBuilder message = new StringBuilder();
        if (!missingLabels.isEmpty()) {
            message.append(CommonUtil.isNotBlank(documentType)
                    ? messageSource.getMessage("validation.summary.mandatory.doctype", Map.of("doctype", documentType))
                    : messageSource.getMessage("validation.summary.mandatory"));
            message.append(LINE_BREAK).append(LINE_BREAK)
                    .append(missingLabels.stream().collect(Collectors.joining("</li><li>", "<ul><li>", "</li></ul>")));
        }
        if (!otherMessages.isEmpty()) {
            if (message.length() > 0) {
                message.append(LINE_BREAK).append(LINE_BREAK);
            }
            message.append(String.join(LINE_BREAK, otherMessages));
        }
        String title = missingLabels.isEmpty()
                ? messageSource.getMessage("validation.summary.title.error")
                : messageSource.getMessage("validation.summary.title.missing");
        return new LyshraOpenDeskValidationSummary(title, message.toString());
    }
}
