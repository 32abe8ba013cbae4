package com.lyshra.open.desk.core.engine.validation.impl;

import com.lyshra.open.desk.core.engine.dependency.ILyshraOpenDeskDependencyResolver;
import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.engine.validation.ILyshraOpenDeskValidationEngine;
import com.lyshra.open.desk.core.engine.validation.LyshraOpenDeskFormatValidator;
import com.lyshra.open.desk.core.util.CommonUtil;
import com.lyshra.open.desk.integration.constant.LyshraOpenDeskConstants;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldFormat;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskValidationErrorType;
import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationError;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class LyshraOpenDeskValidationEngineImpl implements ILyshraOpenDeskValidationEngine {

    private static final String MANDATORY_MESSAGE = "validation.mandatory";
    private static final String TABLE_EMPTY_MESSAGE = "validation.table.empty";
    private static final String LENGTH_MESSAGE = "validation.length";
    private static final String ROW_MESSAGE = "validation.row";
    private static final String PROMPT_NAME_LABEL = "validation.prompt.name.label";
    private static final Map<LyshraOpenDeskFieldFormat, String> FORMAT_MESSAGES = Map.of(
            LyshraOpenDeskFieldFormat.EMAIL, "validation.format.email",
            LyshraOpenDeskFieldFormat.PHONE, "validation.format.phone",
            LyshraOpenDeskFieldFormat.URL, "validation.format.url",
            LyshraOpenDeskFieldFormat.NAME, "validation.format.name");

    private final ILyshraOpenDeskDependencyResolver dependencyResolver;
    private final ILyshraOpenDeskMessageSource messageSource;

    @Override
    public LyshraOpenDeskValidationResult validate(
            ILyshraOpenDeskDocTypeMetadata metadata,
            ILyshraOpenDeskDocument document,
            Map<String, ? extends ILyshraOpenDeskDocTypeMetadata> childMetadataByDocType) {

        if (metadata == null || document == null || document.isCancelled()) {
            return LyshraOpenDeskValidationResult.valid();
        }
        List<LyshraOpenDeskValidationError> errors = new ArrayList<>();
        if (isNamePromptMissing(metadata, document)) {
            String label = messageSource.getMessage(PROMPT_NAME_LABEL);
            errors.add(error(LyshraOpenDeskConstants.NEW_NAME, label,
                    messageSource.getMessage(MANDATORY_MESSAGE, Map.of("label", label)),
                    LyshraOpenDeskValidationErrorType.MANDATORY));
        }

        List<ILyshraOpenDeskFieldDefinition> fields = CommonUtil.nonNullList(metadata.getFields());
        LyshraOpenDeskDependencyOverrides overrides = dependencyResolver.resolve(fields, document);
        Map<String, ? extends ILyshraOpenDeskDocTypeMetadata> childMetadata = CommonUtil.nonNullMap(childMetadataByDocType);
        for (ILyshraOpenDeskFieldDefinition field : fields) {
            if (field == null || field.getFieldName() == null || !field.isDataBearing()) {
                continue;
            }
            Object value = document.get(field.getFieldName());
            checkMandatory(field, value, overrides).ifPresent(errors::add);
            errors.addAll(checkFormat(field, value));
            if (field.isTable()) {
                errors.addAll(checkChildRows(field, value, document, childMetadata));
            }
        }
        if (!errors.isEmpty()) {
            log.debug("Document of type [{}] failed validation with [{}] errors", metadata.getName(), errors.size());
        }
        return LyshraOpenDeskValidationResult.of(errors);
    }

    private static boolean isNamePromptMissing(ILyshraOpenDeskDocTypeMetadata metadata, ILyshraOpenDeskDocument document) {
        boolean prompt = metadata.getAutoname().map(LyshraOpenDeskConstants.AUTONAME_PROMPT::equals).orElse(false);
        return prompt
                && !LyshraOpenDeskValues.isTruthy(document.get(LyshraOpenDeskConstants.NAME))
                && !LyshraOpenDeskValues.isTruthy(document.get(LyshraOpenDeskConstants.NEW_NAME));
    }

    private Optional<LyshraOpenDeskValidationError> checkMandatory(
            ILyshraOpenDeskFieldDefinition field,
            Object value,
            LyshraOpenDeskDependencyOverrides overrides) {

        String fieldName = field.getFieldName();
        boolean readOnly = overrides.getDynamicallyReadOnly(fieldName).orElse(field.isReadOnly());
        if (readOnly || field.isHidden() || overrides.isHiddenByDependency(fieldName)) {
            return Optional.empty();
        }
        boolean mandatory = field.isRequired() || overrides.isDynamicallyRequired(fieldName);
        if (!mandatory) {
            return Optional.empty();
        }
        String label = field.getDisplayLabel();
        if (field.isTable()) {
            if (value instanceof List<?> rows && !rows.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(error(fieldName, label,
                    messageSource.getMessage(TABLE_EMPTY_MESSAGE, Map.of("label", label)),
                    LyshraOpenDeskValidationErrorType.MANDATORY));
        }
        if (!LyshraOpenDeskValues.isEmptyValue(value)) {
            return Optional.empty();
        }
        return Optional.of(error(fieldName, label,
                messageSource.getMessage(MANDATORY_MESSAGE, Map.of("label", label)),
                LyshraOpenDeskValidationErrorType.MANDATORY));
    }

    private List<LyshraOpenDeskValidationError> checkFormat(ILyshraOpenDeskFieldDefinition field, Object value) {
        if (LyshraOpenDeskValues.isEmptyValue(value) || field.isTable()) {
            return List.of();
        }
        List<LyshraOpenDeskValidationError> errors = new ArrayList<>(2);
        String label = field.getDisplayLabel();
        Optional<LyshraOpenDeskFieldFormat> format = field.getFormat();
        if (format.isPresent() && !LyshraOpenDeskFormatValidator.isValid(format.get(), LyshraOpenDeskValues.cstr(value))) {
            errors.add(error(field.getFieldName(), label,
                    messageSource.getMessage(FORMAT_MESSAGES.get(format.get()), Map.of("label", label)),
                    LyshraOpenDeskValidationErrorType.FORMAT));
        }
        Optional<Integer> maxLength = field.getMaxLength();
        if (maxLength.isPresent() && value instanceof CharSequence text && text.length() > maxLength.get()) {
            errors.add(error(field.getFieldName(), label,
                    messageSource.getMessage(LENGTH_MESSAGE, Map.of("label", label, "maxLength", String.valueOf(maxLength.get()))),
                    LyshraOpenDeskValidationErrorType.LENGTH));
        }
        return errors;
    }

    private List<LyshraOpenDeskValidationError> checkChildRows(
            ILyshraOpenDeskFieldDefinition tableField,
            Object value,
            ILyshraOpenDeskDocument parent,
            Map<String, ? extends ILyshraOpenDeskDocTypeMetadata> childMetadata) {

        Optional<? extends ILyshraOpenDeskDocTypeMetadata> rowMetadata = tableField.getOptions().map(childMetadata::get);
        if (rowMetadata.isEmpty() || !(value instanceof List<?> rows)) {
            return List.of();
        }
        List<ILyshraOpenDeskFieldDefinition> rowFields = CommonUtil.nonNullList(rowMetadata.get().getFields());
        String tableLabel = tableField.getDisplayLabel();
        List<LyshraOpenDeskValidationError> errors = new ArrayList<>();
        for (int index = 0; index < rows.size(); index++) {
            if (!(rows.get(index) instanceof Map<?, ?> rowValues)) {
                continue;
            }
            LyshraOpenDeskDocument row = toDocument(rowValues);
            LyshraOpenDeskDependencyOverrides overrides = dependencyResolver.resolve(rowFields, row, parent);
            int rowNumber = index + 1;
            for (ILyshraOpenDeskFieldDefinition field : rowFields) {
                if (field == null || field.getFieldName() == null || !field.isDataBearing()) {
                    continue;
                }
                Optional<LyshraOpenDeskValidationError> rowError = checkMandatory(field, row.get(field.getFieldName()), overrides);
                if (rowError.isPresent()) {
                    LyshraOpenDeskValidationError error = rowError.get();
                    errors.add(LyshraOpenDeskValidationError.builder()
                            .fieldName(tableField.getFieldName() + "." + index + "." + field.getFieldName())
                            .label(error.getLabel())
                            .message(messageSource.getMessage(ROW_MESSAGE,
                                    Map.of("row", String.valueOf(rowNumber), "message", error.getMessage())))
                            .type(error.getType())
                            .row(rowNumber)
                            .tableName(tableLabel)
                            .build());
                }
            }
        }
        return errors;
    }

    private static LyshraOpenDeskDocument toDocument(Map<?, ?> rowValues) {
        LyshraOpenDeskDocument row = new LyshraOpenDeskDocument();
        rowValues.forEach((key, rowValue) -> row.put(String.valueOf(key), rowValue));
        return row;
    }

    private static LyshraOpenDeskValidationError error(String fieldName, String label, String message, LyshraOpenDeskValidationErrorType type) {
        return LyshraOpenDeskValidationError.builder()
                .fieldName(fieldName)
                .label(label)
                .message(message)
                .type(type)
                .build();
    }
}
