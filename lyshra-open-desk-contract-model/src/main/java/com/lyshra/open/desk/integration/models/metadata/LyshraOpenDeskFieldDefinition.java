package com.lyshra.open.desk.integration.models.metadata;

import com.lyshra.open.desk.integration.constant.LyshraOpenDeskConstants;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldFormat;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldKind;
import lombok.Builder;
import lombok.Data;

import java.util.Optional;

@Data
@Builder(toBuilder = true)
public class LyshraOpenDeskFieldDefinition implements ILyshraOpenDeskFieldDefinition {
    private final String fieldName;
    @Builder.Default
    private final String fieldType = LyshraOpenDeskConstants.FIELD_TYPE_DATA;
    private final String label;
    private final int permissionLevel;
    private final boolean required;
    private final boolean readOnly;
    private final boolean hidden;
    private final boolean allowOnSubmit;
    private final boolean noCopy;
    private final Object visibilityExpression; // depends_on
    private final Object requiredExpression; // mandatory_depends_on
    private final Object readOnlyExpression; // read_only_depends_on
    private final Integer maxLength;
    private final String options;

    @Override
    public LyshraOpenDeskFieldKind getKind() {
        return LyshraOpenDeskConstants.STRUCTURAL_FIELD_TYPES.contains(fieldType)
                ? LyshraOpenDeskFieldKind.STRUCTURAL
                : LyshraOpenDeskFieldKind.DATA;
    }

    @Override
    public Optional<Integer> getMaxLength() {
        return Optional.ofNullable(maxLength).filter(length -> length > 0);
    }

    @Override
    public Optional<String> getOptions() {
        return Optional.ofNullable(options).filter(value -> !value.isBlank());
    }

    @Override
    public Optional<LyshraOpenDeskFieldFormat> getFormat() {
        if (!LyshraOpenDeskConstants.FIELD_TYPE_DATA.equals(fieldType)) {
            return Optional.empty();
        }
        return LyshraOpenDeskFieldFormat.fromOptions(options);
    }
}
