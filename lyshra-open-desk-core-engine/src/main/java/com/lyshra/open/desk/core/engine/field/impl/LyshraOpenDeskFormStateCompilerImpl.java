package com.lyshra.open.desk.core.engine.field.impl;

import com.lyshra.open.desk.core.engine.dependency.ILyshraOpenDeskDependencyResolver;
import com.lyshra.open.desk.core.engine.field.ILyshraOpenDeskFieldStatusCompiler;
import com.lyshra.open.desk.core.engine.field.ILyshraOpenDeskFormStateCompiler;
import com.lyshra.open.desk.core.engine.permission.ILyshraOpenDeskPermissionResolver;
import com.lyshra.open.desk.core.util.CommonUtil;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldStatus;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;
import com.lyshra.open.desk.integration.models.field.LyshraOpenDeskFormState;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionMatrix;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class LyshraOpenDeskFormStateCompilerImpl implements ILyshraOpenDeskFormStateCompiler {

    private final ILyshraOpenDeskPermissionResolver permissionResolver;
    private final ILyshraOpenDeskDependencyResolver dependencyResolver;
    private final ILyshraOpenDeskFieldStatusCompiler fieldStatusCompiler;

    @Override
    public LyshraOpenDeskFormState compile(
            ILyshraOpenDeskDocTypeMetadata metadata,
            ILyshraOpenDeskDocument document,
            ILyshraOpenDeskDocumentOverlay overlay,
            List<String> userRoles,
            String currentUserId) {

        LyshraOpenDeskPermissionMatrix matrix = permissionResolver.resolve(metadata, userRoles, currentUserId);
        List<ILyshraOpenDeskFieldDefinition> fields = metadata == null ? List.of() : CommonUtil.nonNullList(metadata.getFields());
        LyshraOpenDeskDependencyOverrides overrides = dependencyResolver.resolve(fields, document);

        Map<String, LyshraOpenDeskFieldStatus> statuses = new LinkedHashMap<>();
        for (ILyshraOpenDeskFieldDefinition field : fields) {
            if (field == null || field.getFieldName() == null) {
                continue;
            }
            statuses.put(field.getFieldName(),
                    fieldStatusCompiler.compile(field, document, matrix, overlay, overrides, currentUserId));
        }
        return LyshraOpenDeskFormState.builder()
                .permissionMatrix(matrix)
                .dependencyOverrides(overrides)
                .fieldStatuses(Collections.unmodifiableMap(statuses))
                .build();
    }
}
