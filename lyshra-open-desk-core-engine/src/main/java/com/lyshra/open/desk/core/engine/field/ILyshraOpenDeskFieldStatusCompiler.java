package com.lyshra.open.desk.core.engine.field;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.contract.permission.ILyshraOpenDeskPermissionMatrix;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldStatus;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;

public interface ILyshraOpenDeskFieldStatusCompiler {

    /**
     * Final display status of one field.
     *
     * @param document         the document, {@code null} while none is loaded
     * @param overlay          per-document permissions and shares, may be {@code null}
     * @param dependencyOverrides overrides for the current document snapshot, may be {@code null}
     */
    LyshraOpenDeskFieldStatus compile(
            ILyshraOpenDeskFieldDefinition field,
            ILyshraOpenDeskDocument document,
            ILyshraOpenDeskPermissionMatrix matrix,
            ILyshraOpenDeskDocumentOverlay overlay,
            LyshraOpenDeskDependencyOverrides dependencyOverrides,
            String currentUserId);
}
