package com.lyshra.open.desk.core.engine.field;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.models.field.LyshraOpenDeskFormState;

import java.util.List;

public interface ILyshraOpenDeskFormStateCompiler {

    /**
     * Resolves the permission matrix and dependency overrides once and compiles every field of the form.
     */
    LyshraOpenDeskFormState compile(
            ILyshraOpenDeskDocTypeMetadata metadata,
            ILyshraOpenDeskDocument document,
            ILyshraOpenDeskDocumentOverlay overlay,
            List<String> userRoles,
            String currentUserId);
}
