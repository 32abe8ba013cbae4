package com.lyshra.open.desk.core.engine.validation;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationResult;

import java.util.Map;

/**
 * Pre-save checks mirroring the server's mandatory and data field validation. Problems are returned
 * as data, never thrown.
 */
public interface ILyshraOpenDeskValidationEngine {

    default LyshraOpenDeskValidationResult validate(ILyshraOpenDeskDocTypeMetadata metadata, ILyshraOpenDeskDocument document) {
        return validate(metadata, document, Map.of());
    }

    /**
     * @param childMetadataByDocType metadata of child table document types, keyed by name. Rows of
     *                               tables whose type is missing here are not checked.
     */
    LyshraOpenDeskValidationResult validate(
            ILyshraOpenDeskDocTypeMetadata metadata,
            ILyshraOpenDeskDocument document,
            Map<String, ? extends ILyshraOpenDeskDocTypeMetadata> childMetadataByDocType);
}
