package com.lyshra.open.desk.integration.contract.collaborator;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskSaveAction;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Remote document store. The server enforces every permission; calls fail with an error signal
 * when it refuses.
 */
public interface ILyshraOpenDeskDocumentGateway {

    Mono<ILyshraOpenDeskDocument> loadDocument(String documentType, String name);

    Mono<ILyshraOpenDeskDocTypeMetadata> loadMetadata(String documentType);

    Mono<ILyshraOpenDeskDocument> saveDocument(ILyshraOpenDeskDocument document, LyshraOpenDeskSaveAction saveAction);

    Mono<ILyshraOpenDeskDocument> cancelDocument(String documentType, String name);

    Mono<Void> deleteDocument(String documentType, String name);

    /**
     * Whether a non-cancelled amendment of the document already exists.
     */
    Mono<Boolean> isDocumentAmended(String documentType, String name);

    /**
     * Renames a document and emits its final name.
     */
    Mono<String> renameDocument(String documentType, String name, String newName, boolean merge);

    Mono<ILyshraOpenDeskDocument> applyWorkflow(ILyshraOpenDeskDocument document, String action);

    Mono<Void> downloadPdf(String documentType, String name);

    Mono<Void> sendEmail(String documentType, String name, ILyshraOpenDeskEmailMessage message);

    /**
     * Calls a whitelisted server method and emits its payload.
     */
    Mono<Map<String, Object>> callMethod(String method, Map<String, Object> arguments);
}
