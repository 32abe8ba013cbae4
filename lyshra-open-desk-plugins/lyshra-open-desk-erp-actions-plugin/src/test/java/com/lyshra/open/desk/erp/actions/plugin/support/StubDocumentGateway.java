package com.lyshra.open.desk.erp.actions.plugin.support;

import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskDocumentGateway;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskEmailMessage;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskSaveAction;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway that answers server method calls from canned responses and records the arguments.
 * Saved documents get the name {@code NEW-0001}.
 */
@Getter
public class StubDocumentGateway implements ILyshraOpenDeskDocumentGateway {
    private final Map<String, Map<String, Object>> responses = new HashMap<>();
    private final Map<String, Map<String, Object>> calls = new LinkedHashMap<>();
    private final List<ILyshraOpenDeskDocument> savedDocuments = new ArrayList<>();

    public StubDocumentGateway respond(String method, Map<String, Object> response) {
        responses.put(method, response);
        return this;
    }

    @Override
    public Mono<Map<String, Object>> callMethod(String method, Map<String, Object> arguments) {
        calls.put(method, arguments);
        return Mono.justOrEmpty(responses.get(method));
    }

    @Override
    public Mono<ILyshraOpenDeskDocument> saveDocument(ILyshraOpenDeskDocument document, LyshraOpenDeskSaveAction saveAction) {
        savedDocuments.add(document);
        return Mono.just(LyshraOpenDeskDocument.copyOf(document).put("name", "NEW-0001"));
    }

    @Override
    public Mono<ILyshraOpenDeskDocument> loadDocument(String documentType, String name) {
        return Mono.empty();
    }

    @Override
    public Mono<ILyshraOpenDeskDocTypeMetadata> loadMetadata(String documentType) {
        return Mono.empty();
    }

    @Override
    public Mono<ILyshraOpenDeskDocument> cancelDocument(String documentType, String name) {
        return Mono.error(new UnsupportedOperationException("cancelDocument"));
    }

    @Override
    public Mono<Void> deleteDocument(String documentType, String name) {
        return Mono.error(new UnsupportedOperationException("deleteDocument"));
    }

    @Override
    public Mono<Boolean> isDocumentAmended(String documentType, String name) {
        return Mono.just(false);
    }

    @Override
    public Mono<String> renameDocument(String documentType, String name, String newName, boolean merge) {
        return Mono.error(new UnsupportedOperationException("renameDocument"));
    }

    @Override
    public Mono<ILyshraOpenDeskDocument> applyWorkflow(ILyshraOpenDeskDocument document, String action) {
        return Mono.just(document);
    }

    @Override
    public Mono<Void> downloadPdf(String documentType, String name) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> sendEmail(String documentType, String name, ILyshraOpenDeskEmailMessage message) {
        return Mono.empty();
    }
}
