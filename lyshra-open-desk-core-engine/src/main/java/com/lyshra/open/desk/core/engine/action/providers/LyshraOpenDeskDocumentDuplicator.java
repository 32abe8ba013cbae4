package com.lyshra.open.desk.core.engine.action.providers;

import com.lyshra.open.desk.core.engine.error.LyshraOpenDeskActionErrorHandler;
import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.exception.codes.LyshraOpenDeskErrorCodes;
import com.lyshra.open.desk.integration.constant.LyshraOpenDeskConstants;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskDocumentGateway;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a clean, unsaved copy of the current document: a fresh server copy with system fields
 * and no-copy fields removed, on the parent and on every child row.
 */
@Slf4j
@RequiredArgsConstructor
public class LyshraOpenDeskDocumentDuplicator {

    private final ILyshraOpenDeskMessageSource messageSource;

    public Mono<LyshraOpenDeskDocument> duplicate(ILyshraOpenDeskActionContext context) {
        ILyshraOpenDeskDocumentGateway gateway = context.requireGateway();
        String documentType = context.getDocumentType();
        String name = context.requireDocumentName();
        ILyshraOpenDeskDocTypeMetadata metadata = context.getMetadata();

        Mono<ILyshraOpenDeskDocument> source = gateway.loadDocument(documentType, name)
                .switchIfEmpty(Mono.error(() -> LyshraOpenDeskActionErrorHandler.create(
                        LyshraOpenDeskErrorCodes.DOCUMENT_LOAD_FAILED,
                        Map.of("doctype", documentType, "name", name),
                        messageSource)));

        return source
                .zipWith(loadChildNoCopyFields(gateway, metadata))
                .map(tuple -> copy(tuple.getT1(), documentType, metadata, tuple.getT2()));
    }

    LyshraOpenDeskDocument copy(
            ILyshraOpenDeskDocument source,
            String documentType,
            ILyshraOpenDeskDocTypeMetadata metadata,
            Map<String, Set<String>> childNoCopyFields) {

        Map<String, Object> values = new LinkedHashMap<>(source.asMap());
        LyshraOpenDeskConstants.SYSTEM_FIELDS.forEach(values::remove);
        noCopyFields(metadata).forEach(values::remove);
        values.put(LyshraOpenDeskConstants.DOCTYPE, documentType);
        values.put(LyshraOpenDeskConstants.DOCSTATUS, 0);
        values.put(LyshraOpenDeskConstants.IS_LOCAL, 1);
        values.put(LyshraOpenDeskConstants.IS_UNSAVED, 1);

        for (ILyshraOpenDeskFieldDefinition field : tableFields(metadata)) {
            Object rows = values.get(field.getFieldName());
            if (rows instanceof List<?> rowList) {
                Set<String> childNoCopy = childNoCopyFields.getOrDefault(field.getOptions().orElse(""), Set.of());
                values.put(field.getFieldName(), copyRows(rowList, childNoCopy));
            }
        }
        return LyshraOpenDeskDocument.of(values);
    }

    private static List<Object> copyRows(List<?> rows, Set<String> childNoCopy) {
        List<Object> copies = new ArrayList<>(rows.size());
        for (Object row : rows) {
            if (!(row instanceof Map<?, ?> rowMap)) {
                copies.add(row);
                continue;
            }
            Map<String, Object> clean = new LinkedHashMap<>();
            rowMap.forEach((key, value) -> clean.put(String.valueOf(key), value));
            LyshraOpenDeskConstants.SYSTEM_FIELDS.forEach(clean::remove);
            LyshraOpenDeskConstants.CHILD_ROW_FIELDS.forEach(clean::remove);
            childNoCopy.forEach(clean::remove);
            copies.add(clean);
        }
        return copies;
    }

    private Mono<Map<String, Set<String>>> loadChildNoCopyFields(
            ILyshraOpenDeskDocumentGateway gateway,
            ILyshraOpenDeskDocTypeMetadata metadata) {

        List<String> childDocTypes = tableFields(metadata).stream()
                .map(field -> field.getOptions().orElse(""))
                .distinct()
                .toList();

        return Flux.fromIterable(childDocTypes)
                .concatMap(childDocType -> gateway.loadMetadata(childDocType)
                        .map(LyshraOpenDeskDocumentDuplicator::noCopyFields)
                        .onErrorResume(error -> {
                            log.warn("Could not load child metadata [{}], copying its rows unfiltered: [{}]",
                                    childDocType, error.getMessage());
                            return Mono.just(Set.<String>of());
                        })
                        .defaultIfEmpty(Set.of())
                        .map(fields -> Map.entry(childDocType, fields)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private static List<ILyshraOpenDeskFieldDefinition> tableFields(ILyshraOpenDeskDocTypeMetadata metadata) {
        if (metadata == null) {
            return List.of();
        }
        return metadata.getFields().stream()
                .filter(ILyshraOpenDeskFieldDefinition::isTable)
                .filter(field -> field.getOptions().isPresent())
                .toList();
    }

    private static Set<String> noCopyFields(ILyshraOpenDeskDocTypeMetadata metadata) {
        if (metadata == null) {
            return Set.of();
        }
        return metadata.getFields().stream()
                .filter(ILyshraOpenDeskFieldDefinition::isNoCopy)
                .map(ILyshraOpenDeskFieldDefinition::getFieldName)
                .collect(Collectors.toSet());
    }
}
