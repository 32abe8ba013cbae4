package com.lyshra.open.desk.core.engine.expression;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Documents an expression is evaluated against. {@code parent} is the enclosing document for
 * child rows and defaults to the document itself.
 */
@Data
@Builder
public class ExpressionContext {
    private final Map<String, Object> document;
    private final Map<String, Object> parent;

    public Map<String, Object> getParent() {
        return parent != null ? parent : document;
    }

    public boolean hasDocument() {
        return document != null;
    }

    public static ExpressionContext of(ILyshraOpenDeskDocument document) {
        return of(document, null);
    }

    public static ExpressionContext of(ILyshraOpenDeskDocument document, ILyshraOpenDeskDocument parent) {
        return ExpressionContext.builder()
                .document(document != null ? document.asMap() : null)
                .parent(parent != null ? parent.asMap() : null)
                .build();
    }

    public static ExpressionContext of(Map<String, Object> document, Map<String, Object> parent) {
        return ExpressionContext.builder()
                .document(document)
                .parent(parent)
                .build();
    }
}
