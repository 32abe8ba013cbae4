package com.lyshra.open.desk.integration.models.document;

import com.lyshra.open.desk.integration.constant.LyshraOpenDeskConstants;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable, insertion-ordered document backed by a {@link LinkedHashMap}.
 */
@ToString
@EqualsAndHashCode
public class LyshraOpenDeskDocument implements ILyshraOpenDeskDocument {
    private final Map<String, Object> values;

    public LyshraOpenDeskDocument() {
        this.values = new LinkedHashMap<>();
    }

    public LyshraOpenDeskDocument(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(values == null ? Map.of() : values);
    }

    public static LyshraOpenDeskDocument of(Map<String, ?> values) {
        return new LyshraOpenDeskDocument(values);
    }

    public static LyshraOpenDeskDocument copyOf(ILyshraOpenDeskDocument document) {
        return new LyshraOpenDeskDocument(document.asMap());
    }

    public LyshraOpenDeskDocument put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    public LyshraOpenDeskDocument remove(String key) {
        values.remove(key);
        return this;
    }

    @Override
    public Object get(String key) {
        return values.get(key);
    }

    @Override
    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    @Override
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public Optional<String> getName() {
        return stringValue(LyshraOpenDeskConstants.NAME);
    }

    @Override
    public Optional<String> getDocType() {
        return stringValue(LyshraOpenDeskConstants.DOCTYPE);
    }

    @Override
    public Optional<String> getOwner() {
        return stringValue(LyshraOpenDeskConstants.OWNER);
    }

    @Override
    public int getDocStatus() {
        return LyshraOpenDeskValues.cint(values.get(LyshraOpenDeskConstants.DOCSTATUS));
    }

    @Override
    public boolean isNew() {
        return LyshraOpenDeskValues.isTruthy(values.get(LyshraOpenDeskConstants.IS_LOCAL))
                || LyshraOpenDeskValues.isTruthy(values.get(LyshraOpenDeskConstants.IS_NEW));
    }

    private Optional<String> stringValue(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = LyshraOpenDeskValues.cstr(value);
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
