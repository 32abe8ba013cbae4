package com.lyshra.open.desk.integration.contract.document;

import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of one business record.
 */
public interface ILyshraOpenDeskDocument {

    Object get(String key);

    boolean containsKey(String key);

    /**
     * All values in insertion order. The returned map is the document's own storage.
     */
    Map<String, Object> asMap();

    Optional<String> getName();

    Optional<String> getDocType();

    Optional<String> getOwner();

    /**
     * 0 draft, 1 submitted, 2 cancelled. Missing or unparsable values read as 0.
     */
    int getDocStatus();

    /**
     * Unsaved documents carry a truthy {@code __islocal} or {@code __isNew}.
     */
    boolean isNew();

    default boolean isSubmitted() {
        return getDocStatus() == 1;
    }

    default boolean isCancelled() {
        return getDocStatus() == 2;
    }
}
