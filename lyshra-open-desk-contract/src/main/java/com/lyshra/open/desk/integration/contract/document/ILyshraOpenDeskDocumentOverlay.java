package com.lyshra.open.desk.integration.contract.document;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Server-computed, per-document permission and sharing facts (docinfo).
 */
public interface ILyshraOpenDeskDocumentOverlay {

    /**
     * Level-0 document permissions computed by the server, absent when the server sent none.
     */
    Optional<Map<LyshraOpenDeskPermissionType, Boolean>> getPermissions();

    List<ILyshraOpenDeskDocumentShare> getShared();

    default Optional<ILyshraOpenDeskDocumentShare> findShare(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return getShared().stream()
                .filter(share -> userId.equals(share.getUser()))
                .findFirst();
    }
}
