package com.lyshra.open.desk.integration.enumerations;

import java.util.Optional;

/**
 * Capabilities a permission rule or a document overlay can grant.
 */
public enum LyshraOpenDeskPermissionType {
    READ("read"),
    WRITE("write"),
    CREATE("create"),
    DELETE("delete"),
    SUBMIT("submit"),
    CANCEL("cancel"),
    AMEND("amend"),
    PRINT("print"),
    EMAIL("email"),
    EXPORT("export"),
    IMPORT("import"),
    SHARE("share");

    private final String key;

    LyshraOpenDeskPermissionType(String key) {
        this.key = key;
    }

    /**
     * Key used for this capability in server payloads.
     */
    public String getKey() {
        return key;
    }

    public static Optional<LyshraOpenDeskPermissionType> fromKey(String key) {
        for (LyshraOpenDeskPermissionType type : values()) {
            if (type.key.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
