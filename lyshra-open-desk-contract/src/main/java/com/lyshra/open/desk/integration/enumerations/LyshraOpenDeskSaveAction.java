package com.lyshra.open.desk.integration.enumerations;

/**
 * The server-side save flavours a document can be sent with.
 */
public enum LyshraOpenDeskSaveAction {
    SAVE("Save"),
    SUBMIT("Submit"),
    UPDATE("Update");

    private final String serverAction;

    LyshraOpenDeskSaveAction(String serverAction) {
        this.serverAction = serverAction;
    }

    public String getServerAction() {
        return serverAction;
    }
}
