package com.lyshra.open.desk.integration.contract.document;

/**
 * One row of a document's sharing list.
 */
public interface ILyshraOpenDeskDocumentShare {
    String getUser();
    boolean isRead();
    boolean isWrite();
    boolean isSubmit();
    boolean isShare();
}
