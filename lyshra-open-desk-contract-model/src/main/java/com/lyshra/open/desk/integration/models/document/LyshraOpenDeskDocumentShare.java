package com.lyshra.open.desk.integration.models.document;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentShare;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LyshraOpenDeskDocumentShare implements ILyshraOpenDeskDocumentShare {
    private final String user;
    private final boolean read;
    private final boolean write;
    private final boolean submit;
    private final boolean share;
}
