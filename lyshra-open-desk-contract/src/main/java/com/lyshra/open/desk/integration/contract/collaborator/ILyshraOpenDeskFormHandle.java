package com.lyshra.open.desk.integration.contract.collaborator;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskSaveAction;
import reactor.core.publisher.Mono;

/**
 * The live form. Saving through it sends the current, possibly unsaved, field values.
 */
public interface ILyshraOpenDeskFormHandle {
    Mono<Void> submit(LyshraOpenDeskSaveAction saveAction);
    boolean isDirty();
}
