package com.lyshra.open.desk.core.engine.support;

import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskFormHandle;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskSaveAction;
import lombok.Getter;
import lombok.Setter;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class FakeFormHandle implements ILyshraOpenDeskFormHandle {
    private final List<LyshraOpenDeskSaveAction> submissions = new ArrayList<>();
    private boolean dirty;

    @Override
    public Mono<Void> submit(LyshraOpenDeskSaveAction saveAction) {
        return Mono.fromRunnable(() -> submissions.add(saveAction));
    }
}
