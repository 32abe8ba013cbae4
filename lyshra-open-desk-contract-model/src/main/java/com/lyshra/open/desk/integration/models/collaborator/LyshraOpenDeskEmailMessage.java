package com.lyshra.open.desk.integration.models.collaborator;

import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskEmailMessage;
import lombok.Builder;
import lombok.Data;

import java.util.Optional;

@Data
@Builder
public class LyshraOpenDeskEmailMessage implements ILyshraOpenDeskEmailMessage {
    private final String recipients;
    private final String cc;
    private final String bcc;
    private final String subject;
    private final String content;

    @Override
    public Optional<String> getCc() {
        return Optional.ofNullable(cc);
    }

    @Override
    public Optional<String> getBcc() {
        return Optional.ofNullable(bcc);
    }
}
