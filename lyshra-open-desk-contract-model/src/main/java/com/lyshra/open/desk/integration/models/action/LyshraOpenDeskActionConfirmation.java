package com.lyshra.open.desk.integration.models.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionConfirmation;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskConfirmationType;
import lombok.Builder;
import lombok.Data;

import java.util.Optional;

@Data
@Builder
public class LyshraOpenDeskActionConfirmation implements ILyshraOpenDeskActionConfirmation {
    private final String message;
    private final String title;
    @Builder.Default
    private final LyshraOpenDeskConfirmationType type = LyshraOpenDeskConfirmationType.WARNING;
    private final boolean requireTypedConfirmation;

    @Override
    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }
}
