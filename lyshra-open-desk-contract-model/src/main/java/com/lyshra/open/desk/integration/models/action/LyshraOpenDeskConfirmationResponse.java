package com.lyshra.open.desk.integration.models.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskConfirmationResponse;
import lombok.Data;

import java.util.Optional;

@Data
public class LyshraOpenDeskConfirmationResponse implements ILyshraOpenDeskConfirmationResponse {
    private static final LyshraOpenDeskConfirmationResponse ACCEPTED = new LyshraOpenDeskConfirmationResponse(true, null);
    private static final LyshraOpenDeskConfirmationResponse DECLINED = new LyshraOpenDeskConfirmationResponse(false, null);

    private final boolean accepted;
    private final String typedText;

    @Override
    public Optional<String> getTypedText() {
        return Optional.ofNullable(typedText);
    }

    public static LyshraOpenDeskConfirmationResponse accepted() {
        return ACCEPTED;
    }

    public static LyshraOpenDeskConfirmationResponse acceptedWithText(String typedText) {
        return new LyshraOpenDeskConfirmationResponse(true, typedText);
    }

    public static LyshraOpenDeskConfirmationResponse declined() {
        return DECLINED;
    }
}
