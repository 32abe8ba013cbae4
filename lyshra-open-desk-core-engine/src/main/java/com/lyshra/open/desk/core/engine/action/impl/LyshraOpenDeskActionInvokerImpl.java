package com.lyshra.open.desk.core.engine.action.impl;

import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionInvoker;
import com.lyshra.open.desk.core.engine.error.LyshraOpenDeskActionErrorHandler;
import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.exception.codes.LyshraOpenDeskErrorCodes;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionConfirmation;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskConfirmationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class LyshraOpenDeskActionInvokerImpl implements ILyshraOpenDeskActionInvoker {

    private final ILyshraOpenDeskMessageSource messageSource;

    @Override
    public Mono<Void> invoke(
            ILyshraOpenDeskAction action,
            ILyshraOpenDeskActionContext context,
            ILyshraOpenDeskConfirmationResponse response) {

        Optional<ILyshraOpenDeskActionConfirmation> confirmation = action.getConfirmation();
        if (confirmation.isPresent()) {
            if (response == null || !response.isAccepted()) {
                log.debug("Action [{}] not confirmed, skipping", action.getId());
                return Mono.empty();
            }
            if (confirmation.get().isRequireTypedConfirmation()) {
                String expected = context.getDocumentName().orElse("");
                String typed = response.getTypedText().map(String::trim).orElse("");
                if (!expected.equals(typed)) {
                    log.debug("Action [{}] typed confirmation [{}] does not match [{}]", action.getId(), typed, expected);
                    return Mono.error(LyshraOpenDeskActionErrorHandler.create(
                            LyshraOpenDeskErrorCodes.ACTION_TYPED_CONFIRMATION_MISMATCH,
                            Map.of("action", action.getLabel(), "expected", expected),
                            messageSource));
                }
            }
        }

        log.info("Executing action: [{}] on [{}]", action.getId(), context.getDocumentType());
        Mono<Void> execution = Mono.defer(() -> action.getExecutor().execute(context));
        return LyshraOpenDeskActionErrorHandler.applyErrorHandling(execution, action, messageSource);
    }
}
