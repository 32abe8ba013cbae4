package com.lyshra.open.desk.core.engine.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskConfirmationResponse;
import reactor.core.publisher.Mono;

public interface ILyshraOpenDeskActionInvoker {

    /**
     * Runs the executor of an action. When the action asks for confirmation the response decides:
     * a declined or missing response completes empty without calling the executor, and a typed
     * confirmation must match the document name exactly.
     * Executor failures are surfaced as {@link com.lyshra.open.desk.integration.exception.LyshraOpenDeskActionExecutionException}.
     */
    Mono<Void> invoke(ILyshraOpenDeskAction action, ILyshraOpenDeskActionContext context, ILyshraOpenDeskConfirmationResponse response);

    default Mono<Void> invoke(ILyshraOpenDeskAction action, ILyshraOpenDeskActionContext context) {
        return invoke(action, context, null);
    }
}
