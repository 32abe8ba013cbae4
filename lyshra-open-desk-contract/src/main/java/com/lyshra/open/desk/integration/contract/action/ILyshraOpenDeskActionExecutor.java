package com.lyshra.open.desk.integration.contract.action;

import reactor.core.publisher.Mono;

@FunctionalInterface
public interface ILyshraOpenDeskActionExecutor {
    Mono<Void> execute(ILyshraOpenDeskActionContext context);
}
