package com.lyshra.open.desk.core.engine.action.providers;

import com.lyshra.open.desk.core.util.CommonUtil;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskUiDelegate;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskAlertIndicator;
import reactor.core.publisher.Mono;

/**
 * UI steps shared by the engine's action executors. A missing UI delegate turns them into no-ops.
 */
public final class LyshraOpenDeskActionSupport {

    private LyshraOpenDeskActionSupport() {
    }

    public static String listPath(String documentType) {
        return "/app/" + CommonUtil.slugify(documentType);
    }

    public static String documentPath(String documentType, String name) {
        return listPath(documentType) + "/" + name;
    }

    public static Mono<Void> reload(ILyshraOpenDeskActionContext context) {
        return Mono.defer(() -> context.getUi()
                .map(ILyshraOpenDeskUiDelegate::reload)
                .orElse(Mono.empty()));
    }

    public static Mono<Void> navigate(ILyshraOpenDeskActionContext context, String path) {
        return Mono.fromRunnable(() -> context.getUi().ifPresent(ui -> ui.navigate(path)));
    }

    public static Mono<Void> alert(ILyshraOpenDeskActionContext context, String message, LyshraOpenDeskAlertIndicator indicator) {
        return Mono.fromRunnable(() -> context.getUi().ifPresent(ui -> ui.showAlert(message, indicator)));
    }
}
