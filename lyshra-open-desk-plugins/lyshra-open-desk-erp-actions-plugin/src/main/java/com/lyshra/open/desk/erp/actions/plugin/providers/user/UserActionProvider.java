package com.lyshra.open.desk.erp.actions.plugin.providers.user;

import com.lyshra.open.desk.erp.actions.plugin.constant.ErpServerMethods;
import com.lyshra.open.desk.erp.actions.plugin.exception.ErpActionsErrorCodes;
import com.lyshra.open.desk.erp.actions.plugin.providers.AbstractErpActionProvider;
import com.lyshra.open.desk.erp.actions.plugin.providers.ErpActionSupport;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskAlertIndicator;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskConfirmationType;
import com.lyshra.open.desk.integration.exception.LyshraOpenDeskActionExecutionException;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskAction;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionRequirement;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Account administration shortcuts on the User form.
 */
@Slf4j
public class UserActionProvider extends AbstractErpActionProvider {

    public static final String PROVIDER_NAME = "UserFeatureProvider";
    public static final String ADMINISTRATOR = "Administrator";

    public UserActionProvider() {
        super(PROVIDER_NAME, "User");
    }

    @Override
    protected List<ILyshraOpenDeskAction> createActions(ILyshraOpenDeskActionContext context) {
        return List.of(
                resetPassword(),
                impersonate(),
                viewPermissions(),
                permittedDocuments(),
                generateApiKeys());
    }

    private ILyshraOpenDeskAction resetPassword() {
        return LyshraOpenDeskAction.builder()
                .id("user-reset-password")
                .label("Reset Password")
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("Key")
                .priority(100)
                .showAsMenuItem()
                .requires(ErpActionSupport.savedDocument())
                .executor(context -> context.requireGateway()
                        .callMethod(ErpServerMethods.RESET_PASSWORD, Map.of("user", context.requireDocumentName()))
                        .then())
                .build();
    }

    private ILyshraOpenDeskAction impersonate() {
        return LyshraOpenDeskAction.builder()
                .id("user-impersonate")
                .label("Impersonate")
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("UserCog")
                .priority(101)
                .showAsMenuItem()
                .requires(ErpActionSupport.savedDocument())
                .requires(LyshraOpenDeskActionRequirement.custom(
                        context -> !ADMINISTRATOR.equals(context.getDocumentName().orElse(null))))
                .confirm(confirmation -> confirmation
                        .title("Impersonate User")
                        .message("You are about to impersonate this user. Please provide a reason.")
                        .type(LyshraOpenDeskConfirmationType.WARNING))
                .executor(this::impersonate)
                .build();
    }

    private Mono<Void> impersonate(ILyshraOpenDeskActionContext context) {
        String user = context.requireDocumentName();
        return context.requireUi()
                .promptText("Impersonate User", "Reason for impersonating (will be shared with user):")
                .defaultIfEmpty("")
                .flatMap(reason -> {
                    if (reason.isBlank()) {
                        Map<String, String> variables = Map.of("user", user);
                        return Mono.<Void>error(new LyshraOpenDeskActionExecutionException(
                                ErpActionsErrorCodes.IMPERSONATION_REASON_REQUIRED, variables,
                                ErpActionsErrorCodes.IMPERSONATION_REASON_REQUIRED.format(variables)));
                    }
                    log.info("Impersonating user [{}]", user);
                    return context.requireGateway()
                            .callMethod(ErpServerMethods.IMPERSONATE, Map.of("user", user, "reason", reason.trim()))
                            .then(context.requireUi().reload());
                });
    }

    private ILyshraOpenDeskAction viewPermissions() {
        return LyshraOpenDeskAction.builder()
                .id("user-view-permissions")
                .label("View Permissions")
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("Shield")
                .priority(102)
                .showAsMenuItem()
                .requires(ErpActionSupport.savedDocument())
                .executor(context -> ErpActionSupport.navigate(context,
                        ErpActionSupport.listPath("User Permission", "user", context.requireDocumentName())))
                .build();
    }

    private ILyshraOpenDeskAction permittedDocuments() {
        return LyshraOpenDeskAction.builder()
                .id("user-permitted-documents")
                .label("Permitted Documents")
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("FileCheck")
                .priority(103)
                .showAsMenuItem()
                .requires(ErpActionSupport.savedDocument())
                .executor(context -> ErpActionSupport.navigate(context,
                        ErpActionSupport.reportPath(ErpServerMethods.REPORT_PERMITTED_DOCUMENTS, "user", context.requireDocumentName())))
                .build();
    }

    private ILyshraOpenDeskAction generateApiKeys() {
        return LyshraOpenDeskAction.builder()
                .id("user-generate-api-keys")
                .label("Generate API Keys")
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("Code")
                .priority(104)
                .showAsMenuItem()
                .requires(ErpActionSupport.savedDocument())
                .confirm(confirmation -> confirmation
                        .title("Generate API Keys")
                        .message("This will generate new API keys for this user. Existing keys (if any) will be invalidated.")
                        .type(LyshraOpenDeskConfirmationType.WARNING))
                .executor(context -> context.requireGateway()
                        .callMethod(ErpServerMethods.GENERATE_KEYS, Map.of("user", context.requireDocumentName()))
                        .flatMap(keys -> Mono.fromRunnable(() -> context.requireUi().showAlert(
                                "API Key: " + keys.get("api_key") + "\nAPI Secret: " + keys.get("api_secret")
                                        + "\n\nPlease save these securely. The secret will not be shown again.",
                                LyshraOpenDeskAlertIndicator.ORANGE)))
                        .then(Mono.defer(() -> context.requireUi().reload())))
                .build();
    }
}
