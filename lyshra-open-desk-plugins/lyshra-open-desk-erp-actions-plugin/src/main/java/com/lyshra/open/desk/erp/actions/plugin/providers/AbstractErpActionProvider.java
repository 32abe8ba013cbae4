package com.lyshra.open.desk.erp.actions.plugin.providers;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import lombok.Getter;

import java.util.List;

/**
 * Provider bound to a single document type. Saved documents only; submitted-only providers
 * override {@link #isSubmittedOnly()}.
 */
@Getter
public abstract class AbstractErpActionProvider implements ILyshraOpenDeskActionProvider {

    private final String name;
    private final String documentType;

    protected AbstractErpActionProvider(String name, String documentType) {
        this.name = name;
        this.documentType = documentType;
    }

    @Override
    public boolean appliesTo(String documentType) {
        return this.documentType.equals(documentType);
    }

    @Override
    public List<ILyshraOpenDeskAction> getActions(ILyshraOpenDeskActionContext context) {
        if (context.isNewDocument()) {
            return List.of();
        }
        if (isSubmittedOnly() && context.getDocStatus() != 1) {
            return List.of();
        }
        return createActions(context);
    }

    protected boolean isSubmittedOnly() {
        return false;
    }

    protected abstract List<ILyshraOpenDeskAction> createActions(ILyshraOpenDeskActionContext context);
}
