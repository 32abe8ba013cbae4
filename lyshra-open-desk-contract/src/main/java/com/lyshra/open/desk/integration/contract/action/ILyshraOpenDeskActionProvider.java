package com.lyshra.open.desk.integration.contract.action;

import java.util.List;

/**
 * Source of candidate actions. Requirement filtering and ordering happen afterwards in the manifest builder.
 */
public interface ILyshraOpenDeskActionProvider {

    String getName();

    default boolean appliesTo(String documentType) {
        return true;
    }

    List<ILyshraOpenDeskAction> getActions(ILyshraOpenDeskActionContext context);
}
