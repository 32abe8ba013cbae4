package com.lyshra.open.desk.core.engine.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionRequirement;

public interface ILyshraOpenDeskActionRequirementEvaluator {

    /**
     * True when every requirement of the action holds. An action without requirements is always available.
     */
    boolean isAvailable(ILyshraOpenDeskAction action, ILyshraOpenDeskActionContext context);

    boolean isSatisfied(ILyshraOpenDeskActionRequirement requirement, ILyshraOpenDeskActionContext context);
}
