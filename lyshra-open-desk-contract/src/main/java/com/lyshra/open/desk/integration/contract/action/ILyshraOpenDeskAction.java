package com.lyshra.open.desk.integration.contract.action;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;

import java.util.List;
import java.util.Optional;

/**
 * Stateless descriptor of an operation offered on a document.
 */
public interface ILyshraOpenDeskAction {
    String getId();
    String getLabel();
    LyshraOpenDeskActionGroup getGroup();
    Optional<String> getIcon();

    /**
     * Order within the manifest, lower first.
     */
    Optional<Integer> getPriority();

    boolean isPrimary();
    boolean isShowAsMenuItem();
    List<ILyshraOpenDeskActionRequirement> getRequirements();
    Optional<ILyshraOpenDeskActionConfirmation> getConfirmation();
    ILyshraOpenDeskActionExecutor getExecutor();
}
