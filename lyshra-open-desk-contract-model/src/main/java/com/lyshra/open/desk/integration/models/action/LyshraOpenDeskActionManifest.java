package com.lyshra.open.desk.integration.models.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionManifest;
import lombok.Data;

import java.util.List;
import java.util.Optional;

@Data
public class LyshraOpenDeskActionManifest implements ILyshraOpenDeskActionManifest {
    private final List<ILyshraOpenDeskAction> actions;
    private final ILyshraOpenDeskActionContext context;

    public Optional<ILyshraOpenDeskAction> findAction(String actionId) {
        return actions.stream().filter(action -> action.getId().equals(actionId)).findFirst();
    }
}
