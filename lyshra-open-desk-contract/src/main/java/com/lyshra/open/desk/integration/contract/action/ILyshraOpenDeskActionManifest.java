package com.lyshra.open.desk.integration.contract.action;

import java.util.List;

public interface ILyshraOpenDeskActionManifest {
    List<ILyshraOpenDeskAction> getActions();
    ILyshraOpenDeskActionContext getContext();
}
