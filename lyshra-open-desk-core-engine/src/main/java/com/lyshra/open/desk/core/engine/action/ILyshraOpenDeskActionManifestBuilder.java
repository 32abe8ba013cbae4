package com.lyshra.open.desk.core.engine.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionManifest;

public interface ILyshraOpenDeskActionManifestBuilder {

    /**
     * Collects the actions of every applicable provider, keeps the available ones and orders them.
     * A failing provider contributes nothing; the others are unaffected.
     */
    LyshraOpenDeskActionManifest build(ILyshraOpenDeskActionContext context);
}
