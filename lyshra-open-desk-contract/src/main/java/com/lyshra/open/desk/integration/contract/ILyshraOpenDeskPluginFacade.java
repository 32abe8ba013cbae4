package com.lyshra.open.desk.integration.contract;

/**
 * Engine services handed to plugins while they create their providers.
 */
public interface ILyshraOpenDeskPluginFacade {
    ILyshraOpenDeskEngineSettings getEngineSettings();
    ILyshraOpenDeskDiagnostics getDiagnostics();
    ILyshraOpenDeskObjectMapper getObjectMapper();
}
