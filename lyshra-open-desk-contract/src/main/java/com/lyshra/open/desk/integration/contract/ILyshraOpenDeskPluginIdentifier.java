package com.lyshra.open.desk.integration.contract;

public interface ILyshraOpenDeskPluginIdentifier {
    String getOrganization();
    String getModule();
    String getVersion();
    String toString();
}
