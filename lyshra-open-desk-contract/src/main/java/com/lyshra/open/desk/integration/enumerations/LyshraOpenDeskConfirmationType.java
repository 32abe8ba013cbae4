package com.lyshra.open.desk.integration.enumerations;

public enum LyshraOpenDeskConfirmationType {
    WARNING,
    DANGER,
    INFO
}
