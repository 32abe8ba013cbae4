package com.lyshra.open.desk.integration.enumerations;

public enum LyshraOpenDeskAlertIndicator {
    GREEN,
    BLUE,
    ORANGE,
    RED
}
