package com.lyshra.open.desk.core.engine.message;

import java.util.Locale;
import java.util.Map;

public interface ILyshraOpenDeskMessageSource {

    default String getMessage(String messageTemplate) {
        return getMessage(messageTemplate, null, Map.of());
    }

    default String getMessage(String messageTemplate, Map<String, String> arguments) {
        return getMessage(messageTemplate, null, arguments);
    }

    String getMessage(String messageTemplate, Locale locale, Map<String, String> arguments);
}
