package com.lyshra.open.desk.core.engine.message;

import com.ibm.icu.text.MessageFormat;
import com.lyshra.open.desk.core.util.CommonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves message keys from a resource bundle and formats them with ICU named arguments
 * ({@code {label} is required}). Unknown keys come back unchanged.
 */
@Slf4j
public final class LyshraOpenDeskMessageSource implements ILyshraOpenDeskMessageSource {
    public static final String I18N_MESSAGES_BASE_PATH = "i18n/lyshra_open_desk_messages";

    private final MessageSource messageSource;

    public LyshraOpenDeskMessageSource() {
        this(I18N_MESSAGES_BASE_PATH, LyshraOpenDeskMessageSource.class.getClassLoader());
    }

    public LyshraOpenDeskMessageSource(String baseName, ClassLoader classLoader) {
        this.messageSource = createMessageSource(baseName, classLoader);
    }

    private MessageSource createMessageSource(String baseName, ClassLoader classLoader) {
        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBundleClassLoader(classLoader);
        source.setDefaultEncoding(StandardCharsets.UTF_8.name());
        source.setFallbackToSystemLocale(false);
        source.setBasename(baseName);
        return source;
    }

    @Override
    public String getMessage(String messageTemplate, Locale locale, Map<String, String> arguments) {
        String message = messageTemplate;
        if (CommonUtil.isNotBlank(messageTemplate)) {
            locale = (locale != null) ? locale : Locale.getDefault();
            try {
                // ICU4J formats the named arguments, so no positional args go to Spring
                message = messageSource.getMessage(messageTemplate, null, locale);
                if (!CommonUtil.nonNullMap(arguments).isEmpty()) {
                    MessageFormat mf = new MessageFormat(message, locale);
                    message = mf.format(arguments);
                }
            } catch (Exception e) {
                log.trace("Failed to resolve message for key: [{}]", messageTemplate, e);
            }
        }
        return message;
    }
}
