package com.lyshra.open.desk.core.engine.validation;

import com.lyshra.open.desk.core.util.CommonUtil;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldFormat;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Syntax checks for the format kinds a {@code Data} field can declare.
 */
public final class LyshraOpenDeskFormatValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^[+]?[(]?[0-9]{1,4}[)]?[-\\s./0-9]*$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern INVALID_NAME_CHARACTERS = Pattern.compile("[<>]");
    private static final int MIN_PHONE_DIGITS = 7;

    private LyshraOpenDeskFormatValidator() {}

    public static boolean isValid(LyshraOpenDeskFieldFormat format, String value) {
        return switch (format) {
            case EMAIL -> isValidEmail(value);
            case PHONE -> isValidPhone(value);
            case URL -> isValidUrl(value);
            case NAME -> isValidName(value);
        };
    }

    /**
     * Accepts a comma separated list; every entry must be an address.
     */
    public static boolean isValidEmail(String value) {
        return Arrays.stream(value.split(",", -1))
                .map(String::trim)
                .allMatch(email -> CommonUtil.patternMatches(EMAIL_PATTERN, email));
    }

    public static boolean isValidPhone(String value) {
        return CommonUtil.patternMatches(PHONE_PATTERN, value)
                && NON_DIGITS.matcher(value).replaceAll("").length() >= MIN_PHONE_DIGITS;
    }

    public static boolean isValidUrl(String value) {
        try {
            return new URI(value.trim()).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public static boolean isValidName(String value) {
        return !INVALID_NAME_CHARACTERS.matcher(value).find();
    }
}
