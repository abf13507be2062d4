package com.secma.core.global.validation;

import java.util.regex.Pattern;

import com.secma.core.global.error.InvalidInputException;

/**
 * Naming rules for application names, user logins, role names and permission strings.
 * Each method returns the value unchanged when it is valid.
 */
public final class Identifiers {

    public static final int MAX_LENGTH = 255;
    public static final int MIN_APPLICATION_NAME_LENGTH = 3;

    private static final Pattern NAME = Pattern.compile("^[a-z0-9\\-_]+$");
    private static final Pattern PERMISSION = Pattern.compile("^[a-z0-9\\-_.]+:[a-z0-9\\-_.]+$");

    private Identifiers() {
    }

    public static String applicationName(String value) {
        String checked = lowercaseName("name", value);
        if (checked.length() < MIN_APPLICATION_NAME_LENGTH) {
            throw new InvalidInputException("name",
                    "The application name must be at least " + MIN_APPLICATION_NAME_LENGTH + " characters in length.");
        }
        return checked;
    }

    public static String login(String value) {
        return lowercaseName("login", value);
    }

    public static String roleName(String value) {
        return lowercaseName("role", value);
    }

    /**
     * Permissions are literal {@code resource:action} tokens. There is no wildcard or prefix
     * matching: {@code doc:*} is rejected rather than treated as a pattern.
     */
    public static String permission(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidInputException("permission", "The permission must be non-empty.");
        }
        if (value.length() > MAX_LENGTH) {
            throw new InvalidInputException("permission",
                    "The permission must be less than " + MAX_LENGTH + " characters in length.");
        }
        if (!PERMISSION.matcher(value).matches()) {
            throw new InvalidInputException("permission",
                    "The permission `" + value + "` must have the `resource:action` form using lowercase "
                            + "letters, numbers, dot (.), underscore (_) and minus (-).");
        }
        return value;
    }

    public static String optionalText(String field, String value) {
        if (value != null && value.length() > MAX_LENGTH) {
            throw new InvalidInputException(field,
                    "The " + field + " must be less than " + MAX_LENGTH + " characters in length.");
        }
        return value;
    }

    private static String lowercaseName(String field, String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidInputException(field, "The " + field + " must be non-empty.");
        }
        if (value.length() > MAX_LENGTH) {
            throw new InvalidInputException(field,
                    "The " + field + " must be less than " + MAX_LENGTH + " characters in length.");
        }
        if (!NAME.matcher(value).matches()) {
            throw new InvalidInputException(field,
                    "The " + field + " can include lowercase letters, numbers, underscore (_) and minus (-) characters.");
        }
        return value;
    }
}
