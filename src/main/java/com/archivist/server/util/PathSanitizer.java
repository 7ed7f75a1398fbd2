package com.archivist.server.util;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Checks for untrusted strings that end up as process arguments.
 */
public class PathSanitizer {

    public static final int MAX_ARGUMENT_LENGTH = 1000;

    private static final Pattern DANGEROUS_CHARACTERS = Pattern.compile("[;&|`$\\\\]");

    private static final Pattern SAFE_PATH = Pattern.compile("^[a-zA-Z0-9/._-]+$");

    private PathSanitizer() {}

    /**
     * @return true only for relative paths made of alphanumerics, '/', '.', '-' and '_' without "..".
     */
    public static boolean validate(String path) {
        if (StringUtils.isEmpty(path)) {
            return false;
        }
        if (DANGEROUS_CHARACTERS.matcher(path).find()) {
            return false;
        }
        if (path.contains("..") || path.startsWith("/")) {
            return false;
        }
        return SAFE_PATH.matcher(path).matches();
    }

    /**
     * For identifiers that are not paths (archive names): no metacharacters, no traversal, no leading
     * '-' that the tool would read as an option.
     */
    public static boolean validateArgument(String argument) {
        if (StringUtils.isBlank(argument) || argument.length() > MAX_ARGUMENT_LENGTH) {
            return false;
        }
        if (DANGEROUS_CHARACTERS.matcher(argument).find()) {
            return false;
        }
        return !argument.contains("..") && !argument.startsWith("-");
    }

    /**
     * Removes shell metacharacters and truncates to {@link #MAX_ARGUMENT_LENGTH}.
     */
    public static String sanitize(String argument) {
        if (StringUtils.isEmpty(argument)) {
            return "";
        }
        String sanitized = DANGEROUS_CHARACTERS.matcher(argument).replaceAll("");
        return StringUtils.truncate(sanitized, MAX_ARGUMENT_LENGTH);
    }
}
