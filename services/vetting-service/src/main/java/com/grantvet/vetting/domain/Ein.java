package com.grantvet.vetting.domain;

import com.grantvet.common.exception.InvalidArgumentException;

import java.util.regex.Pattern;

/**
 * Employer Identification Number helpers.
 * The canonical (normalized) form is nine digits without separators.
 */
public final class Ein {

    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]");
    private static final Pattern NINE_DIGITS = Pattern.compile("\\d{9}");

    private Ein() {
    }

    /**
     * Strip dashes and whitespace and require exactly nine digits.
     *
     * @throws InvalidArgumentException if the identifier is null or malformed
     */
    public static String normalize(String ein) {
        if (ein == null) {
            throw new InvalidArgumentException("EIN is required");
        }
        String stripped = SEPARATORS.matcher(ein).replaceAll("");
        if (!NINE_DIGITS.matcher(stripped).matches()) {
            throw new InvalidArgumentException(
                    "Malformed EIN \"" + ein + "\": expected 9 digits, e.g. 12-3456789 or 123456789");
        }
        return stripped;
    }

    /**
     * Lenient comparison form used for policy lists: separators removed, no validation.
     */
    public static String strip(String ein) {
        return ein == null ? "" : SEPARATORS.matcher(ein).replaceAll("");
    }

    /**
     * Render a normalized EIN as XX-XXXXXXX.
     */
    public static String format(String ein) {
        String normalized = normalize(ein);
        return normalized.substring(0, 2) + "-" + normalized.substring(2);
    }
}
