package com.grantvet.vetting.sanctions;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical form for organization names.
 *
 * Steps: strip diacritics, lowercase, "&" to "and", drop apostrophes, turn
 * remaining punctuation into spaces, collapse whitespace, then remove a
 * leading "the" and trailing corporate suffixes. A name is never reduced to
 * nothing: the last remaining word is always kept. The result is a fixed
 * point, {@code normalize(normalize(x)) == normalize(x)}.
 */
public final class NameNormalizer {

    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    static final Set<String> CORPORATE_SUFFIXES = Set.of(
            "inc", "incorporated", "corp", "corporation", "co", "company",
            "llc", "llp", "lp", "ltd", "limited", "plc", "pc", "nfp",
            "foundation", "fdn", "fund", "trust", "association", "assn", "org");

    private static final String LEADING_ARTICLE = "the";

    private NameNormalizer() {
    }

    public static NormalizedName normalize(String name) {
        if (name == null) {
            return new NormalizedName("");
        }
        String text = StringUtils.stripAccents(name).toLowerCase(Locale.ROOT);
        text = text.replace("&", " and ");
        text = APOSTROPHES.matcher(text).replaceAll("");
        text = NON_ALPHANUMERIC.matcher(text).replaceAll(" ").trim();
        if (text.isEmpty()) {
            return new NormalizedName("");
        }

        List<String> words = new ArrayList<>(Arrays.asList(text.split(" ")));
        while (words.size() > 1 && LEADING_ARTICLE.equals(words.get(0))) {
            words.remove(0);
        }
        while (words.size() > 1 && CORPORATE_SUFFIXES.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return new NormalizedName(String.join(" ", words));
    }
}
