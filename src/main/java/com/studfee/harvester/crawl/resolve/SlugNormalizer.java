package com.studfee.harvester.crawl.resolve;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns sire names into register url slugs, e.g. {@code "Gio Ponti" -> "gio-ponti"} and
 * {@code "Yoshida (JPN)" -> "yoshida-jpn"}.
 */
public final class SlugNormalizer {
    private static final Pattern COUNTRY_SUFFIX = Pattern.compile("^(.*?)\\s*\\((\\w{2,4})\\)$");
    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9\\- ]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SlugNormalizer() {
    }

    public static String slugify(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim();
        Matcher matcher = COUNTRY_SUFFIX.matcher(trimmed);
        if (matcher.matches()) {
            String base = normalize(matcher.group(1));
            String country = normalize(matcher.group(2));
            if (base.isEmpty()) {
                return country;
            }
            return country.isEmpty() ? base : base + "-" + country;
        }
        return normalize(trimmed);
    }

    /**
     * Slugs to try for a name, most specific first: the country-suffixed slug, then the bare
     * base name when the name carries a country code.
     */
    public static List<String> candidates(String name) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(slugify(name));
        if (name != null) {
            Matcher matcher = COUNTRY_SUFFIX.matcher(name.trim());
            if (matcher.matches()) {
                candidates.add(normalize(matcher.group(1)));
            }
        }
        candidates.remove("");
        return new ArrayList<>(candidates);
    }

    static String normalize(String value) {
        String lowered = value.toLowerCase(Locale.ROOT);
        String stripped = DISALLOWED.matcher(lowered).replaceAll("").trim();
        return WHITESPACE.matcher(stripped).replaceAll("-");
    }
}
