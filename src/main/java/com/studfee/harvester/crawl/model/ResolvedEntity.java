package com.studfee.harvester.crawl.model;

import java.util.regex.Pattern;

/**
 * Canonical stallion identity on the auction results site.
 *
 * @param id   six digit stallion register id
 * @param slug canonical url token, lowercase alphanumerics and hyphens
 */
public record ResolvedEntity(
    String id,
    String slug
) {
    private static final Pattern ID_PATTERN = Pattern.compile("[0-9]{6}");
    private static final Pattern SLUG_PATTERN = Pattern.compile("[a-z0-9-]+");

    public ResolvedEntity {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("stallion id must be exactly 6 digits: " + id);
        }
        if (slug == null || !SLUG_PATTERN.matcher(slug).matches()) {
            throw new IllegalArgumentException("slug must be lowercase alphanumerics and hyphens: " + slug);
        }
    }
}
