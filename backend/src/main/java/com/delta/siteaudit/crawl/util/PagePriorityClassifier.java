package com.delta.siteaudit.crawl.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Path keyword heuristics ranking pages by how much they tell a reader about the business.
 * Tier 0 is the homepage, tier 3 everything unrecognized.
 */
public final class PagePriorityClassifier {
    public static final int HOMEPAGE = 0;
    public static final int PRIMARY = 1;
    public static final int SECONDARY = 2;
    public static final int OTHER = 3;

    private static final List<String> PRIMARY_HINTS = List.of(
        "about",
        "pricing",
        "price",
        "services",
        "products",
        "solutions",
        "case-stud",
        "portfolio",
        "customers",
        "testimonial",
        "reviews"
    );

    private static final List<String> SECONDARY_HINTS = List.of(
        "faq",
        "contact",
        "blog",
        "features",
        "resources",
        "how-it-works",
        "use-case",
        "industries",
        "team"
    );

    private PagePriorityClassifier() {
    }

    public static int classify(String url) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null) {
            return OTHER;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        if (path.isEmpty() || path.equals("/") || path.equals("/index.html") || path.equals("/index.php")) {
            return HOMEPAGE;
        }
        for (String hint : PRIMARY_HINTS) {
            if (path.contains(hint)) {
                return PRIMARY;
            }
        }
        for (String hint : SECONDARY_HINTS) {
            if (path.contains(hint)) {
                return SECONDARY;
            }
        }
        return OTHER;
    }
}
