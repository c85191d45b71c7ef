package com.delta.siteaudit.crawl.model;

import java.util.List;

public record ExtractedContent(
    String title,
    String metaDescription,
    String text,
    int wordCount,
    List<String> links
) {
}
