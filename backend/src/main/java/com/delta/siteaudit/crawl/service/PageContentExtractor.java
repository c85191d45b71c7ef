package com.delta.siteaudit.crawl.service;

import com.delta.siteaudit.crawl.model.ExtractedContent;
import com.delta.siteaudit.crawl.util.SiteOrigin;
import com.delta.siteaudit.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class PageContentExtractor {
    private static final Set<String> SKIPPED_EXTENSIONS = Set.of(
        ".pdf", ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".ico",
        ".zip", ".gz", ".exe", ".dmg", ".mp3", ".mp4", ".mov", ".avi",
        ".css", ".js", ".json", ".xml", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx"
    );

    public ExtractedContent extract(String html, String pageUrl, SiteOrigin origin) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl);

        String title = doc.title() == null ? "" : doc.title().trim();
        Element description = doc.selectFirst("meta[name=description]");
        String metaDescription = description == null ? "" : description.attr("content").trim();
        List<String> links = extractLinks(doc, origin);

        doc.select("script, style, nav, footer, header, noscript, template, svg").remove();
        String text = doc.body() == null ? "" : doc.body().text().trim();
        int wordCount = text.isEmpty() ? 0 : text.split("\\s+").length;
        return new ExtractedContent(title, metaDescription, text, wordCount, links);
    }

    private List<String> extractLinks(Document doc, SiteOrigin origin) {
        LinkedHashSet<String> links = new LinkedHashSet<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#")) {
                continue;
            }
            String lowered = href.toLowerCase(Locale.ROOT);
            if (lowered.startsWith("javascript:") || lowered.startsWith("mailto:") || lowered.startsWith("tel:")) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            URI uri = UrlNormalizer.safeUri(absolute);
            if (uri == null || uri.getScheme() == null) {
                continue;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                continue;
            }
            if (!origin.isSameSite(uri) || hasSkippedExtension(uri)) {
                continue;
            }
            links.add(stripFragment(absolute));
        }
        return new ArrayList<>(links);
    }

    private static boolean hasSkippedExtension(URI uri) {
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < path.lastIndexOf('/')) {
            return false;
        }
        return SKIPPED_EXTENSIONS.contains(path.substring(dot));
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
