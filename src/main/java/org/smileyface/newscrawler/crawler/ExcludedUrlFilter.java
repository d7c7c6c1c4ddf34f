package org.smileyface.newscrawler.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recognises links into content verticals that are never ingested (entertainment, sports, ...).
 * Patterns are Java regular expressions matched with find semantics against the full URL.
 */
public class ExcludedUrlFilter {

    private static final Logger log = LoggerFactory.getLogger(ExcludedUrlFilter.class);

    private final List<Pattern> excludes;

    public ExcludedUrlFilter(List<String> rawPatterns) {
        this.excludes = compilePatterns(rawPatterns);
    }

    public static ExcludedUrlFilter from(CrawlerProperties properties) {
        return new ExcludedUrlFilter(properties.getExcludeUrlPatterns());
    }

    public boolean isExcluded(String url) {
        if (url == null) return false;
        for (Pattern p : excludes) {
            if (p.matcher(url).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compilePatterns(List<String> raw) {
        List<Pattern> out = new ArrayList<>();
        if (raw == null) return out;
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            try {
                out.add(Pattern.compile(s));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid exclude pattern in crawler config: {} (ignored)", s);
            }
        }
        return out;
    }
}
