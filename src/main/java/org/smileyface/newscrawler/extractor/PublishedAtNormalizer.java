package org.smileyface.newscrawler.extractor;

import org.smileyface.newscrawler.model.ArticleRecord;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Turns a scraped Korean timestamp such as {@code "기사입력 2025.12.15. 오후 1:23"} into the canonical
 * {@code "2025-12-15 13:23:00"}. Anything that does not fit the expected shape is returned unchanged,
 * so sentinels and already-canonical values pass through.
 */
public class PublishedAtNormalizer {

    private static final String PUBLISHED_PREFIX = "기사입력";
    private static final String INPUT_PREFIX = "입력";
    private static final String PM = "오후";
    private static final String AM = "오전";

    private static final DateTimeFormatter SCRAPED = DateTimeFormatter.ofPattern("uuuu.M.d. H:mm");

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return raw;
        }
        String s = raw.replace(PUBLISHED_PREFIX, "").replace(INPUT_PREFIX, "");
        boolean pm = s.contains(PM);
        boolean am = s.contains(AM);
        s = s.replace(PM, "").replace(AM, "").replaceAll("\\s+", " ").trim();

        LocalDateTime parsed;
        try {
            parsed = LocalDateTime.parse(s, SCRAPED);
        } catch (DateTimeParseException e) {
            return raw;
        }

        int hour = parsed.getHour();
        if (pm && hour != 12) {
            hour += 12;
        } else if (am && hour == 12) {
            hour = 0;
        }
        if (hour > 23) {
            return raw;
        }
        return parsed.withHour(hour).format(ArticleRecord.CANONICAL_DATE_TIME);
    }
}
