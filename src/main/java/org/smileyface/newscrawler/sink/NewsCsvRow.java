package org.smileyface.newscrawler.sink;

import org.apache.commons.csv.CSVRecord;
import org.smileyface.newscrawler.model.ArticleRecord;

import java.util.List;

/**
 * One line of the news CSV file. Every column is kept as text; empty means absent.
 */
public class NewsCsvRow {

    static final String[] HEADER = {"NDATE", "TITLE", "CONTENT", "LINK", "OID", "INDUSTRY", "SENT_SCORE"};

    String ndate = "";
    String title = "";
    String content = "";
    String link = "";
    String oid = "";
    String industry = "";
    String sentScore = "";

    public static NewsCsvRow from(ArticleRecord record) {
        NewsCsvRow row = new NewsCsvRow();
        row.ndate = nz(record.getPublishedAt());
        row.title = nz(record.getTitle());
        row.content = nz(record.getBody());
        row.link = nz(record.getUrl());
        row.oid = nz(record.getSourceId());
        row.industry = nz(record.getIndustry());
        row.sentScore = record.getSentimentScore() == null ? "" : record.getSentimentScore().toString();
        return row;
    }

    static NewsCsvRow from(CSVRecord record) {
        NewsCsvRow row = new NewsCsvRow();
        row.ndate = column(record, "NDATE");
        row.title = column(record, "TITLE");
        row.content = column(record, "CONTENT");
        row.link = column(record, "LINK");
        row.oid = column(record, "OID");
        row.industry = column(record, "INDUSTRY");
        row.sentScore = column(record, "SENT_SCORE");
        return row;
    }

    /** Values in {@link #HEADER} order. */
    List<String> values() {
        return List.of(ndate, title, content, link, oid, industry, sentScore);
    }

    public ArticleRecord toRecord() {
        ArticleRecord r = new ArticleRecord();
        r.setUrl(link);
        r.setPublishedAt(ndate);
        r.setTitle(title);
        r.setBody(content);
        r.setSourceId(oid);
        r.setIndustry(blankToNull(industry));
        r.setSentimentScore(parseScore(blankToNull(sentScore)));
        return r;
    }

    private static String column(CSVRecord record, String name) {
        return record.isMapped(name) && record.isSet(name) ? record.get(name) : "";
    }

    private static Double parseScore(String s) {
        if (s == null) return null;
        try {
            return Double.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
