package org.smileyface.newscrawler.sink;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.newscrawler.enrichment.EnrichableArticleStore;
import org.smileyface.newscrawler.model.ArticleRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Appends articles to a UTF-8 CSV file with a byte order mark, so spreadsheet tools detect the encoding.
 * <p>
 * Columns: {@code NDATE,TITLE,CONTENT,LINK,OID,INDUSTRY,SENT_SCORE}. The header is written once when
 * the file is created; every record is flushed as it is written. All file access is serialized on this
 * instance.
 */
public class CsvArticleSink implements ArticleSink, EnrichableArticleStore {

    private static final Logger log = LogManager.getLogger();

    static final char BOM = '\uFEFF';

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    private final Path path;

    // urls in the file; loaded on first use
    private Set<String> storedUrls;

    public CsvArticleSink(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized SinkOutcome write(ArticleRecord record) throws SinkException {
        Set<String> urls = storedUrls();
        if (urls.contains(record.getUrl())) {
            return SinkOutcome.DUPLICATE;
        }
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
             CSVPrinter printer = new CSVPrinter(w, WRITE_FORMAT)) {
            printer.printRecord(NewsCsvRow.from(record).values());
        } catch (IOException e) {
            throw new SinkException("Failed to append " + record.getUrl() + " to " + path, e);
        }
        urls.add(record.getUrl());
        return SinkOutcome.WRITTEN;
    }

    @Override
    public synchronized Set<String> loadStoredUrls() throws SinkException {
        return Set.copyOf(storedUrls());
    }

    @Override
    public synchronized List<ArticleRecord> findMissingIndustry(LocalDate from, LocalDate to) throws SinkException {
        List<ArticleRecord> out = new ArrayList<>();
        for (NewsCsvRow row : readRows()) {
            ArticleRecord r = row.toRecord();
            if (r.getIndustry() == null && inWindow(r, from, to)) {
                out.add(r);
            }
        }
        return out;
    }

    @Override
    public synchronized List<ArticleRecord> findMissingSentiment(Collection<String> industries,
                                                                 LocalDate from, LocalDate to) throws SinkException {
        List<ArticleRecord> out = new ArrayList<>();
        if (industries == null || industries.isEmpty()) return out;
        for (NewsCsvRow row : readRows()) {
            ArticleRecord r = row.toRecord();
            if (r.getSentimentScore() == null && industries.contains(r.getIndustry()) && inWindow(r, from, to)) {
                out.add(r);
            }
        }
        return out;
    }

    /**
     * Rewrites the whole file through a temporary sibling, then moves it into place.
     */
    @Override
    public synchronized int updateEnrichment(List<ArticleRecord> records) throws SinkException {
        if (records == null || records.isEmpty()) return 0;
        Map<String, ArticleRecord> byUrl = new HashMap<>();
        for (ArticleRecord r : records) {
            byUrl.put(r.getUrl(), r);
        }

        List<NewsCsvRow> rows = readRows();
        int updated = 0;
        for (NewsCsvRow row : rows) {
            ArticleRecord u = byUrl.get(row.link);
            if (u == null) continue;
            if (u.getIndustry() != null) row.industry = u.getIndustry();
            if (u.getSentimentScore() != null) row.sentScore = u.getSentimentScore().toString();
            updated++;
        }

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(w, WRITE_FORMAT)) {
                w.write(BOM);
                printer.printRecord((Object[]) NewsCsvRow.HEADER);
                for (NewsCsvRow row : rows) {
                    printer.printRecord(row.values());
                }
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new SinkException("Failed to rewrite " + path, e);
        }
        log.info("Enrichment applied to {} rows of {}", updated, path);
        return updated;
    }

    private Set<String> storedUrls() throws SinkException {
        if (storedUrls == null) {
            Set<String> urls = new LinkedHashSet<>();
            for (NewsCsvRow row : readRows()) {
                if (row.link != null && !row.link.isBlank()) urls.add(row.link);
            }
            storedUrls = urls;
            log.debug("Loaded {} stored urls from {}", urls.size(), path);
        }
        return storedUrls;
    }

    private List<NewsCsvRow> readRows() throws SinkException {
        ensureFile();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            skipBom(reader);
            List<NewsCsvRow> rows = new ArrayList<>();
            try (CSVParser parser = READ_FORMAT.parse(reader)) {
                for (CSVRecord record : parser) {
                    rows.add(NewsCsvRow.from(record));
                }
            }
            return rows;
        } catch (IOException | RuntimeException e) {
            throw new SinkException("Failed to read " + path, e);
        }
    }

    private void ensureFile() throws SinkException {
        if (Files.exists(path)) return;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
                 CSVPrinter printer = new CSVPrinter(w, WRITE_FORMAT)) {
                w.write(BOM);
                printer.printRecord((Object[]) NewsCsvRow.HEADER);
            }
            log.info("Created news CSV {}", path);
        } catch (IOException e) {
            throw new SinkException("Failed to create " + path, e);
        }
    }

    private static void skipBom(Reader reader) throws IOException {
        reader.mark(1);
        int first = reader.read();
        if (first != BOM) {
            reader.reset();
        }
    }

    private static boolean inWindow(ArticleRecord r, LocalDate from, LocalDate to) {
        if (from == null && to == null) return true;
        LocalDateTime published = r.getPublishedDateTime();
        if (published == null) return false;
        LocalDate day = published.toLocalDate();
        return (from == null || !day.isBefore(from)) && (to == null || !day.isAfter(to));
    }
}
