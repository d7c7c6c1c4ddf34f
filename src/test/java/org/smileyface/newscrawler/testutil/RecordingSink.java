package org.smileyface.newscrawler.testutil;

import org.smileyface.newscrawler.model.ArticleRecord;
import org.smileyface.newscrawler.sink.ArticleSink;
import org.smileyface.newscrawler.sink.SinkException;
import org.smileyface.newscrawler.sink.SinkOutcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sink that keeps records by url and can be told to fail writes for chosen urls.
 */
public class RecordingSink implements ArticleSink {

    private final Map<String, ArticleRecord> records = new LinkedHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private int writeCalls;

    public void failOn(String url) {
        failing.add(url);
    }

    public void heal() {
        failing.clear();
    }

    @Override
    public synchronized SinkOutcome write(ArticleRecord record) throws SinkException {
        writeCalls++;
        if (failing.contains(record.getUrl())) {
            throw new SinkException("injected failure for " + record.getUrl());
        }
        if (records.containsKey(record.getUrl())) {
            return SinkOutcome.DUPLICATE;
        }
        records.put(record.getUrl(), record);
        return SinkOutcome.WRITTEN;
    }

    @Override
    public synchronized Set<String> loadStoredUrls() {
        return Set.copyOf(records.keySet());
    }

    public synchronized List<ArticleRecord> records() {
        return new ArrayList<>(records.values());
    }

    public synchronized List<String> urls() {
        return new ArrayList<>(records.keySet());
    }

    public synchronized int getWriteCalls() {
        return writeCalls;
    }
}
