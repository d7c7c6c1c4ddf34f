package org.smileyface.newscrawler.crawler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link DedupIndex} backed by a concurrent set.
 * <p>
 * It holds no durable state of its own: it is seeded once at start-up with the URLs already stored
 * in the sink, and the sink is what survives a restart.
 */
public class InMemoryDedupIndex implements DedupIndex {

    private static final Logger log = LogManager.getLogger();

    private final Set<String> ingested = ConcurrentHashMap.newKeySet();

    public InMemoryDedupIndex() {
    }

    public InMemoryDedupIndex(Collection<String> storedUrls) {
        if (storedUrls != null) {
            for (String url : storedUrls) {
                record(url);
            }
        }
        log.info("In-memory dedup index seeded with {} stored urls", ingested.size());
    }

    @Override
    public boolean has(String url) {
        return url != null && ingested.contains(url);
    }

    @Override
    public void record(String url) {
        if (url == null || url.isBlank()) return;
        ingested.add(url);
    }

    public int size() {
        return ingested.size();
    }
}
