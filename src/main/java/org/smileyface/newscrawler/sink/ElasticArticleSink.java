package org.smileyface.newscrawler.sink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.newscrawler.elasticsearch.ElasticRestClient;
import org.smileyface.newscrawler.model.ArticleRecord;

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;

/**
 * Indexes articles as Elasticsearch documents whose id is the SHA-256 of the url. Documents are created,
 * never overwritten: an existing id is reported as {@link SinkOutcome#DUPLICATE}.
 */
public class ElasticArticleSink implements ArticleSink, Closeable {

    private static final Logger log = LogManager.getLogger();

    static final String INDEX_BODY = """
            {
              "mappings": {
                "properties": {
                  "id":             { "type": "keyword" },
                  "url":            { "type": "keyword" },
                  "publishedAt":    { "type": "keyword" },
                  "title":          { "type": "text" },
                  "body":           { "type": "text" },
                  "sourceId":       { "type": "keyword" },
                  "crawlTimestamp": { "type": "date", "format": "epoch_millis" },
                  "industry":       { "type": "keyword" },
                  "sentimentScore": { "type": "double" }
                }
              }
            }
            """;

    private final ElasticRestClient client;
    private final String indexName;
    private volatile boolean indexReady;

    public ElasticArticleSink(ElasticRestClient client, String indexName) {
        if (indexName == null || indexName.isBlank()) {
            throw new IllegalArgumentException("indexName must not be null/blank");
        }
        this.client = client;
        this.indexName = indexName;
    }

    public String getIndexName() {
        return indexName;
    }

    @Override
    public SinkOutcome write(ArticleRecord record) throws SinkException {
        try {
            ensureIndex();
            return client.createDocument(indexName, record) ? SinkOutcome.WRITTEN : SinkOutcome.DUPLICATE;
        } catch (IOException | RuntimeException e) {
            throw new SinkException("Failed to index " + record.getUrl() + " into " + indexName, e);
        }
    }

    @Override
    public Set<String> loadStoredUrls() throws SinkException {
        try {
            return client.collectUrls(indexName);
        } catch (IOException | RuntimeException e) {
            throw new SinkException("Failed to load stored urls from " + indexName, e);
        }
    }

    private void ensureIndex() throws IOException {
        if (indexReady) return;
        synchronized (this) {
            if (indexReady) return;
            if (client.createIndex(indexName, INDEX_BODY)) {
                log.info("Created index {}", indexName);
            }
            indexReady = true;
        }
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
