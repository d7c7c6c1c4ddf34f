package org.smileyface.newscrawler.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.DeleteIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.smileyface.newscrawler.model.ArticleRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Thin wrapper around the Elasticsearch Java API client exposing the index and document operations
 * the article sink needs.
 */
public class ElasticRestClient implements Closeable {

    private static final Logger log = LogManager.getLogger();

    private static final int PAGE_SIZE = 1000;
    private static final int CONFLICT = 409;

    private final RestClient lowLevel;
    private final ElasticsearchClient client;

    /**
     * Constructs the client using the provided ElasticContext by internally creating the underlying
     * Elasticsearch Java API client.
     */
    public ElasticRestClient(ElasticContext context) {
        if (context == null) {
            log.error("ElasticContext must not be null");
            throw new IllegalArgumentException("ElasticContext must not be null");
        }

        log.info("ElasticRestClient initializing on {}:{}", context.getAddress(), context.getPort());
        RestClientBuilder builder = RestClient.builder(new HttpHost(context.getAddress(), context.getPort(), "http"));
        if (context.hasCredentials()) {
            BasicCredentialsProvider creds = new BasicCredentialsProvider();
            creds.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(context.getUsername(), context.getPassword()));
            builder.setHttpClientConfigCallback(clientBuilder -> clientBuilder.setDefaultCredentialsProvider(creds));
        }
        this.lowLevel = builder.build();
        ElasticsearchTransport transport = new RestClientTransport(lowLevel, new JacksonJsonpMapper());
        this.client = new ElasticsearchClient(transport);
    }

    // ---------------- Indices ----------------

    public boolean indexExists(String indexName) throws IOException {
        return client.indices().exists(ExistsRequest.of(b -> b.index(indexName))).value();
    }

    /**
     * Creates an index with the provided JSON body (settings/mappings). The JSON should not include the index name.
     * @return true if created, false if already exists
     */
    public boolean createIndex(String indexName, String jsonBody) throws IOException {
        try {
            if (indexExists(indexName)) return false;
            client.indices().create(CreateIndexRequest.of(b -> b.index(indexName).withJson(new StringReader(jsonBody))));
            log.debug("Index {} created with settings/mappings: {}", indexName, jsonBody);
            return true;
        } catch (ElasticsearchException e) {
            if ("resource_already_exists_exception".equals(e.error().type())) {
                // created concurrently by another worker
                return false;
            }
            log.error("Failed to create index {}", indexName, e);
            throw e;
        }
    }

    /**
     * Deletes the given index if it exists.
     * @return true if deleted, false if it did not exist
     */
    public boolean deleteIndex(String indexName) throws IOException {
        try {
            if (!indexExists(indexName)) return false;
            client.indices().delete(DeleteIndexRequest.of(b -> b.index(indexName)));
            log.debug("Index {} deleted", indexName);
            return true;
        } catch (ElasticsearchException e) {
            log.error("Failed to delete index {}", indexName, e);
            throw e;
        }
    }

    /**
     * Makes recently written documents visible to search.
     */
    public void refresh(String indexName) throws IOException {
        client.indices().refresh(r -> r.index(indexName));
    }

    // ---------------- Documents ----------------

    /**
     * Creates the article document under its url hash id, failing on an existing id instead of overwriting.
     *
     * @return true when created, false when a document with the same id already exists
     */
    public boolean createDocument(String indexName, ArticleRecord document) throws IOException {
        if (indexName == null || indexName.isBlank()) {
            throw new IllegalArgumentException("indexName must not be null/blank");
        }
        if (document == null || document.getId() == null) {
            throw new IllegalArgumentException("document with an id is required");
        }
        try {
            client.create(b -> b.index(indexName).id(document.getId()).document(document));
            log.debug("Created document id={} url={}", document.getId(), document.getUrl());
            return true;
        } catch (ElasticsearchException e) {
            if (e.status() == CONFLICT) {
                return false;
            }
            log.error("Failed to create document {} in index {}", document.getUrl(), indexName, e);
            throw e;
        }
    }

    /**
     * Fetches a document by id. Returns null if the document is not found.
     */
    public ArticleRecord getDocument(String indexName, String id) throws IOException {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null/blank");
        }
        try {
            var resp = client.get(b -> b.index(indexName).id(id), ArticleRecord.class);
            if (!resp.found() || resp.source() == null) {
                log.debug("Document with id: {} not found", id);
                return null;
            }
            return resp.source();
        } catch (ElasticsearchException e) {
            log.error("Failed to get document with id {} from index {}", id, indexName, e);
            throw e;
        }
    }

    /**
     * Collects the url of every document in the index, paging with search_after on the id field.
     */
    public Set<String> collectUrls(String indexName) throws IOException {
        Set<String> urls = new HashSet<>();
        if (!indexExists(indexName)) return urls;
        String after = null;
        try {
            while (true) {
                final String cursor = after;
                SearchResponse<ArticleRecord> resp = client.search(s -> {
                    s.index(indexName)
                            .size(PAGE_SIZE)
                            .query(q -> q.matchAll(m -> m))
                            .source(src -> src.filter(f -> f.includes("url")))
                            .sort(so -> so.field(f -> f.field("id").order(SortOrder.Asc)));
                    if (cursor != null) {
                        s.searchAfter(List.of(FieldValue.of(cursor)));
                    }
                    return s;
                }, ArticleRecord.class);
                List<Hit<ArticleRecord>> hits = resp.hits().hits();
                for (Hit<ArticleRecord> h : hits) {
                    if (h.source() != null && h.source().getUrl() != null) urls.add(h.source().getUrl());
                }
                if (hits.size() < PAGE_SIZE) break;
                after = hits.get(hits.size() - 1).id();
            }
        } catch (ElasticsearchException e) {
            log.error("Failed to collect urls of index {}", indexName, e);
            throw e;
        }
        return urls;
    }

    /**
     * Executes a match_all search on the specified index (first 1000 hits).
     * Intended primarily for validation in tests.
     */
    public List<ArticleRecord> searchAll(String indexName) throws IOException {
        try {
            SearchResponse<ArticleRecord> resp = client.search(s -> s
                            .index(indexName)
                            .query(q -> q.matchAll(m -> m))
                            .size(PAGE_SIZE),
                    ArticleRecord.class);
            List<ArticleRecord> out = new ArrayList<>();
            for (Hit<ArticleRecord> h : resp.hits().hits()) {
                if (h.source() != null) out.add(h.source());
            }
            return out;
        } catch (ElasticsearchException e) {
            log.error("Failed to search index {}", indexName, e);
            throw e;
        }
    }

    @Override
    public void close() throws IOException {
        lowLevel.close();
    }
}
