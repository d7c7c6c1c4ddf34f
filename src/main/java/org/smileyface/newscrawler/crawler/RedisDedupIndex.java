package org.smileyface.newscrawler.crawler;

import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed {@link DedupIndex}, durable independently of the sink.
 *
 * Uses a single Redis Set ("{ns}:ingested"); SADD is idempotent so concurrent workers may record the
 * same URL without coordination.
 */
public class RedisDedupIndex implements DedupIndex {

    private final StringRedisTemplate redis;
    private final String ingestedKey;

    public RedisDedupIndex(StringRedisTemplate redisTemplate, CrawlerProperties properties) {
        this.redis = redisTemplate;
        this.ingestedKey = properties.getDedup().getNamespace() + ":ingested";
    }

    @Override
    public boolean has(String url) {
        if (url == null || url.isBlank()) return false;
        Boolean member = redis.opsForSet().isMember(ingestedKey, url);
        return Boolean.TRUE.equals(member);
    }

    @Override
    public void record(String url) {
        if (url == null || url.isBlank()) return;
        redis.opsForSet().add(ingestedKey, url);
    }

    String getIngestedKey() {
        return ingestedKey;
    }
}
