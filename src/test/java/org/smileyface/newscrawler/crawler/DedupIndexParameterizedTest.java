package org.smileyface.newscrawler.crawler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests for DedupIndex implementations. The Redis-backed implementation is included when a
 * Redis Testcontainer can be started.
 */
class DedupIndexParameterizedTest {

    private static Logger logger = LogManager.getLogger(DedupIndexParameterizedTest.class);
    private static GenericContainer<?> redisContainer;
    private static List<Arguments> IMPLEMENTATIONS;

    static Stream<Arguments> indexImplementations() {
        if (IMPLEMENTATIONS == null) {
            synchronized (DedupIndexParameterizedTest.class) {
                if (IMPLEMENTATIONS == null) {
                    IMPLEMENTATIONS = new ArrayList<>();
                    IMPLEMENTATIONS.add(Arguments.of(
                            "InMemoryDedupIndex",
                            (Supplier<DedupIndex>) InMemoryDedupIndex::new
                    ));

                    try {
                        redisContainer = new GenericContainer<>("redis:7.2.4").withExposedPorts(6379);
                        redisContainer.start();

                        Supplier<DedupIndex> redisSupplier = () -> {
                            LettuceConnectionFactory cf = new LettuceConnectionFactory(
                                    redisContainer.getHost(), redisContainer.getMappedPort(6379));
                            cf.afterPropertiesSet();
                            StringRedisTemplate template = new StringRedisTemplate(cf);
                            CrawlerProperties props = new CrawlerProperties();
                            props.getDedup().setNamespace("test:" + UUID.randomUUID());
                            return new RedisDedupIndex(template, props);
                        };
                        IMPLEMENTATIONS.add(Arguments.of("RedisDedupIndex", redisSupplier));
                    } catch (Throwable t) {
                        // Docker not available; only the in-memory implementation is tested
                        logger.error("Failed to start Redis Testcontainer: {}", t.getMessage(), t);
                    }
                }
            }
        }
        return IMPLEMENTATIONS.stream();
    }

    @AfterAll
    static void tearDown() {
        if (redisContainer != null) {
            try {
                redisContainer.stop();
            } finally {
                redisContainer = null;
            }
        }
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("indexImplementations")
    @DisplayName("unknownUrlIsNotIngested")
    void unknownUrlIsNotIngested(String implName, Supplier<DedupIndex> supplier) {
        DedupIndex index = supplier.get();
        assertFalse(index.has("https://n.news.naver.com/article/009/0001"));
        assertFalse(index.has(null));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("indexImplementations")
    @DisplayName("recordIsIdempotent")
    void recordIsIdempotent(String implName, Supplier<DedupIndex> supplier) {
        DedupIndex index = supplier.get();
        String url = "https://n.news.naver.com/article/009/0002";

        index.record(url);
        index.record(url);

        assertTrue(index.has(url));
        assertFalse(index.has(url + "?x=1"));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("indexImplementations")
    @DisplayName("blankUrlsAreIgnored")
    void blankUrlsAreIgnored(String implName, Supplier<DedupIndex> supplier) {
        DedupIndex index = supplier.get();
        index.record(null);
        index.record("  ");
        assertFalse(index.has("  "));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("indexImplementations")
    @DisplayName("concurrentRecordsAreAllVisible")
    void concurrentRecordsAreAllVisible(String implName, Supplier<DedupIndex> supplier) throws Exception {
        DedupIndex index = supplier.get();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            String url = "https://example.com/article/" + (i % 100);
            pool.submit(() -> index.record(url));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        for (int i = 0; i < 100; i++) {
            assertTrue(index.has("https://example.com/article/" + i), "missing " + i);
        }
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("indexImplementations")
    @DisplayName("freshInstancesStartEmpty")
    void freshInstancesStartEmpty(String implName, Supplier<DedupIndex> supplier) {
        // each supplier call is a fresh, empty store
        DedupIndex first = supplier.get();
        DedupIndex second = supplier.get();
        first.record("https://example.com/a");
        assertFalse(second.has("https://example.com/a"));
    }
}
