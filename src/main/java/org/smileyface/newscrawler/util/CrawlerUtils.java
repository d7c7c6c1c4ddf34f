package org.smileyface.newscrawler.util;

import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.elasticsearch.ElasticContext;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class CrawlerUtils {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Lower-case hex SHA-256 of the given text (UTF-8). Null is hashed as the empty string.
     */
    public static String sha256Hex(String text) {
        byte[] data = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    /**
     * Collapses every run of line breaks (and the whitespace around them) into a single space and trims.
     */
    public static String flattenLines(String input) {
        if (input == null) {
            return null;
        }
        return input.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
    }

    /**
     * Returns at most {@code max} leading characters of the input.
     */
    public static String head(String input, int max) {
        if (input == null) return "";
        return input.length() <= max ? input : input.substring(0, max);
    }

    /**
     * Builds the Elasticsearch index name by concatenating the sink indexPrefix and the tenantId
     * from the ElasticContext with a dash in between: prefix + "-" + tenantId.
     *
     * If the prefix is null/blank, returns null to signal "do not index".
     * If the context is null or has a blank tenant id, "default" is used as the tenant id.
     */
    public static String getIndexName(CrawlerProperties props, ElasticContext ctx) {
        if (props == null) return null;
        String prefix = props.getSink().getIndexPrefix();
        if (prefix == null || prefix.isBlank()) return null;
        String tenant = (ctx == null || ctx.getTenantId() == null || ctx.getTenantId().isBlank())
                ? "default"
                : ctx.getTenantId();
        return prefix + "-" + tenant;
    }
}
