package io.github.cyfko.querier.core.cache;

import io.github.cyfko.querier.core.model.QuerierParams;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Generates deterministic cache keys for search requests.
 * <p>
 * Keys have the shape {@code {entity}:querier:{hash}}, where the hash is the first 16 hex digits
 * of the SHA-256 of a canonical rendering of the parameters. The rendering sorts filters and
 * operators ignoring case, so equal parameters always yield the same key whatever the order
 * they were received in.
 * </p>
 *
 * <pre>{@code
 * String key = QuerierKeyGenerator.generateKey("Company", params);   // "company:querier:3fa9c1..."
 * cache.evictMatching(QuerierKeyGenerator.generatePattern("Company")); // "company:querier:*"
 * }</pre>
 *
 * @author Frank KOSSI
 */
public final class QuerierKeyGenerator {

    private static final String SEGMENT = ":querier:";
    private static final int HASH_LENGTH = 16;

    private QuerierKeyGenerator() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    public static String generateKey(String entityName, QuerierParams params) {
        Objects.requireNonNull(params, "params cannot be null");
        return normalizeEntity(entityName) + SEGMENT + hash(canonicalForm(params));
    }

    public static String generatePattern(String entityName) {
        return normalizeEntity(entityName) + SEGMENT + "*";
    }

    static String canonicalForm(QuerierParams params) {
        StringBuilder sb = new StringBuilder();
        append(sb, "q", params.freeText());
        append(sb, "sort", params.sort());
        append(sb, "include", params.include());
        append(sb, "fields", String.join(",", params.fields()));
        append(sb, "page", String.valueOf(params.page()));
        append(sb, "pageSize", String.valueOf(params.pageSize()));

        Map<String, Map<String, String>> filters = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        filters.putAll(params.filters());
        filters.forEach((field, operators) -> {
            Map<String, String> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            sorted.putAll(operators);
            sorted.forEach((operator, value) ->
                    append(sb, "filter[" + field.toLowerCase(Locale.ROOT) + "][" + operator.toLowerCase(Locale.ROOT) + "]", value));
        });
        return sb.toString();
    }

    private static void append(StringBuilder sb, String key, String value) {
        if (value == null) {
            return;
        }
        // length prefix keeps values containing separators unambiguous
        sb.append(key).append('=').append(value.length()).append(':').append(value).append(';');
    }

    private static String hash(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String normalizeEntity(String entityName) {
        if (entityName == null || entityName.isBlank()) {
            throw new IllegalArgumentException("Entity name cannot be null or blank");
        }
        return entityName.trim().toLowerCase(Locale.ROOT);
    }
}
