package io.github.cyfko.querier.jpa.utils;

import jakarta.persistence.criteria.Fetch;
import jakarta.persistence.criteria.FetchParent;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.Metamodel;

/**
 * Utility resolving dot-notation attribute paths against a Criteria query root.
 * <p>
 * Association segments (relations and collections) become LEFT joins, reused when the same
 * attribute was already joined from the same parent, so that several predicates on
 * {@code "settings.key"} and {@code "settings.value"} share one join. Embedded segments are
 * navigated with {@link Path#get(String)}.
 * </p>
 *
 * <h2>Usage example:</h2>
 * <pre>{@code
 * Root<Company> root = query.from(Company.class);
 * Path<?> city = PathResolverUtils.resolvePath(root, "address.city", em.getMetamodel());
 * Path<?> key = PathResolverUtils.resolvePath(root, "settings.key", em.getMetamodel());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PathResolverUtils {

    private PathResolverUtils() {
        throw new UnsupportedOperationException("PathResolverUtils is a utility class and cannot be instantiated");
    }

    /**
     * Resolves the given path from the provided root.
     *
     * @param root      the root (or join) to start from
     * @param path      attribute path in dot notation
     * @param metamodel metamodel used to tell associations from embedded attributes
     * @return the resolved path
     * @throws IllegalArgumentException if the path is blank or a segment is not an attribute
     */
    public static Path<?> resolvePath(From<?, ?> root, String path, Metamodel metamodel) {
        if (root == null) {
            throw new IllegalArgumentException("Root cannot be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be null or blank");
        }

        String[] segments = path.split("\\.");
        Path<?> current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            String segment = segments[i];
            if (current instanceof From<?, ?> from && isAssociation(metamodel, from.getJavaType(), segment)) {
                current = joinOnce(from, segment);
            } else {
                current = current.get(segment);
            }
        }
        return current.get(segments[segments.length - 1]);
    }

    /**
     * Adds LEFT fetch joins for every segment of a dot-notation path, reusing existing fetches.
     *
     * @param root the root to fetch from
     * @param path association path in dot notation
     */
    public static void fetchPath(FetchParent<?, ?> root, String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be null or blank");
        }
        FetchParent<?, ?> current = root;
        for (String segment : path.split("\\.")) {
            current = fetchOnce(current, segment);
        }
    }

    private static boolean isAssociation(Metamodel metamodel, Class<?> type, String attributeName) {
        Attribute<?, ?> attribute = metamodel.managedType(type).getAttribute(attributeName);
        return attribute.isAssociation() || attribute.isCollection();
    }

    private static From<?, ?> joinOnce(From<?, ?> from, String attribute) {
        return from.getJoins().stream()
                .filter(j -> j.getAttribute().getName().equals(attribute))
                .findFirst()
                .map(j -> (From<?, ?>) j)
                .orElseGet(() -> from.join(attribute, JoinType.LEFT));
    }

    private static FetchParent<?, ?> fetchOnce(FetchParent<?, ?> parent, String attribute) {
        for (Fetch<?, ?> fetch : parent.getFetches()) {
            if (fetch.getAttribute().getName().equals(attribute)) {
                return (FetchParent<?, ?>) fetch;
            }
        }
        return (FetchParent<?, ?>) parent.fetch(attribute, JoinType.LEFT);
    }
}
