package io.github.cyfko.querier.core.spi;

import java.util.List;

/**
 * Applies validated eager-load hints to a source.
 * <p>
 * The names handed over are already filtered through the registry allow-list, deduplicated and
 * spelled as declared. The applier is never invoked with an empty list.
 * </p>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 */
@FunctionalInterface
public interface IncludeApplier<T> {

    QuerySource<T> apply(QuerySource<T> source, List<String> includes);
}
