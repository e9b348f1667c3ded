package io.github.cyfko.querier.core.compile;

import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.model.QuerierConstants;
import io.github.cyfko.querier.core.spi.IncludeApplier;
import io.github.cyfko.querier.core.spi.QuerySource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Filters eager-load hints through the registry allow-list.
 *
 * @param <T> entity type
 * @author Frank KOSSI
 */
public class IncludeResolver<T> {

    private static final Logger logger = Logger.getLogger(IncludeResolver.class.getName());

    private final FieldRegistry<T> registry;

    public IncludeResolver(FieldRegistry<T> registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    /**
     * Resolves the allow-listed hints of a comma-separated include expression.
     *
     * @param include raw expression, may be null
     * @return the declared spellings of the allowed hints, deduplicated, in encounter order
     */
    public List<String> resolve(String include) {
        if (include == null || include.isBlank()) {
            return List.of();
        }
        Set<String> resolved = new LinkedHashSet<>();
        for (String part : include.split(QuerierConstants.LIST_SEPARATOR)) {
            String name = part.trim();
            if (name.isEmpty()) {
                continue;
            }
            Optional<String> declared = registry.findInclude(name);
            if (declared.isPresent()) {
                resolved.add(declared.get());
            } else {
                logger.fine(() -> String.format("Ignoring include '%s' not allowed for %s",
                        name, registry.getEntityType().getSimpleName()));
            }
        }
        return List.copyOf(new ArrayList<>(resolved));
    }

    /**
     * Applies the allowed hints to a source.
     *
     * @param source  the source
     * @param include raw include expression
     * @param applier applier receiving the allowed hints, may be null
     * @return the source with eager loading applied, or the unchanged source when no hint survives
     */
    public QuerySource<T> apply(QuerySource<T> source, String include, IncludeApplier<T> applier) {
        List<String> includes = resolve(include);
        if (includes.isEmpty() || applier == null) {
            return source;
        }
        logger.fine(() -> "Applying includes " + includes);
        return applier.apply(source, includes);
    }
}
