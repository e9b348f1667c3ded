package io.github.cyfko.querier.core.compile;

import io.github.cyfko.querier.core.api.FieldAccessor;
import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.api.SortKey;
import io.github.cyfko.querier.core.model.QuerierConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Compiles a sort expression such as {@code "-createdAt,name"} into ordered {@link SortKey}s.
 * <p>
 * Keys are comma-separated and trimmed; a leading {@code -} requests descending order. Keys that
 * are not sortable in the registry are skipped. The first surviving key is the primary order and
 * the following ones are tie-breaks in encounter order.
 * </p>
 * <p>
 * When the expression is absent or blank the registry default sort field is used, descending.
 * An expression whose keys are all unknown yields no key at all, leaving the source order.
 * </p>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 */
public class SortCompiler<T> {

    private static final Logger logger = Logger.getLogger(SortCompiler.class.getName());

    private final FieldRegistry<T> registry;

    public SortCompiler(FieldRegistry<T> registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    public List<SortKey<T>> compile(String sort) {
        if (sort == null || sort.isBlank()) {
            return registry.getDefaultSortField()
                    .<List<SortKey<T>>>map(field -> List.of(SortKey.desc(field)))
                    .orElse(List.of());
        }

        List<SortKey<T>> keys = new ArrayList<>();
        for (String part : sort.split(QuerierConstants.LIST_SEPARATOR)) {
            String token = part.trim();
            boolean descending = token.startsWith(QuerierConstants.DESCENDING_PREFIX);
            String name = descending ? token.substring(1).trim() : token;
            if (name.isEmpty()) {
                continue;
            }

            Optional<FieldAccessor<T, ?>> field = registry.findSortable(name);
            if (field.isEmpty()) {
                logger.fine(() -> String.format("Ignoring unregistered sort key '%s' for %s",
                        name, registry.getEntityType().getSimpleName()));
                continue;
            }
            keys.add(new SortKey<>(field.get(), descending));
        }
        return List.copyOf(keys);
    }
}
