package io.github.cyfko.querier.core.api;

import io.github.cyfko.querier.core.exception.FieldDefinitionException;

import java.util.*;

/**
 * Per-entity declaration of the names a client may filter on, sort on and eagerly load.
 * <p>
 * A registry is the only bridge between client-supplied names and storage paths: the engine
 * never resolves a name that has not been declared here, so unknown names are inert rather than
 * an injection vector. Registries are built once at configuration time and are immutable,
 * hence safely shared across concurrent executions.
 * </p>
 *
 * <h2>Name matching</h2>
 * <p>All lookups ignore case: {@code filter[Name]} and {@code filter[name]} target the same entry.</p>
 *
 * <h2>Canonical fields</h2>
 * <ul>
 *   <li><strong>Free-text field:</strong> the filterable field {@code q} is matched against.
 *       Declared with {@link Builder#freeTextField(String)}, otherwise the filterable field
 *       {@code title}, otherwise {@code name}.</li>
 *   <li><strong>Default sort field:</strong> the field sorted descending when no sort is requested.
 *       Declared with {@link Builder#defaultSortField(String)}, otherwise {@code createdAt}
 *       (sortable first, then filterable).</li>
 * </ul>
 *
 * <pre>{@code
 * FieldRegistry<Company> registry = FieldRegistry.builder(Company.class)
 *     .field("name", FieldAccessor.of("name", String.class, Company::getName))
 *     .filterable("status", FieldAccessor.of("status", Status.class, Company::getStatus))
 *     .sortable("createdAt", FieldAccessor.of("createdAt", LocalDateTime.class, Company::getCreatedAt))
 *     .include("settings")
 *     .build();
 * }</pre>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FieldRegistry<T> {

    private static final List<String> FREE_TEXT_CONVENTION = List.of("title", "name");
    private static final String DEFAULT_SORT_CONVENTION = "createdAt";

    private final Class<T> entityType;
    private final Map<String, FieldAccessor<T, ?>> filterable;
    private final Map<String, FieldAccessor<T, ?>> sortable;
    private final Map<String, String> includes;
    private final FieldAccessor<T, ?> freeTextField;
    private final FieldAccessor<T, ?> defaultSortField;

    private FieldRegistry(Builder<T> builder) {
        this.entityType = builder.entityType;
        this.filterable = Collections.unmodifiableMap(caseInsensitiveCopy(builder.filterable));
        this.sortable = Collections.unmodifiableMap(caseInsensitiveCopy(builder.sortable));
        this.includes = Collections.unmodifiableMap(caseInsensitiveCopy(builder.includes));
        this.freeTextField = resolveFreeText(builder.freeTextField);
        this.defaultSortField = resolveDefaultSort(builder.defaultSortField);
    }

    public static <T> Builder<T> builder(Class<T> entityType) {
        return new Builder<>(entityType);
    }

    public Class<T> getEntityType() {
        return entityType;
    }

    public Optional<FieldAccessor<T, ?>> findFilterable(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(filterable.get(name.trim()));
    }

    public Optional<FieldAccessor<T, ?>> findSortable(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(sortable.get(name.trim()));
    }

    /**
     * Looks up an include hint.
     *
     * @param name client-supplied hint
     * @return the declared spelling of the hint, or empty when it is not allow-listed
     */
    public Optional<String> findInclude(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(includes.get(name.trim()));
    }

    public Optional<FieldAccessor<T, ?>> getFreeTextField() {
        return Optional.ofNullable(freeTextField);
    }

    public Optional<FieldAccessor<T, ?>> getDefaultSortField() {
        return Optional.ofNullable(defaultSortField);
    }

    public Set<String> getFilterableNames() {
        return filterable.keySet();
    }

    public Set<String> getSortableNames() {
        return sortable.keySet();
    }

    public Set<String> getIncludeNames() {
        return includes.keySet();
    }

    private FieldAccessor<T, ?> resolveFreeText(String declared) {
        if (declared != null) {
            return findFilterable(declared).orElseThrow(() -> new FieldDefinitionException(
                    String.format("Free-text field '%s' is not a filterable field of %s", declared, entityType.getSimpleName())));
        }
        for (String candidate : FREE_TEXT_CONVENTION) {
            FieldAccessor<T, ?> accessor = filterable.get(candidate);
            if (accessor != null) {
                return accessor;
            }
        }
        return null;
    }

    private FieldAccessor<T, ?> resolveDefaultSort(String declared) {
        if (declared != null) {
            return findSortable(declared).or(() -> findFilterable(declared))
                    .orElseThrow(() -> new FieldDefinitionException(
                            String.format("Default sort field '%s' is not a declared field of %s", declared, entityType.getSimpleName())));
        }
        return findSortable(DEFAULT_SORT_CONVENTION).or(() -> findFilterable(DEFAULT_SORT_CONVENTION)).orElse(null);
    }

    private static <V> Map<String, V> caseInsensitiveCopy(Map<String, V> source) {
        Map<String, V> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(source);
        return copy;
    }

    @Override
    public String toString() {
        return "FieldRegistry[" + entityType.getSimpleName()
                + ", filterable=" + filterable.keySet()
                + ", sortable=" + sortable.keySet()
                + ", includes=" + includes.keySet() + "]";
    }

    /**
     * Builder for {@link FieldRegistry}. Declaration errors raise {@link FieldDefinitionException}.
     *
     * @param <T> entity type
     */
    public static final class Builder<T> {
        private final Class<T> entityType;
        private final Map<String, FieldAccessor<T, ?>> filterable = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, FieldAccessor<T, ?>> sortable = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, String> includes = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private String freeTextField;
        private String defaultSortField;

        private Builder(Class<T> entityType) {
            this.entityType = Objects.requireNonNull(entityType, "entityType cannot be null");
        }

        public Builder<T> filterable(String name, FieldAccessor<T, ?> accessor) {
            register(filterable, "Filterable", name, accessor);
            return this;
        }

        public Builder<T> sortable(String name, FieldAccessor<T, ?> accessor) {
            register(sortable, "Sortable", name, accessor);
            return this;
        }

        /**
         * Declares a field both filterable and sortable.
         */
        public Builder<T> field(String name, FieldAccessor<T, ?> accessor) {
            return filterable(name, accessor).sortable(name, accessor);
        }

        public Builder<T> include(String... names) {
            for (String name : names) {
                String key = requireName(name, "Include");
                if (includes.putIfAbsent(key, key) != null) {
                    throw new FieldDefinitionException(
                            String.format("Include '%s' is already declared for %s", key, entityType.getSimpleName()));
                }
            }
            return this;
        }

        public Builder<T> freeTextField(String name) {
            this.freeTextField = requireName(name, "Free-text");
            return this;
        }

        public Builder<T> defaultSortField(String name) {
            this.defaultSortField = requireName(name, "Default sort");
            return this;
        }

        public FieldRegistry<T> build() {
            return new FieldRegistry<>(this);
        }

        private void register(Map<String, FieldAccessor<T, ?>> target, String kind, String name, FieldAccessor<T, ?> accessor) {
            String key = requireName(name, kind);
            if (accessor == null) {
                throw new FieldDefinitionException(String.format("%s field '%s' has no accessor", kind, key));
            }
            if (target.putIfAbsent(key, accessor) != null) {
                throw new FieldDefinitionException(
                        String.format("%s field '%s' is already declared for %s", kind, key, entityType.getSimpleName()));
            }
        }

        private String requireName(String name, String kind) {
            if (name == null || name.isBlank()) {
                throw new FieldDefinitionException(kind + " name cannot be null or blank for " + entityType.getSimpleName());
            }
            return name.trim();
        }
    }
}
