package io.github.cyfko.querier.spring.support;

import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.exception.FieldDefinitionException;

import java.util.*;
import java.util.logging.Logger;

/**
 * Lookup of the {@link FieldRegistry} beans of an application by entity type.
 * <p>
 * Populated once at construction; safe for concurrent reads afterwards.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FieldRegistryCatalog {

    private static final Logger logger = Logger.getLogger(FieldRegistryCatalog.class.getName());

    private final Map<Class<?>, FieldRegistry<?>> registryByEntity;

    /**
     * @param registries registries to index
     * @throws FieldDefinitionException if two registries describe the same entity type
     */
    public FieldRegistryCatalog(List<? extends FieldRegistry<?>> registries) {
        Map<Class<?>, FieldRegistry<?>> map = new LinkedHashMap<>();
        for (FieldRegistry<?> registry : registries) {
            FieldRegistry<?> previous = map.putIfAbsent(registry.getEntityType(), registry);
            if (previous != null) {
                throw new FieldDefinitionException("More than one FieldRegistry declared for entity "
                        + registry.getEntityType().getName());
            }
        }
        this.registryByEntity = Collections.unmodifiableMap(map);
        logger.fine(() -> "Registered field registries for " + registryByEntity.keySet());
    }

    /**
     * Retrieves the registry describing the given entity type.
     *
     * @param entityType entity class
     * @param <T>        entity type
     * @return the registry
     * @throws IllegalArgumentException if no registry is declared for the entity
     */
    @SuppressWarnings("unchecked")
    public <T> FieldRegistry<T> get(Class<T> entityType) {
        FieldRegistry<?> registry = registryByEntity.get(entityType);
        if (registry == null) {
            throw new IllegalArgumentException("No FieldRegistry found for entity " + entityType.getName()
                    + ". Declare a FieldRegistry bean for it.");
        }
        return (FieldRegistry<T>) registry;
    }

    public boolean contains(Class<?> entityType) {
        return registryByEntity.containsKey(entityType);
    }

    public Set<Class<?>> getEntityTypes() {
        return registryByEntity.keySet();
    }
}
