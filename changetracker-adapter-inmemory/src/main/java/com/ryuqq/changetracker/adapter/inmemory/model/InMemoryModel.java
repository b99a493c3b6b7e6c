package com.ryuqq.changetracker.adapter.inmemory.model;

import com.ryuqq.changetracker.core.compare.CurrentValueComparatorCache;
import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.Key;
import com.ryuqq.changetracker.core.metadata.Model;
import com.ryuqq.changetracker.core.metadata.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link Model} for testing and reference purposes.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryModel model = InMemoryModel.builder()
 *     .entityType("Order", e -&gt; e
 *         .property("Id", int.class)
 *         .property("Number", OrderNumber.class, p -&gt; p.hasConversion(OrderNumber.CONVERTER))
 *         .primaryKey("Id"))
 *     .build();
 * </pre>
 *
 * <p><strong>Build-time validation:</strong> with {@link ModelConfig#validateKeyComparators()}
 * every primary key property gets its comparator while building, so an unorderable key type
 * fails here with {@link IllegalStateException}.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class InMemoryModel implements Model {

    private static final Logger log = LoggerFactory.getLogger(InMemoryModel.class);

    private final Map<String, InMemoryEntityType> entityTypes;
    private final CurrentValueComparatorCache comparators;

    private InMemoryModel(Map<String, InMemoryEntityType> entityTypes) {
        this.entityTypes = Collections.unmodifiableMap(entityTypes);
        this.comparators = new CurrentValueComparatorCache();
    }

    /**
     * Starts a model with the default {@link ModelConfig}.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder(new ModelConfig());
    }

    /**
     * Starts a model with the given configuration.
     *
     * @param config build configuration
     * @return new builder
     * @throws IllegalArgumentException if config is null
     */
    public static Builder builder(ModelConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new Builder(config);
    }

    @Override
    public Collection<EntityType> getEntityTypes() {
        return Collections.unmodifiableCollection(entityTypes.values());
    }

    @Override
    public InMemoryEntityType findEntityType(String name) {
        return entityTypes.get(name);
    }

    /**
     * Finds an entity type by name, failing when it is not part of the model.
     *
     * @param name entity type name
     * @return the entity type
     * @throws IllegalArgumentException if not found
     */
    public InMemoryEntityType getEntityType(String name) {
        InMemoryEntityType entityType = entityTypes.get(name);
        if (entityType == null) {
            throw new IllegalArgumentException("Entity type " + name + " is not part of the model");
        }
        return entityType;
    }

    @Override
    public CurrentValueComparatorCache getCurrentValueComparators() {
        return comparators;
    }

    private void validateKeyComparators() {
        for (InMemoryEntityType entityType : entityTypes.values()) {
            Key primaryKey = entityType.findPrimaryKey();
            if (primaryKey == null) {
                continue;
            }
            for (Property keyProperty : primaryKey.getProperties()) {
                comparators.getComparator(keyProperty);
            }
        }
    }

    /**
     * Builder of {@link InMemoryModel}. Not thread-safe.
     */
    public static final class Builder {

        private final ModelConfig config;
        private final Map<String, EntityTypeBuilder> entityTypes;
        private boolean built;

        private Builder(ModelConfig config) {
            this.config = config;
            this.entityTypes = new LinkedHashMap<>();
        }

        /**
         * Declares an entity type.
         *
         * @param name entity type name, unique within the model
         * @param configuration entity type configuration
         * @return this builder
         * @throws IllegalArgumentException if the name is blank or already declared
         * @throws IllegalStateException if the model was already built
         */
        public Builder entityType(String name, Consumer<EntityTypeBuilder> configuration) {
            if (built) {
                throw new IllegalStateException("Model is already built");
            }
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (configuration == null) {
                throw new IllegalArgumentException("configuration cannot be null");
            }
            if (entityTypes.containsKey(name)) {
                throw new IllegalArgumentException("Entity type " + name + " is already declared");
            }
            EntityTypeBuilder builder = new EntityTypeBuilder(name);
            configuration.accept(builder);
            entityTypes.put(name, builder);
            return this;
        }

        /**
         * Finalizes the model.
         *
         * @return immutable model
         * @throws IllegalStateException if already built, or a primary key type cannot be ordered
         *                               while {@link ModelConfig#validateKeyComparators()} is on
         */
        public InMemoryModel build() {
            if (built) {
                throw new IllegalStateException("Model is already built");
            }

            Map<String, InMemoryEntityType> types = new LinkedHashMap<>();
            for (EntityTypeBuilder builder : entityTypes.values()) {
                types.put(builder.name(), new InMemoryEntityType(builder));
            }
            InMemoryModel model = new InMemoryModel(types);

            if (config.validateKeyComparators()) {
                model.validateKeyComparators();
            }

            built = true;
            log.info("Model built: {} entity types, {} key comparators", types.size(), model.comparators.size());
            return model;
        }
    }
}
