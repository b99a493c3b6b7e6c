package com.ryuqq.changetracker.core.metadata;

import java.util.function.Function;

/**
 * Bidirectional mapping between a model value type and a provider (store) value type.
 *
 * <p>Converters are stateless and shared between properties. The comparison subsystem only
 * uses the forward direction through {@link #convertToProvider(Object)}.</p>
 *
 * <p><strong>Null handling:</strong> the untyped entry points never pass {@code null}
 * to the typed functions; a {@code null} input converts to {@code null}.</p>
 *
 * <pre>
 * ValueConverter&lt;OrderNumber, Integer&gt; converter = ValueConverter.of(
 *     OrderNumber.class, Integer.class,
 *     OrderNumber::value,
 *     OrderNumber::new);
 * </pre>
 *
 * @param <M> model type
 * @param <P> provider type
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public abstract class ValueConverter<M, P> {

    private final Class<M> modelType;
    private final Class<P> providerType;

    /**
     * 생성자.
     *
     * @param modelType model type
     * @param providerType provider type
     * @throws IllegalArgumentException 타입이 null인 경우
     */
    protected ValueConverter(Class<M> modelType, Class<P> providerType) {
        if (modelType == null) {
            throw new IllegalArgumentException("modelType cannot be null");
        }
        if (providerType == null) {
            throw new IllegalArgumentException("providerType cannot be null");
        }
        this.modelType = modelType;
        this.providerType = providerType;
    }

    /**
     * Creates a converter from a pair of functions.
     *
     * @param modelType model type
     * @param providerType provider type
     * @param toProvider model to provider mapping
     * @param fromProvider provider to model mapping
     * @param <M> model type
     * @param <P> provider type
     * @return converter instance
     * @throws IllegalArgumentException if any argument is null
     */
    public static <M, P> ValueConverter<M, P> of(
        Class<M> modelType,
        Class<P> providerType,
        Function<? super M, ? extends P> toProvider,
        Function<? super P, ? extends M> fromProvider
    ) {
        if (toProvider == null || fromProvider == null) {
            throw new IllegalArgumentException("conversion functions cannot be null");
        }
        return new ValueConverter<>(modelType, providerType) {
            @Override
            public P toProvider(M value) {
                return toProvider.apply(value);
            }

            @Override
            public M fromProvider(P value) {
                return fromProvider.apply(value);
            }
        };
    }

    /**
     * Converts a non-null model value to its provider value.
     *
     * @param value model value, never {@code null}
     * @return provider value
     */
    public abstract P toProvider(M value);

    /**
     * Converts a non-null provider value back to its model value.
     *
     * @param value provider value, never {@code null}
     * @return model value
     */
    public abstract M fromProvider(P value);

    /**
     * Untyped forward conversion.
     *
     * @param value model value, may be {@code null}
     * @return provider value, {@code null} for a {@code null} input
     * @throws ClassCastException if {@code value} is not a model-typed value
     */
    @SuppressWarnings("unchecked")
    public final Object convertToProvider(Object value) {
        return value == null ? null : toProvider((M) value);
    }

    /**
     * Untyped backward conversion.
     *
     * @param value provider value, may be {@code null}
     * @return model value, {@code null} for a {@code null} input
     * @throws ClassCastException if {@code value} is not a provider-typed value
     */
    @SuppressWarnings("unchecked")
    public final Object convertFromProvider(Object value) {
        return value == null ? null : fromProvider((P) value);
    }

    /**
     * Model type.
     *
     * @return model type
     */
    public Class<M> getModelType() {
        return modelType;
    }

    /**
     * Provider type.
     *
     * @return provider type
     */
    public Class<P> getProviderType() {
        return providerType;
    }

    @Override
    public String toString() {
        return "ValueConverter{" + modelType.getSimpleName() + " -> " + providerType.getSimpleName() + '}';
    }
}
