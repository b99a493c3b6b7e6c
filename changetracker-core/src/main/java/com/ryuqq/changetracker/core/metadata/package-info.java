/**
 * Read-only entity model consumed by the change tracker.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.changetracker.core.metadata.Model} - finalized model, owner of the comparator cache</li>
 *   <li>{@link com.ryuqq.changetracker.core.metadata.EntityType} - entity type with optional primary key</li>
 *   <li>{@link com.ryuqq.changetracker.core.metadata.Key} - ordered key properties</li>
 *   <li>{@link com.ryuqq.changetracker.core.metadata.PropertyBase} / {@link com.ryuqq.changetracker.core.metadata.Property} - entity members</li>
 *   <li>{@link com.ryuqq.changetracker.core.metadata.ValueConverter} - model to provider value mapping</li>
 *   <li>{@link com.ryuqq.changetracker.core.metadata.TypeMapping} - store type mapping with optional converter</li>
 *   <li>{@link com.ryuqq.changetracker.core.metadata.StructuralComparable} - element-wise comparison capability</li>
 * </ul>
 *
 * <p>Implementations are immutable after model finalization.</p>
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.core.metadata;
