/**
 * In-memory entity model built with a fluent builder.
 *
 * <p>{@link com.ryuqq.changetracker.adapter.inmemory.model.InMemoryModel} owns the comparator cache
 * and validates primary key comparators while building.</p>
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.adapter.inmemory.model;
