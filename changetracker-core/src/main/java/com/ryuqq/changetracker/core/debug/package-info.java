/**
 * Stable debug ordering and rendering of tracked entries.
 *
 * <p>{@link com.ryuqq.changetracker.core.debug.EntryOrderingService} orders entries by entity
 * type name, then by comparable primary key values, and renders them line by line through an
 * {@link com.ryuqq.changetracker.core.spi.EntryRenderer}. The ordering is for diagnostics only
 * and carries no persistence semantics.</p>
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.core.debug;
