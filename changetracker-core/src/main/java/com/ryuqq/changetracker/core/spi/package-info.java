/**
 * Service Provider Interfaces implemented by change-tracking hosts.
 *
 * <ul>
 *   <li>{@link com.ryuqq.changetracker.core.spi.StateManager} - source of tracked entries</li>
 *   <li>{@link com.ryuqq.changetracker.core.spi.EntryRenderer} - per-entry debug rendering</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.core.spi;
