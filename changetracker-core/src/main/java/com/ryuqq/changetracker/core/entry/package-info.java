/**
 * Tracked entry contract and entity states.
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.core.entry;
