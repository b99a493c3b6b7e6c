/**
 * In-memory tracked entries and state manager.
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.adapter.inmemory.tracking;
