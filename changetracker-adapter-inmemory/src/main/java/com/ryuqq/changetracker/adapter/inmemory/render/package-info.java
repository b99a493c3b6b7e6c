/**
 * Default debug rendering of tracked entries.
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.adapter.inmemory.render;
