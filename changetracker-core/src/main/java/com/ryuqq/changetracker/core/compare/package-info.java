/**
 * Current-value comparators for tracked entries.
 *
 * <p>{@link com.ryuqq.changetracker.core.compare.CurrentValueComparatorFactory} inspects a
 * property's type once and picks one of a closed set of comparator variants:</p>
 *
 * <table>
 *   <caption>Comparator variants</caption>
 *   <tr><th>Capability</th><th>Model type</th><th>Provider type (converter)</th></tr>
 *   <tr><td>GENERIC_COMPARABLE</td><td>TypedCurrentValueComparator</td><td>ConvertedTypedCurrentValueComparator</td></tr>
 *   <tr><td>STRUCTURAL_COMPARABLE</td><td>StructuralCurrentValueComparator</td><td>ConvertedStructuralCurrentValueComparator</td></tr>
 *   <tr><td>COMPARABLE</td><td>CurrentValueComparator</td><td>ConvertedCurrentValueComparator</td></tr>
 * </table>
 *
 * <p>{@link com.ryuqq.changetracker.core.compare.CurrentValueComparatorCache} keeps one
 * comparator per property for the lifetime of the model.</p>
 *
 * @since 1.0.0
 * @author ChangeTracker Team
 */
package com.ryuqq.changetracker.core.compare;
