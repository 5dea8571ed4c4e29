/**
 * Selection State: a two-variant sum type ({@code MANUAL} include-set, {@code ALL} exclude-set).
 *
 * <p>Owned by one client session until a token binds it. Transport agnostic, no I/O.</p>
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.selection;
