/**
 * Resolver: turns a bound selection into a pull-based, batched, ordered id stream.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.resolver;
