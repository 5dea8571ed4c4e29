/**
 * Pluggable per-record bulk action contract.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.executor;
