/**
 * In-memory token and bulk result stores.
 *
 * <p>Reference implementations for tests and single-instance deployments.
 * Multi-instance deployments back {@code TokenStore} with a shared key-value store.</p>
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.adapter.inmemory.store;
