/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Adapter modules implement these interfaces; the core and application modules only depend on them.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.selection.core.spi.TokenStore} - Token → (filter, selection, snapshot) mapping with TTL</li>
 *   <li>{@link com.ryuqq.selection.core.spi.RecordSource} - Filter evaluation and ordered id streaming</li>
 *   <li>{@link com.ryuqq.selection.core.spi.BulkResultStore} - Progress and final results for polling</li>
 * </ul>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Thread safety:</strong> all methods may be called concurrently</li>
 *   <li><strong>Failures:</strong> transient backend failures surface as
 *       {@link com.ryuqq.selection.core.error.StoreUnavailableException}</li>
 *   <li><strong>Contract tests:</strong> extend the abstract tests in {@code selection-testkit}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.spi;
