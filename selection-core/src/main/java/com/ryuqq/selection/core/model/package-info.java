/**
 * Core value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.selection.core.model.RecordId} - Record identifier, natural order is the stable sort key</li>
 *   <li>{@link com.ryuqq.selection.core.model.SelectionToken} - Opaque, unguessable token handle</li>
 *   <li>{@link com.ryuqq.selection.core.model.ResultId} - Bulk operation result identifier</li>
 *   <li>{@link com.ryuqq.selection.core.model.SnapshotBasis} - Live or pinned data version</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.model;
