/**
 * Bulk operation result model. Counts are always exact; the failed-record list is bounded.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.result;
