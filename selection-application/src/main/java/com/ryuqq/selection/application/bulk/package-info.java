/**
 * Bulk action entry points: submission with a synchronous time budget, status lookup and cancellation.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.application.bulk;
