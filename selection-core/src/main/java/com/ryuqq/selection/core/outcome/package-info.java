/**
 * Per-record action outcomes ({@code Ok}, {@code Retry}, {@code Fail}).
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.outcome;
