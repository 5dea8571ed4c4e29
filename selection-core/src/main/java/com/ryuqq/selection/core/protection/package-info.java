/**
 * Load protection for downstream systems touched by bulk actions.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.protection;
