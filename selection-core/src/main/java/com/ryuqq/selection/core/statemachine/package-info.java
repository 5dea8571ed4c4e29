/**
 * Bulk operation status lifecycle and transition validation.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.statemachine;
