/**
 * Selection use cases: token issuance ({@code POST /selections}) and advisory count estimates.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.application.selection;
