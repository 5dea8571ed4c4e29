/**
 * Test fixtures: a controllable clock and a recording, idempotent bulk action.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.testkit.fixture;
