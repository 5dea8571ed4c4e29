/**
 * Runtime adapters: the bulk operation executor, the inline runner that answers
 * submissions within a time budget, and the expired-token reaper.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.adapter.runner;
