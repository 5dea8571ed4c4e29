/**
 * Versioned in-memory record source with keyset cursors and snapshot pinning.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.adapter.inmemory.source;
