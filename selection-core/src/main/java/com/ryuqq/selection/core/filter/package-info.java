/**
 * Filter Descriptor: conjunctive field constraints over a typed record schema.
 *
 * <p>Descriptors are built client-side, validated against the {@link com.ryuqq.selection.core.filter.RecordSchema}
 * exposed by the record source, and evaluated either by the record source itself (query push-down)
 * or in process via {@link com.ryuqq.selection.core.filter.FilterDescriptor#matches(java.util.Map)}.</p>
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.core.filter;
