/**
 * Abstract SPI contract tests. Adapter modules extend these and supply an implementation.
 *
 * @since 1.0.0
 * @author Selection Team
 */
package com.ryuqq.selection.testkit.contract;
