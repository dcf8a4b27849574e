/**
 * SPI contract tests.
 *
 * <p>Abstract JUnit 5 test classes that every SPI implementation extends.
 * The in-memory adapter runs them in its own test suite; other adapters
 * should do the same.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tickline.testkit.contract;
