/**
 * Command dispatch: handler registry, execution-time authorization and result normalization.
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.dispatcher;
