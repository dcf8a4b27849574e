/**
 * Priority-tier authorization of commands.
 *
 * <p>{@link com.ryuqq.tickline.core.authorization.CommandAuthorizations} holds the default table;
 * {@link com.ryuqq.tickline.core.authorization.CommandAuthorizer} evaluates it at admission
 * ({@code reason "queue"}) and again at execution ({@code reason "dispatcher"}).</p>
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.authorization;
