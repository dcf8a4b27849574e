package com.ryuqq.tickline.core.result;

/**
 * 성공 결과.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record Success() implements CommandResult {

    static final Success INSTANCE = new Success();
}
