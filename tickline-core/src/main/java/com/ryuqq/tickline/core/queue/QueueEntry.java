package com.ryuqq.tickline.core.queue;

import com.ryuqq.tickline.core.model.Command;

/**
 * 큐에 보관된 명령.
 *
 * @param command payload가 snapshot으로 교체된 명령
 * @param sequence 큐 내 삽입 순번 (단조 증가)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record QueueEntry(
    Command command,
    long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException command가 null이거나 sequence가 음수인 경우
     */
    public QueueEntry {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative");
        }
    }
}
