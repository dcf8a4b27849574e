package com.ryuqq.tickline.core.snapshot;

/**
 * Immutable snapshot에 대한 쓰기 시도.
 *
 * <p>snapshot에서 얻을 수 있는 모든 경로(중첩 컨테이너, 뷰, iterator, 콜백 인자)의
 * 변경 연산은 호출 지점에서 동기적으로 이 예외를 던집니다. 조용히 무시되는 경우는 없습니다.</p>
 *
 * <p>{@link UnsupportedOperationException}의 하위 타입이므로
 * {@code Collections.unmodifiableMap} 등 JDK 읽기 전용 뷰와 동일하게 처리할 수 있습니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public class SnapshotMutationException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    private final String target;
    private final String operation;

    /**
     * 생성자.
     *
     * @param target snapshot 종류 (예: map, set, list)
     * @param operation 시도한 연산 이름 (예: put, add)
     */
    public SnapshotMutationException(String target, String operation) {
        super("Cannot call " + operation + "() on an immutable " + target + " snapshot");
        this.target = target;
        this.operation = operation;
    }

    public String getTarget() {
        return target;
    }

    public String getOperation() {
        return operation;
    }
}
