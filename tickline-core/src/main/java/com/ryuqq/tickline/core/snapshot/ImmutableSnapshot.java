package com.ryuqq.tickline.core.snapshot;

/**
 * 깊은 읽기 전용 snapshot 타입의 공통 인터페이스.
 *
 * <p>이 인터페이스를 구현한 값은 이미 snapshot이므로
 * {@link ImmutableSnapshots#snapshot(Object)}에 다시 전달하면 그대로 반환됩니다.
 * 구현 타입은 이 패키지의 snapshot 타입으로 닫혀 있어, 외부 타입이 snapshot을 가장할 수 없습니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public sealed interface ImmutableSnapshot
    permits ImmutableListSnapshot, ImmutableMapSnapshot, ImmutableSetSnapshot,
    ImmutableBinarySnapshot, ImmutableNumericBufferSnapshot, ImmutableDateSnapshot {

    /**
     * snapshot의 값 종류.
     *
     * @return SnapshotKind
     */
    SnapshotKind kind();

    /**
     * 원본을 꺼내는 접근자.
     *
     * <p>항상 자기 자신을 반환합니다. 변경 가능한 원본이나 새 사본을 돌려주지 않습니다.
     * 변경 가능한 사본이 필요하면 각 타입의 명시적 복사 메서드를 사용합니다.</p>
     *
     * @return this
     */
    ImmutableSnapshot unwrap();
}
