package com.ryuqq.tickline.core.snapshot;

import java.util.Date;

/**
 * {@link Date}의 읽기 전용 snapshot.
 *
 * <p>모든 setter는 {@link SnapshotMutationException}을 던집니다.
 * {@link #clone()}과 {@link #toDate()}는 변경 가능한 새 {@link Date}를 반환합니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableDateSnapshot extends Date implements ImmutableSnapshot {

    private static final long serialVersionUID = 1L;

    private static final String TARGET = "date";

    private ImmutableDateSnapshot(long epochMillis) {
        super(epochMillis);
    }

    public static ImmutableDateSnapshot copyOf(Date source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new ImmutableDateSnapshot(source.getTime());
    }

    public Date toDate() {
        return new Date(getTime());
    }

    @Override
    public Object clone() {
        return toDate();
    }

    @Override
    public SnapshotKind kind() {
        return SnapshotKind.CALENDAR;
    }

    @Override
    public ImmutableDateSnapshot unwrap() {
        return this;
    }

    @Override
    public void setTime(long time) {
        throw new SnapshotMutationException(TARGET, "setTime");
    }

    @Deprecated
    @Override
    public void setYear(int year) {
        throw new SnapshotMutationException(TARGET, "setYear");
    }

    @Deprecated
    @Override
    public void setMonth(int month) {
        throw new SnapshotMutationException(TARGET, "setMonth");
    }

    @Deprecated
    @Override
    public void setDate(int date) {
        throw new SnapshotMutationException(TARGET, "setDate");
    }

    @Deprecated
    @Override
    public void setHours(int hours) {
        throw new SnapshotMutationException(TARGET, "setHours");
    }

    @Deprecated
    @Override
    public void setMinutes(int minutes) {
        throw new SnapshotMutationException(TARGET, "setMinutes");
    }

    @Deprecated
    @Override
    public void setSeconds(int seconds) {
        throw new SnapshotMutationException(TARGET, "setSeconds");
    }
}
