package com.ryuqq.tickline.core.snapshot;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.nio.ByteBuffer;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload 값의 깊은 읽기 전용 snapshot 생성기.
 *
 * <p>Queue는 enqueue 시점에 이 생성기로 payload를 변환하므로, 이후 호출자가 원본을 수정해도
 * 대기 중인 명령에는 영향이 없습니다.</p>
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>IMMUTABLE, PATTERN: 그대로 반환</li>
 *   <li>RECORD: 구성 요소를 snapshot으로 바꿔 public canonical 생성자로 재구성 (바뀐 요소가 없으면 원본 반환).
 *       public이 아닌 record는 접근 제한을 우회하지 않고 거부합니다.</li>
 *   <li>LIST / MAP / SET: {@link ImmutableListSnapshot} / {@link ImmutableMapSnapshot} / {@link ImmutableSetSnapshot}</li>
 *   <li>BUFFER / SHARED_BUFFER: {@link ImmutableByteBufferSnapshot} / {@link ImmutableSharedBufferSnapshot}</li>
 *   <li>NUMERIC_BUFFER: {@link ImmutableNumericBufferSnapshot}</li>
 *   <li>CALENDAR: Date는 {@link ImmutableDateSnapshot}, Calendar는 {@link ZonedDateTime}</li>
 *   <li>UNSUPPORTED: {@link UnsupportedPayloadException}</li>
 * </ul>
 *
 * <p>한 번의 호출 안에서 같은 원본 객체는 같은 snapshot으로 변환되므로 공유 참조가 보존되고,
 * list/map/set을 통한 순환 참조도 처리됩니다. record를 통한 순환은 재구성할 수 없어 거부합니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableSnapshots {

    private ImmutableSnapshots() {
    }

    /**
     * 깊은 읽기 전용 snapshot 생성.
     *
     * @param value 원본 값 (null 허용)
     * @return snapshot (원본이 이미 불변이면 원본 그대로)
     * @throws UnsupportedPayloadException 변환할 수 없는 값이 포함된 경우
     */
    public static Object snapshot(Object value) {
        return new SnapshotContext().snapshot(value);
    }

    private static final class SnapshotContext {

        private final Map<Object, Object> converted = new IdentityHashMap<>();
        private final Set<Object> recordsInProgress = Collections.newSetFromMap(new IdentityHashMap<>());

        Object snapshot(Object value) {
            SnapshotKind kind = SnapshotKind.of(value);
            if (kind != SnapshotKind.IMMUTABLE && kind != SnapshotKind.PATTERN) {
                Object existing = converted.get(value);
                if (existing != null) {
                    return existing;
                }
            }
            return switch (kind) {
                case IMMUTABLE, PATTERN -> value;
                case RECORD -> snapshotRecord((Record) value);
                case LIST -> snapshotList(value);
                case MAP -> snapshotMap((Map<?, ?>) value);
                case SET -> snapshotSet((Set<?>) value);
                case BUFFER -> remember(value, value instanceof byte[] bytes
                    ? ImmutableByteBufferSnapshot.copyOf(bytes)
                    : ImmutableByteBufferSnapshot.copyOf((ByteBuffer) value));
                case SHARED_BUFFER -> remember(value, ImmutableSharedBufferSnapshot.copyOf((ByteBuffer) value));
                case NUMERIC_BUFFER -> remember(value, ImmutableNumericBufferSnapshot.copyOf(value));
                case CALENDAR -> remember(value, snapshotCalendar(value));
                case UNSUPPORTED -> throw UnsupportedPayloadException.unsupportedType(value);
            };
        }

        private Object remember(Object source, Object snapshot) {
            converted.put(source, snapshot);
            return snapshot;
        }

        private Object snapshotList(Object source) {
            List<Object> elements = new ArrayList<>();
            ImmutableListSnapshot<Object> result = new ImmutableListSnapshot<>(elements);
            converted.put(source, result);
            if (source instanceof Collection<?> collection) {
                for (Object element : collection) {
                    elements.add(snapshot(element));
                }
            } else if (source instanceof boolean[] flags) {
                for (boolean flag : flags) {
                    elements.add(flag);
                }
            } else if (source instanceof char[] chars) {
                for (char c : chars) {
                    elements.add(c);
                }
            } else {
                for (Object element : (Object[]) source) {
                    elements.add(snapshot(element));
                }
            }
            return result;
        }

        private Object snapshotMap(Map<?, ?> source) {
            LinkedHashMap<Object, Object> entries = new LinkedHashMap<>();
            ImmutableMapSnapshot<Object, Object> result = new ImmutableMapSnapshot<>(entries);
            converted.put(source, result);
            for (Map.Entry<?, ?> entry : source.entrySet()) {
                entries.put(snapshot(entry.getKey()), snapshot(entry.getValue()));
            }
            return result;
        }

        private Object snapshotSet(Set<?> source) {
            LinkedHashSet<Object> elements = new LinkedHashSet<>();
            ImmutableSetSnapshot<Object> result = new ImmutableSetSnapshot<>(elements);
            converted.put(source, result);
            for (Object element : source) {
                elements.add(snapshot(element));
            }
            return result;
        }

        private Object snapshotCalendar(Object source) {
            if (source instanceof Date date) {
                return ImmutableDateSnapshot.copyOf(date);
            }
            Calendar calendar = (Calendar) source;
            return ZonedDateTime.ofInstant(calendar.toInstant(), calendar.getTimeZone().toZoneId());
        }

        private Object snapshotRecord(Record source) {
            if (!recordsInProgress.add(source)) {
                throw new UnsupportedPayloadException(
                    "Circular reference through record is not supported: " + source.getClass().getName()
                );
            }
            try {
                Object result = rebuildRecord(source);
                converted.put(source, result);
                return result;
            } finally {
                recordsInProgress.remove(source);
            }
        }

        private Object rebuildRecord(Record source) {
            Class<?> type = source.getClass();
            if (!Modifier.isPublic(type.getModifiers())) {
                throw new UnsupportedPayloadException("Record type must be public: " + type.getName());
            }
            RecordComponent[] components = type.getRecordComponents();
            Class<?>[] parameterTypes = new Class<?>[components.length];
            Object[] arguments = new Object[components.length];
            boolean changed = false;

            for (int i = 0; i < components.length; i++) {
                RecordComponent component = components[i];
                Object original = readComponent(source, component);
                Object copy = snapshot(original);
                if (copy != null && !component.getType().isPrimitive() && !component.getType().isInstance(copy)) {
                    throw new UnsupportedPayloadException(
                        "Record component " + type.getName() + "." + component.getName()
                            + " of type " + component.getType().getName()
                            + " cannot hold snapshot " + copy.getClass().getName()
                    );
                }
                parameterTypes[i] = component.getType();
                arguments[i] = copy;
                changed |= copy != original;
            }

            if (!changed) {
                return source;
            }
            return construct(type, parameterTypes, arguments);
        }

        private Object readComponent(Record source, RecordComponent component) {
            try {
                return component.getAccessor().invoke(source);
            } catch (InvocationTargetException e) {
                throw new UnsupportedPayloadException(
                    "Record accessor failed: " + component.getName(), e.getCause()
                );
            } catch (IllegalAccessException e) {
                throw new UnsupportedPayloadException(
                    "Record component is not accessible: " + component.getName(), e
                );
            }
        }

        private Object construct(Class<?> type, Class<?>[] parameterTypes, Object[] arguments) {
            try {
                return type.getConstructor(parameterTypes).newInstance(arguments);
            } catch (InvocationTargetException e) {
                throw new UnsupportedPayloadException(
                    "Record constructor rejected snapshot values: " + type.getName(), e.getCause()
                );
            } catch (ReflectiveOperationException e) {
                throw new UnsupportedPayloadException(
                    "Record has no public canonical constructor: " + type.getName(), e
                );
            }
        }
    }
}
