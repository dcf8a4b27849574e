/**
 * Deep read-only snapshots of command payloads.
 *
 * <p>{@link com.ryuqq.tickline.core.snapshot.ImmutableSnapshots} classifies every value into a
 * {@link com.ryuqq.tickline.core.snapshot.SnapshotKind} and converts it into a structure whose
 * every reachable mutation path throws
 * {@link com.ryuqq.tickline.core.snapshot.SnapshotMutationException}. Binary and numeric buffers
 * are exposed as facades without write methods; their only escapes are explicit copies.</p>
 */
package com.ryuqq.tickline.core.snapshot;
