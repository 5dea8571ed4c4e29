package com.ryuqq.selection.adapter.inmemory.source;

import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.filter.FieldType;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.filter.RecordSchema;
import com.ryuqq.selection.core.model.PinnedSnapshot;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.spi.RecordCursor;
import com.ryuqq.selection.core.spi.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 버전 이력을 보관하는 in-memory {@link RecordSource}.
 *
 * <p>모든 쓰기(insert/update/delete)는 전역 버전을 1 증가시키고, 레코드별 이력에
 * (version, fields) 항목을 추가합니다. 삭제는 fields가 null인 항목(tombstone)입니다.</p>
 *
 * <p><strong>스냅샷 해석:</strong></p>
 * <ul>
 *   <li>Live: 최신 항목 기준</li>
 *   <li>Pinned(v): 버전 v 시점의 필드 값으로 필터를 평가하되,
 *       현재 삭제된 레코드는 제외 (삭제된 레코드에 Action을 실행하지 않음)</li>
 * </ul>
 *
 * <p><strong>커서:</strong> 마지막으로 방출한 ID 이후부터 읽는 keyset 방식입니다.
 * 전체 후보 집합을 메모리에 만들지 않으며 ID 오름차순으로 방출합니다.</p>
 *
 * <p><strong>장애 주입:</strong></p>
 * <pre>
 * source.simulateOutageAfter(2500); // 각 커서가 2500건 방출 후 StoreUnavailableException
 * source.simulateOutage();          // 모든 읽기 즉시 실패
 * source.restore();
 * </pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class InMemoryRecordSource implements RecordSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordSource.class);

    private static final long NO_OUTAGE = -1L;

    private final RecordSchema schema;
    private final ConcurrentSkipListMap<RecordId, RecordHistory> records = new ConcurrentSkipListMap<>();
    private final AtomicLong version = new AtomicLong();
    private final AtomicInteger openCursors = new AtomicInteger();
    private volatile long outageAfter = NO_OUTAGE;

    public InMemoryRecordSource(RecordSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        this.schema = schema;
    }

    @Override
    public RecordSchema schema() {
        return schema;
    }

    @Override
    public long currentVersion() {
        return version.get();
    }

    /**
     * 레코드 추가.
     *
     * @param id 레코드 ID
     * @param fields 필드 값 (스키마에 선언된 필드만, null 값 불가)
     * @return 쓰기 후 버전
     * @throws IllegalStateException 이미 존재하는 레코드
     */
    public synchronized long insert(RecordId id, Map<String, ?> fields) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Map<String, Object> checked = checkFields(fields);
        RecordHistory history = records.get(id);
        if (history != null && history.latest() != null) {
            throw new IllegalStateException("Record already exists: " + id);
        }
        long v = version.incrementAndGet();
        records.put(id, history == null ? RecordHistory.of(v, checked) : history.append(v, checked));
        return v;
    }

    /**
     * 레코드 필드 교체.
     *
     * @throws IllegalStateException 존재하지 않거나 삭제된 레코드
     */
    public synchronized long update(RecordId id, Map<String, ?> fields) {
        Map<String, Object> checked = checkFields(fields);
        RecordHistory history = liveHistory(id);
        long v = version.incrementAndGet();
        records.put(id, history.append(v, checked));
        return v;
    }

    /**
     * 레코드 삭제 (tombstone 기록).
     *
     * @return 삭제했으면 true, 이미 없으면 false
     */
    public synchronized boolean delete(RecordId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        RecordHistory history = records.get(id);
        if (history == null || history.latest() == null) {
            return false;
        }
        long v = version.incrementAndGet();
        records.put(id, history.append(v, null));
        return true;
    }

    @Override
    public RecordCursor open(FilterDescriptor filter, SnapshotBasis snapshotBasis) {
        checkArgs(filter, snapshotBasis);
        ensureAvailable(0);
        openCursors.incrementAndGet();
        return new KeysetCursor(filter, snapshotBasis);
    }

    @Override
    public long count(FilterDescriptor filter, SnapshotBasis snapshotBasis) {
        checkArgs(filter, snapshotBasis);
        ensureAvailable(0);
        long count = 0;
        for (RecordHistory history : records.values()) {
            if (matches(history, filter, snapshotBasis)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public List<RecordId> retainMatching(FilterDescriptor filter, SnapshotBasis snapshotBasis,
                                         Collection<RecordId> ids) {
        checkArgs(filter, snapshotBasis);
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        ensureAvailable(0);
        List<RecordId> retained = new ArrayList<>();
        for (RecordId id : new TreeSet<>(ids)) {
            RecordHistory history = records.get(id);
            if (history != null && matches(history, filter, snapshotBasis)) {
                retained.add(id);
            }
        }
        return retained;
    }

    /**
     * 각 커서가 limit건을 방출한 뒤 {@link StoreUnavailableException}을 던지도록 설정.
     */
    public void simulateOutageAfter(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        this.outageAfter = limit;
    }

    public void simulateOutage() {
        simulateOutageAfter(0);
    }

    public void restore() {
        this.outageAfter = NO_OUTAGE;
    }

    /**
     * @return 닫히지 않은 커서 수
     */
    public int getOpenCursorCount() {
        return openCursors.get();
    }

    /**
     * @return 현재 살아 있는 레코드 수
     */
    public long size() {
        return count(FilterDescriptor.matchAll(), SnapshotBasis.live());
    }

    private boolean matches(RecordHistory history, FilterDescriptor filter, SnapshotBasis basis) {
        Map<String, Object> fields = history.latest();
        if (fields == null) {
            return false;
        }
        if (basis instanceof PinnedSnapshot) {
            fields = history.asOf(((PinnedSnapshot) basis).version());
            if (fields == null) {
                return false;
            }
        }
        return filter.matches(fields);
    }

    private RecordHistory liveHistory(RecordId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        RecordHistory history = records.get(id);
        if (history == null || history.latest() == null) {
            throw new IllegalStateException("Record not found: " + id);
        }
        return history;
    }

    private Map<String, Object> checkFields(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        for (Map.Entry<String, ?> e : fields.entrySet()) {
            FieldType type = schema.typeOf(e.getKey()).orElseThrow(
                () -> new IllegalArgumentException("Unknown field: " + e.getKey()));
            if (e.getValue() == null || !type.accepts(e.getValue())) {
                throw new IllegalArgumentException(
                    "Invalid value for " + type + " field '" + e.getKey() + "': " + e.getValue());
            }
        }
        return Map.copyOf(fields);
    }

    private void checkArgs(FilterDescriptor filter, SnapshotBasis snapshotBasis) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (snapshotBasis == null) {
            throw new IllegalArgumentException("snapshotBasis cannot be null");
        }
        filter.validate(schema);
    }

    private void ensureAvailable(long emitted) {
        long limit = outageAfter;
        if (limit != NO_OUTAGE && emitted >= limit) {
            throw new StoreUnavailableException("Record source is unavailable (after " + emitted + " ids)");
        }
    }

    /**
     * 레코드별 불변 버전 이력. 버전 오름차순.
     */
    private static final class RecordHistory {

        private final NavigableMap<Long, Map<String, Object>> versions;
        private final Map<String, Object> latest;

        private RecordHistory(NavigableMap<Long, Map<String, Object>> versions) {
            this.versions = versions;
            this.latest = versions.lastEntry().getValue();
        }

        static RecordHistory of(long version, Map<String, Object> fields) {
            NavigableMap<Long, Map<String, Object>> versions = new TreeMap<>();
            versions.put(version, fields);
            return new RecordHistory(versions);
        }

        RecordHistory append(long version, Map<String, Object> fieldsOrNull) {
            NavigableMap<Long, Map<String, Object>> next = new TreeMap<>(versions);
            next.put(version, fieldsOrNull);
            return new RecordHistory(next);
        }

        Map<String, Object> latest() {
            return latest;
        }

        Map<String, Object> asOf(long version) {
            Map.Entry<Long, Map<String, Object>> entry = versions.floorEntry(version);
            return entry == null ? null : entry.getValue();
        }
    }

    private final class KeysetCursor implements RecordCursor {

        private final FilterDescriptor filter;
        private final SnapshotBasis basis;
        private RecordId lastKey;
        private long emitted;
        private boolean closed;

        KeysetCursor(FilterDescriptor filter, SnapshotBasis basis) {
            this.filter = filter;
            this.basis = basis;
        }

        @Override
        public List<RecordId> nextBatch(int maxSize) {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
            }
            if (closed) {
                throw new IllegalStateException("cursor is closed");
            }
            ensureAvailable(emitted);

            long limit = outageAfter;
            int allowed = limit == NO_OUTAGE ? maxSize : (int) Math.min(maxSize, limit - emitted);

            NavigableMap<RecordId, RecordHistory> tail = lastKey == null ? records : records.tailMap(lastKey, false);
            List<RecordId> batch = new ArrayList<>(Math.min(allowed, 1024));
            for (Map.Entry<RecordId, RecordHistory> e : tail.entrySet()) {
                if (batch.size() >= allowed) {
                    break;
                }
                if (matches(e.getValue(), filter, basis)) {
                    batch.add(e.getKey());
                }
            }
            if (!batch.isEmpty()) {
                lastKey = batch.get(batch.size() - 1);
                emitted += batch.size();
            }
            return batch;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                openCursors.decrementAndGet();
                log.debug("Cursor closed after {} ids (filter={}, basis={})", emitted, filter, basis);
            }
        }
    }
}
