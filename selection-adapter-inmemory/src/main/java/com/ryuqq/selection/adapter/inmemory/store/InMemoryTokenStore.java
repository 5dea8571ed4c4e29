package com.ryuqq.selection.adapter.inmemory.store;

import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.error.TokenExpiredException;
import com.ryuqq.selection.core.error.TokenNotFoundException;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.model.SelectionToken;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.selection.SelectionState;
import com.ryuqq.selection.core.spi.TokenEntry;
import com.ryuqq.selection.core.spi.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link TokenStore} SPI.
 *
 * <p>{@link ConcurrentHashMap}에 토큰 항목을 보관하며, 항목은 생성 후 변경되지 않습니다.
 * 외부 키-값 저장소의 네이티브 TTL 대신 {@link #purgeExpired(int)}로 정리합니다.</p>
 *
 * <p><strong>만료 처리:</strong></p>
 * <ul>
 *   <li>now &lt; expiresAt: 정상 resolve</li>
 *   <li>expiresAt ≤ now &lt; expiresAt + expiredRetention: {@link TokenExpiredException}</li>
 *   <li>그 이후: 삭제 대상, {@link TokenNotFoundException}</li>
 * </ul>
 *
 * <p><strong>장애 주입:</strong> {@link #setAvailable(boolean)}로 저장소 장애를 흉내낼 수 있습니다.</p>
 *
 * <p><strong>Limitations:</strong> 프로세스 재시작 시 데이터가 사라지며, 여러 인스턴스 간에 공유되지 않습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class InMemoryTokenStore implements TokenStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTokenStore.class);

    private final ConcurrentHashMap<SelectionToken, TokenEntry> entries = new ConcurrentHashMap<>();
    private final TokenStoreConfig config;
    private final Clock clock;
    private final SecureRandom random;
    private volatile boolean available = true;

    public InMemoryTokenStore() {
        this(new TokenStoreConfig(), Clock.systemUTC());
    }

    public InMemoryTokenStore(TokenStoreConfig config, Clock clock) {
        this(config, clock, new SecureRandom());
    }

    public InMemoryTokenStore(TokenStoreConfig config, Clock clock, SecureRandom random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.random = random;
    }

    @Override
    public TokenEntry create(FilterDescriptor filter, SelectionState selection, SnapshotBasis snapshotBasis) {
        if (filter == null || selection == null || snapshotBasis == null) {
            throw new IllegalArgumentException("filter, selection and snapshotBasis cannot be null");
        }
        ensureAvailable();

        Instant now = clock.instant();
        Instant expiresAt = now.plus(config.ttl());
        while (true) {
            SelectionToken token = SelectionToken.generate(random);
            TokenEntry entry = new TokenEntry(token, filter, selection, snapshotBasis, now, expiresAt);
            if (entries.putIfAbsent(token, entry) == null) {
                log.debug("Stored selection token {} (expiresAt={})", token, expiresAt);
                return entry;
            }
        }
    }

    @Override
    public TokenEntry resolve(SelectionToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        ensureAvailable();

        TokenEntry entry = entries.get(token);
        if (entry == null) {
            throw new TokenNotFoundException(token);
        }
        Instant now = clock.instant();
        if (isPurgeable(entry, now)) {
            entries.remove(token, entry);
            throw new TokenNotFoundException(token);
        }
        if (entry.isExpiredAt(now)) {
            throw new TokenExpiredException(token, entry.expiresAt());
        }
        return entry;
    }

    @Override
    public void invalidate(SelectionToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        ensureAvailable();
        if (entries.remove(token) != null) {
            log.debug("Invalidated selection token {}", token);
        }
    }

    @Override
    public int purgeExpired(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        ensureAvailable();

        Instant now = clock.instant();
        int purged = 0;
        Iterator<Map.Entry<SelectionToken, TokenEntry>> it = entries.entrySet().iterator();
        while (it.hasNext() && purged < batchSize) {
            Map.Entry<SelectionToken, TokenEntry> e = it.next();
            if (isPurgeable(e.getValue(), now) && entries.remove(e.getKey(), e.getValue())) {
                purged++;
            }
        }
        return purged;
    }

    @Override
    public boolean isSingleUse() {
        return config.singleUse();
    }

    /**
     * 장애 주입용. false면 모든 호출이 {@link StoreUnavailableException}을 던집니다.
     *
     * @param available 사용 가능 여부
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int size() {
        return entries.size();
    }

    public TokenStoreConfig getConfig() {
        return config;
    }

    private boolean isPurgeable(TokenEntry entry, Instant now) {
        return !now.isBefore(entry.expiresAt().plus(config.expiredRetention()));
    }

    private void ensureAvailable() {
        if (!available) {
            throw new StoreUnavailableException("Token store is unavailable");
        }
    }
}
