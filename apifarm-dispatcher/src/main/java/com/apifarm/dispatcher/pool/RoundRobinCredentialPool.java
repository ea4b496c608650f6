package com.apifarm.dispatcher.pool;

import com.apifarm.common.exception.DuplicateKeyException;
import com.apifarm.common.exception.KeyNotFoundException;
import com.apifarm.common.exception.KeyPoolExhaustedException;
import com.apifarm.common.exception.PersistenceException;
import com.apifarm.common.util.Secrets;
import com.apifarm.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的轮询凭证池，写操作同步落盘。
 * <p>
 * 两把锁：
 * <ul>
 *   <li>{@code lock} 保护内存中的凭证表和游标，持有期间不做任何 I/O</li>
 *   <li>{@code writeMonitor} 串行化所有写盘操作，保证添加时的查重与插入是原子的，
 *       且健康状态按发生顺序写入存储</li>
 * </ul>
 * 冷却到期不依赖定时任务，在选择时惰性判断。
 */
@Slf4j
public class RoundRobinCredentialPool implements CredentialPool {

    /** 退避指数上限，防止移位溢出 */
    private static final int MAX_BACKOFF_EXPONENT = 20;

    private final CredentialStore store;
    private final DispatcherProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Object writeMonitor = new Object();

    /** id -> 凭证，保持添加顺序 */
    private final Map<Long, Credential> credentials = new LinkedHashMap<>();
    private int cursor;

    public RoundRobinCredentialPool(CredentialStore store, DispatcherProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 从存储全量加载。读取失败时异常直接抛出，进程不应带着残缺状态启动。
     */
    public void load() {
        List<Credential> loaded = store.loadAll();
        lock.lock();
        try {
            credentials.clear();
            for (Credential credential : loaded) {
                credentials.put(credential.getId(), credential.copy());
            }
            cursor = 0;
        } finally {
            lock.unlock();
        }
        log.info("从存储加载了 {} 个凭证", loaded.size());
    }

    @Override
    public Long add(Long ownerId, String value, String endpoint) {
        synchronized (writeMonitor) {
            if (findByValue(value) != null) {
                throw new DuplicateKeyException("该 API Key 已存在于池中");
            }

            Credential saved = store.insert(Credential.builder()
                    .ownerId(ownerId)
                    .value(value)
                    .endpoint(endpoint)
                    .status(CredentialStatus.ACTIVE)
                    .createdAt(clock.millis())
                    .build());

            lock.lock();
            try {
                credentials.put(saved.getId(), saved.copy());
            } finally {
                lock.unlock();
            }
            log.info("用户 {} 添加新 Key 到池: {}", ownerId, Secrets.mask(value));
            return saved.getId();
        }
    }

    @Override
    public void remove(Long ownerId, String value) {
        synchronized (writeMonitor) {
            Credential existing = findByValue(value);
            if (existing == null || !existing.getOwnerId().equals(ownerId)) {
                throw new KeyNotFoundException("当前用户名下没有该 API Key");
            }

            store.delete(existing.getId());

            lock.lock();
            try {
                credentials.remove(existing.getId());
            } finally {
                lock.unlock();
            }
            log.info("用户 {} 从池中移除 Key: {}", ownerId, Secrets.mask(value));
        }
    }

    @Override
    public List<String> list(Long ownerId) {
        lock.lock();
        try {
            List<String> values = new ArrayList<>();
            for (Credential credential : credentials.values()) {
                if (credential.getOwnerId().equals(ownerId)) {
                    values.add(credential.getValue());
                }
            }
            return values;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 游标是全部凭证（按添加顺序）中的位置，从游标处向后找第一个可用且未被排除的凭证。
     * 排除集只影响本次跳过哪些凭证，不改变其余凭证的轮转次序。
     */
    @Override
    public Credential selectForUse(Set<Long> excludedIds) {
        lock.lock();
        try {
            long now = clock.millis();
            List<Credential> ordered = new ArrayList<>(credentials.values());
            int total = ordered.size();
            for (int step = 0; step < total; step++) {
                int index = (cursor + step) % total;
                Credential candidate = ordered.get(index);
                if (excludedIds.contains(candidate.getId()) || !isEligible(candidate, now)) {
                    continue;
                }
                cursor = (index + 1) % total;

                if (candidate.getStatus() == CredentialStatus.COOLING_DOWN) {
                    candidate.setStatus(CredentialStatus.ACTIVE);
                    candidate.setCooldownUntil(null);
                    log.info("Key 冷却结束，恢复轮询: {}", Secrets.mask(candidate.getValue()));
                }
                log.debug("选中 Key: {} ({}/{})", Secrets.mask(candidate.getValue()), index + 1, total);
                return candidate.copy();
            }
            throw new KeyPoolExhaustedException("API Key 池已耗尽，请稍后重试或添加更多 Key");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reportOutcome(Long credentialId, Outcome outcome) {
        lock.lock();
        try {
            Credential credential = credentials.get(credentialId);
            if (credential == null) {
                log.debug("凭证 {} 已被移除，忽略结果上报 {}", credentialId, outcome);
                return;
            }
            applyOutcome(credential, outcome, clock.millis());
        } finally {
            lock.unlock();
        }
        persistHealth(credentialId);
    }

    @Override
    public int size() {
        lock.lock();
        try {
            int count = 0;
            for (Credential credential : credentials.values()) {
                if (credential.getStatus() != CredentialStatus.DISABLED) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PoolStats stats() {
        lock.lock();
        try {
            int active = 0;
            int coolingDown = 0;
            int disabled = 0;
            for (Credential credential : credentials.values()) {
                switch (credential.getStatus()) {
                    case ACTIVE -> active++;
                    case COOLING_DOWN -> coolingDown++;
                    case DISABLED -> disabled++;
                }
            }
            return new PoolStats(credentials.size(), active, coolingDown, disabled);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 状态机 ====================

    private void applyOutcome(Credential credential, Outcome outcome, long now) {
        String masked = Secrets.mask(credential.getValue());
        switch (outcome) {
            case SUCCESS -> {
                credential.setLastUsedAt(now);
                if (credential.getStatus() == CredentialStatus.DISABLED) {
                    // 停用后才返回的成功结果不恢复该 Key，只能删除后重新添加
                    log.info("已停用的 Key 返回成功结果，保持停用: {}", masked);
                    return;
                }
                credential.setFailureCount(0);
                credential.setStatus(CredentialStatus.ACTIVE);
                credential.setCooldownUntil(null);
            }
            case TRANSIENT_FAILURE -> {
                credential.setLastUsedAt(now);
                if (credential.getStatus() == CredentialStatus.DISABLED) {
                    return;
                }
                int failures = credential.getFailureCount() + 1;
                credential.setFailureCount(failures);
                if (failures >= properties.getFailureThreshold()) {
                    long backoffMillis = backoffMillis(failures);
                    credential.setStatus(CredentialStatus.COOLING_DOWN);
                    credential.setCooldownUntil(now + backoffMillis);
                    log.warn("Key 连续失败 {} 次，冷却 {} 秒: {}", failures, backoffMillis / 1000, masked);
                } else {
                    log.warn("Key 暂时性失败 ({}/{}): {}", failures, properties.getFailureThreshold(), masked);
                }
            }
            case DEFINITIVE_FAILURE -> {
                credential.setStatus(CredentialStatus.DISABLED);
                credential.setCooldownUntil(null);
                credential.setLastUsedAt(now);
                log.warn("Key 被上游拒绝，已停用: {}", masked);
            }
        }
    }

    /**
     * 冷却时长 = cooldownSeconds × 2^(失败次数 − 阈值)，不超过 maxCooldownSeconds。
     */
    long backoffMillis(int failures) {
        int exponent = Math.min(Math.max(0, failures - properties.getFailureThreshold()), MAX_BACKOFF_EXPONENT);
        long seconds = Math.min((long) properties.getCooldownSeconds() << exponent,
                properties.getMaxCooldownSeconds());
        return seconds * 1000L;
    }

    private boolean isEligible(Credential credential, long now) {
        return switch (credential.getStatus()) {
            case ACTIVE -> true;
            case COOLING_DOWN -> credential.getCooldownUntil() == null || credential.getCooldownUntil() <= now;
            case DISABLED -> false;
        };
    }

    /**
     * 健康状态写盘。在写锁内重新读取最新快照，保证最后写入的是最新状态。
     * 推理结果已经产生，写盘失败只记录告警，不影响本次请求。
     */
    private void persistHealth(Long credentialId) {
        synchronized (writeMonitor) {
            Credential snapshot;
            lock.lock();
            try {
                Credential current = credentials.get(credentialId);
                snapshot = current != null ? current.copy() : null;
            } finally {
                lock.unlock();
            }
            if (snapshot == null) {
                return;
            }
            try {
                store.updateHealth(snapshot);
            } catch (PersistenceException e) {
                log.warn("凭证 {} 健康状态写盘失败: {}", credentialId, e.getMessage());
            }
        }
    }

    private Credential findByValue(String value) {
        lock.lock();
        try {
            for (Credential credential : credentials.values()) {
                if (credential.getValue().equals(value)) {
                    return credential.copy();
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }
}
