package org.showvault.service.show;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.showvault.config.AppProperties;
import org.showvault.exception.ApiError;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per show ID so two writes to the same show never interleave. An entry lives only
 * while some thread holds or waits on it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShowLockRegistry {

    private final ConcurrentMap<Long, ShowLock> locks = new ConcurrentHashMap<>();
    private final AppProperties appProperties;

    public <T> T withLock(long showId, Supplier<T> action) {
        ShowLock entry = locks.compute(showId, (id, existing) -> {
            ShowLock current = existing != null ? existing : new ShowLock();
            current.holders++;
            return current;
        });
        try {
            acquire(showId, entry.lock);
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(showId, (id, current) -> --current.holders == 0 ? null : current);
        }
    }

    private void acquire(long showId, ReentrantLock lock) {
        long timeoutMillis = appProperties.getShows().getUpdateLockTimeout().toMillis();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ApiError.SHOW_BUSY.createException(showId);
        }
        if (!acquired) {
            log.warn("Could not lock show {} within {} ms", showId, timeoutMillis);
            throw ApiError.SHOW_BUSY.createException(showId);
        }
    }

    boolean isLocked(long showId) {
        ShowLock entry = locks.get(showId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedShows() {
        return locks.size();
    }

    // holders is only touched inside compute/computeIfPresent for its key
    private static final class ShowLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
