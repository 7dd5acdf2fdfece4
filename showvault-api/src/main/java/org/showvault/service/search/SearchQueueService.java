package org.showvault.service.search;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.showvault.config.AppProperties;
import org.showvault.model.SearchRequest;
import org.showvault.model.dto.response.SearchQueueStatus;
import org.showvault.model.enums.PauseTransition;
import org.showvault.model.enums.SearchPriority;
import org.showvault.model.event.ShowRemovedEvent;
import org.showvault.model.event.ShowSettingsChangedEvent;
import org.showvault.repository.ShowRepository;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pending show searches, most urgent first. Paused shows are never queued, and pausing a show
 * drops whatever it already had waiting. Offers, pauses and removals all synchronize on the
 * queue, so a pause can never miss a request that is being added.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchQueueService {

    private final Set<Long> pausedShows = ConcurrentHashMap.newKeySet();
    private final ShowRepository showRepository;
    private final AppProperties appProperties;
    private final AtomicLong sequence = new AtomicLong();
    private volatile BlockingQueue<SearchRequest> queue;

    @EventListener(ApplicationReadyEvent.class)
    public void initializePausedShows() {
        List<Long> paused = showRepository.findPausedShowIds();
        pausedShows.addAll(paused);
        log.info("Search queue initialized with {} paused shows", paused.size());
    }

    public boolean enqueue(long showId, String reason) {
        return enqueue(showId, reason, SearchPriority.NORMAL);
    }

    public boolean enqueue(long showId, String reason, SearchPriority priority) {
        BlockingQueue<SearchRequest> pending = queue();
        synchronized (pending) {
            if (pausedShows.contains(showId)) {
                log.debug("Not queuing search for paused show {}", showId);
                return false;
            }
            if (pending.stream().anyMatch(request -> request.getShowId() == showId)) {
                return false;
            }
            if (pending.size() >= capacity()) {
                log.warn("Search queue is full, dropping search for show {}", showId);
                return false;
            }
            return pending.offer(SearchRequest.builder()
                    .showId(showId)
                    .reason(reason)
                    .priority(priority != null ? priority : SearchPriority.NORMAL)
                    .enqueuedAt(Instant.now())
                    .sequence(sequence.incrementAndGet())
                    .build());
        }
    }

    public Optional<SearchRequest> poll() {
        BlockingQueue<SearchRequest> pending = queue();
        SearchRequest next;
        while ((next = pending.poll()) != null) {
            if (!pausedShows.contains(next.getShowId())) {
                return Optional.of(next);
            }
        }
        return Optional.empty();
    }

    public void pause(long showId) {
        int dropped;
        BlockingQueue<SearchRequest> pending = queue();
        synchronized (pending) {
            pausedShows.add(showId);
            dropped = dropPending(showId);
        }
        log.info("Paused searches for show {}, dropped {} pending", showId, dropped);
    }

    public void resume(long showId) {
        if (pausedShows.remove(showId)) {
            log.info("Resumed searches for show {}", showId);
        }
    }

    public boolean isPaused(long showId) {
        return pausedShows.contains(showId);
    }

    public SearchQueueStatus status(long showId) {
        List<SearchRequest> pending = queue().stream()
                .filter(request -> request.getShowId() == showId)
                .sorted(SearchRequest.QUEUE_ORDER)
                .toList();
        return SearchQueueStatus.builder()
                .showId(showId)
                .paused(isPaused(showId))
                .queued(!pending.isEmpty())
                .pending(pending)
                .build();
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onSettingsChanged(ShowSettingsChangedEvent event) {
        if (event.getPauseTransition() == PauseTransition.PAUSED) {
            pause(event.getShowId());
        } else if (event.getPauseTransition() == PauseTransition.RESUMED) {
            resume(event.getShowId());
        }
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onShowRemoved(ShowRemovedEvent event) {
        pausedShows.remove(event.getShowId());
        dropPending(event.getShowId());
    }

    private int dropPending(long showId) {
        BlockingQueue<SearchRequest> pending = queue();
        synchronized (pending) {
            int before = pending.size();
            pending.removeIf(request -> request.getShowId() == showId);
            return before - pending.size();
        }
    }

    private int capacity() {
        return Math.max(1, appProperties.getSearch().getQueueCapacity());
    }

    private BlockingQueue<SearchRequest> queue() {
        BlockingQueue<SearchRequest> current = queue;
        if (current == null) {
            synchronized (this) {
                if (queue == null) {
                    queue = new PriorityBlockingQueue<>(16, SearchRequest.QUEUE_ORDER);
                }
                current = queue;
            }
        }
        return current;
    }
}
