package org.showvault.service.event;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.showvault.model.event.ShowRemovedEvent;
import org.showvault.model.event.ShowSettingsChangedEvent;
import org.showvault.model.websocket.ShowNotification;
import org.showvault.model.websocket.Topic;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;

@Slf4j
@AllArgsConstructor
@Service
public class ShowEventBroadcaster {

    private final SimpMessagingTemplate messagingTemplate;

    @TransactionalEventListener(fallbackExecution = true)
    public void broadcastSettingsChanged(ShowSettingsChangedEvent event) {
        send(Topic.SHOW_SETTINGS_CHANGED, ShowNotification.builder()
                .showId(event.getShowId())
                .showName(event.getSettings() != null ? event.getSettings().getName() : null)
                .changedFields(event.getChangedFields())
                .pauseTransition(event.getPauseTransition())
                .timestamp(Instant.now())
                .build());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void broadcastShowRemoved(ShowRemovedEvent event) {
        send(Topic.SHOW_REMOVED, ShowNotification.builder()
                .showId(event.getShowId())
                .timestamp(Instant.now())
                .build());
    }

    private void send(Topic topic, ShowNotification notification) {
        try {
            messagingTemplate.convertAndSend(topic.getPath(), notification);
        } catch (MessagingException e) {
            log.warn("Failed to broadcast {} for show {}: {}", topic, notification.getShowId(), e.getMessage());
        }
    }
}
