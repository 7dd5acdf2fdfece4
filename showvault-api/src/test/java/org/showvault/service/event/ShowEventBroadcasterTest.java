package org.showvault.service.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.enums.PauseTransition;
import org.showvault.model.enums.ShowSettingField;
import org.showvault.model.event.ShowRemovedEvent;
import org.showvault.model.event.ShowSettingsChangedEvent;
import org.showvault.model.websocket.ShowNotification;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShowEventBroadcasterTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @InjectMocks
    private ShowEventBroadcaster broadcaster;

    @Test
    void settingsChanged_isSentToSettingsTopic() {
        broadcaster.broadcastSettingsChanged(ShowSettingsChangedEvent.builder()
                .showId(4L)
                .changedFields(Set.of(ShowSettingField.PAUSED))
                .pauseTransition(PauseTransition.PAUSED)
                .settings(ShowSettings.builder().showId(4L).name("Show").build())
                .build());

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/shows/settings"), captor.capture());
        ShowNotification notification = (ShowNotification) captor.getValue();
        assertThat(notification.getShowName()).isEqualTo("Show");
        assertThat(notification.getPauseTransition()).isEqualTo(PauseTransition.PAUSED);
    }

    @Test
    void showRemoved_isSentToRemovedTopic() {
        broadcaster.broadcastShowRemoved(new ShowRemovedEvent(4L));

        verify(messagingTemplate).convertAndSend(eq("/topic/shows/removed"), any(Object.class));
    }

    @Test
    void brokerFailure_doesNotPropagate() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(messagingTemplate).convertAndSend(eq("/topic/shows/removed"), any(Object.class));

        assertThatCode(() -> broadcaster.broadcastShowRemoved(new ShowRemovedEvent(4L))).doesNotThrowAnyException();
    }
}
