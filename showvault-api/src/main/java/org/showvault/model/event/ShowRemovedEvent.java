package org.showvault.model.event;

import lombok.Value;

@Value
public class ShowRemovedEvent {
    long showId;
}
