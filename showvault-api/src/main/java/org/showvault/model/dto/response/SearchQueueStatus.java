package org.showvault.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.SearchRequest;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchQueueStatus {
    private long showId;
    private boolean paused;
    private boolean queued;
    private List<SearchRequest> pending;
}
