package org.showvault.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.enums.SearchPriority;

import java.time.Instant;
import java.util.Comparator;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    /**
     * Most urgent first, then in the order requests arrived.
     */
    public static final Comparator<SearchRequest> QUEUE_ORDER = Comparator
            .comparing(SearchRequest::getPriority)
            .thenComparingLong(SearchRequest::getSequence);

    private long showId;
    private String reason;
    @Builder.Default
    private SearchPriority priority = SearchPriority.NORMAL;
    private Instant enqueuedAt;
    @JsonIgnore
    private long sequence;
}
