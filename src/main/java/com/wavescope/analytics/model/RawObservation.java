package com.wavescope.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Raw per-observation metrics as delivered by the ingestion collaborator.
 * Counters may be null when a platform does not report them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawObservation {
    private String contentId;
    private String platformSource;
    private String category;
    private LocalDateTime publishedAt;
    private LocalDateTime observedAt;
    private Long views;
    private Long likes;
    private Long comments;
    private Long shares;

    public String getTrendId() {
        return platformSource + "_" + contentId;
    }

    public RawMetrics toRawMetrics() {
        return RawMetrics.of(views, likes, comments, shares);
    }
}
