package com.wavescope.analytics.service;

import com.wavescope.analytics.model.ScorePoint;
import com.wavescope.analytics.model.TrendSeries;
import com.wavescope.analytics.persistence.TrendStore;
import com.wavescope.analytics.variant.HistoricalVariantGenerator;
import com.wavescope.analytics.variant.Variant;
import com.wavescope.analytics.variant.VariantOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Generates historical variants of a trend and stores them.
 * Peer series for comparisons are read from the store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VariantService {

    private final HistoricalVariantGenerator variantGenerator;
    private final TrendStore trendStore;
    private final Clock clock;

    @Value("${analytics.variant.history-days:30}")
    private int historyDays;

    @Value("${analytics.variant.peer-limit:10}")
    private int peerLimit;

    @Value("${analytics.variant.peer-lookback-days:30}")
    private int peerLookbackDays;

    public VariantOptions defaultOptions() {
        return VariantOptions.all(peerLimit, peerLookbackDays);
    }

    public List<Variant> generateVariants(String trendId) {
        LocalDateTime now = LocalDateTime.now(clock);
        TrendSeries series = trendStore.querySeries(trendId, now.minusDays(historyDays), now);
        return generateVariants(trendId, series, defaultOptions(), now);
    }

    public List<Variant> generateVariants(String trendId, TrendSeries series, VariantOptions options) {
        return generateVariants(trendId, series, options, LocalDateTime.now(clock));
    }

    /**
     * Generate and store the variants of {@code series}, which must carry {@code trendId}.
     * <p>
     * A trend id is {@code platform_contentId}, so a series read from the store by trend id covers a
     * single platform and never yields {@code platform_comparison}. To get that variant, pass a series
     * under the trend's id that merges the points of the same content from several platforms.
     */
    public List<Variant> generateVariants(String trendId, TrendSeries series, VariantOptions options, LocalDateTime now) {
        if (series == null || series.isEmpty()) {
            log.debug("No points for variants of {}", trendId);
            return List.of();
        }
        if (!trendId.equals(series.getTrendId())) {
            throw new IllegalArgumentException("Series belongs to " + series.getTrendId() + ", not " + trendId);
        }
        VariantOptions effective = options != null ? options : defaultOptions();

        List<TrendSeries> peers = List.of();
        if (effective.comparisons()) {
            ScorePoint reference = series.first();
            peers = trendStore.queryPeers(
                    series.category(),
                    trendId,
                    reference.getContentId(),
                    now.minusDays(effective.peerLookbackDays()),
                    now,
                    effective.peerLimit());
        }

        List<Variant> variants = variantGenerator.generate(series, peers, effective, now);
        trendStore.upsertVariants(variants);
        log.info("Generated {} variants for trend {}", variants.size(), trendId);
        return variants;
    }

    public List<Variant> getVariants(String trendId) {
        return trendStore.findVariants(trendId);
    }
}
