package com.locationscout.core.service;

import com.locationscout.core.api.IPageRenderer;
import com.locationscout.core.api.ISiteDiscoverer;
import com.locationscout.core.classifier.SiteClassifier;
import com.locationscout.core.crawler.SiteCrawlState;
import com.locationscout.core.crawler.SiteCrawler;
import com.locationscout.core.model.*;
import com.locationscout.core.store.PageStore;
import com.locationscout.core.util.Durations;
import com.locationscout.core.util.StructuredLog;
import com.locationscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 사이트 1건: 발견 → 크롤 → 분류 → 요약 갱신 → 결과 행.
 *  - http(s) 가 아닌 URL 은 건너뜀(skipped-invalid-url)
 *  - 사이트 경계 밖으로 나온 예외는 모두 error 결과로 바꾼다(다른 사이트는 계속)
 *  - 렌더러는 사이트마다 새로 만들고 끝나면 닫는다
 */
public final class SitePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SitePipeline.class);
    private static final StructuredLog SLOG = StructuredLog.get(SitePipeline.class);

    private final ISiteDiscoverer discoverer;
    private final SiteCrawler crawler;
    private final Supplier<? extends IPageRenderer> renderers;
    private final SiteClassifier classifier;
    private final Path crawledRoot;

    public SitePipeline(ISiteDiscoverer discoverer,
                        SiteCrawler crawler,
                        Supplier<? extends IPageRenderer> renderers,
                        SiteClassifier classifier,
                        Path crawledRoot) {
        this.discoverer = Objects.requireNonNull(discoverer, "discoverer");
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.renderers = Objects.requireNonNull(renderers, "renderers");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.crawledRoot = Objects.requireNonNull(crawledRoot, "crawledRoot");
    }

    public SiteClassifier classifier() { return classifier; }

    public PageStore storeFor(String domain) {
        return PageStore.forDomain(crawledRoot, domain);
    }

    public SiteResult run(int index, Carrier carrier) {
        String website = carrier.website();
        if (!UrlUtils.isHttpUrl(website)) {
            LOG.info("Skip #{} {}: no valid URL ({})", index, carrier.name(), website);
            return SiteResult.of(SiteOutcome.skipped(index, carrier));
        }

        long t0 = System.nanoTime();
        String domain = UrlUtils.extractDomain(website.trim());
        LOG.info("Site start #{}: {} ({})", index, carrier.name(), website);
        StructuredLog slog = SLOG.with("index", index).with("site", carrier.name());
        slog.info("site-start", "url", website);

        try {
            PageStore store = storeFor(domain);
            SiteCrawlState state;
            try (IPageRenderer renderer = renderers.get()) {
                DiscoveryResult seeds = discoverer.discover(website);
                LOG.debug("Discovered {} urls ({} priority) for {}", seeds.urls().size(), seeds.priority().size(), domain);
                state = crawler.crawl(carrier.name(), website, seeds, renderer, store);
            }

            SiteReport report = classifier.classifySite(carrier.name(), domain, store);
            CrawlSummary summary = state.toSummary(carrier.name()).withSignals(report);
            try {
                store.writeSummary(summary);
            } catch (IOException e) {
                LOG.warn("Summary rewrite failed: {} ({})", store.dir(), e.toString());
                slog.warn("summary-write-failed", "dir", store.dir());
            }

            double secs = seconds(t0);
            SiteOutcome o = SiteOutcome.completed(index, carrier, domain, summary, report, secs);
            LOG.info("Site done #{}: {} -> {} (location pages {}/{}, {}s)",
                    index, carrier.name(), o.status.label(), report.acceptedPages(), report.totalPagesSeen(), Durations.round1(secs));
            slog.info("site-done",
                    "status", o.status.label(),
                    "pages", summary.crawlStats.pagesCrawled,
                    "failed", summary.crawlStats.pagesFailed,
                    "locationPages", report.acceptedPages(),
                    "topScore", o.topScore);
            return new SiteResult(o, report);

        } catch (Exception e) {
            double secs = seconds(t0);
            LOG.warn("Site failed #{}: {} ({})", index, carrier.name(), e.toString());
            slog.error("site-error", e);
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            return SiteResult.of(SiteOutcome.error(index, carrier, domain, e, secs));
        }
    }

    private static double seconds(long t0) {
        return (System.nanoTime() - t0) / 1_000_000_000.0;
    }
}
