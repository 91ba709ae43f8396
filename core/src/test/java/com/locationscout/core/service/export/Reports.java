package com.locationscout.core.service.export;

import com.locationscout.core.model.*;
import com.locationscout.core.service.RunResult;

import java.time.Instant;
import java.util.List;

/** 보고서 테스트용 고정 데이터 */
final class Reports {
    private Reports() {}

    static final Instant AT = Instant.parse("2025-03-01T21:34:00Z");

    static SiteReport acme() {
        PageClassification index = PageClassification.scored("https://acme.com/locations", "Locations",
                List.of(Signal.of(SignalKind.INDEX_PAGE, Confidence.HIGH, 15, "URL is a location index page", "")),
                15, 3);
        PageClassification network = PageClassification.scored("https://acme.com/network", "Our Network",
                List.of(Signal.of(SignalKind.ADDRESS_LIST, Confidence.HIGH, 10, "5 addresses found", "100 Main St"),
                        Signal.of(SignalKind.NON_US_LOCALE, Confidence.MEDIUM, -3, "Non-US regional page", "")),
                7, 3);
        return SiteReport.builder("Acme Freight", "acme.com")
                .add(network).add(index).seen()
                .build(20, "Parse addresses from HTML");
    }

    static SiteReport empty() {
        return SiteReport.builder("Zeta Lines", "zeta.com").seen()
                .build(20, "No location data detected - manual review needed");
    }

    static RunResult result() {
        SiteOutcome ok = SiteOutcome.completed(0, new Carrier("Acme Freight", "https://acme.com"), "acme.com",
                new CrawlSummary(), acme(), 3.2);
        SiteOutcome skipped = SiteOutcome.skipped(1, new Carrier("Nowhere", ""));
        return new RunResult(AT, new RunSummary(List.of(ok, skipped), 4.0), List.of(acme(), empty()));
    }
}
