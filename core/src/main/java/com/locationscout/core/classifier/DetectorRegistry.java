package com.locationscout.core.classifier;

import com.locationscout.core.classifier.detectors.*;
import com.locationscout.core.classifier.disqualify.ErrorPageDisqualifier;
import com.locationscout.core.classifier.disqualify.ExcludedCategoryDisqualifier;
import com.locationscout.core.classifier.disqualify.NonEnglishDisqualifier;
import com.locationscout.core.model.ScoutConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 분류 단계별 탐지기 묶음.
 * - disqualifiers : 1단계(하나라도 걸리면 0점 실격)
 * - primary       : 2단계 게이트 후보(qualifies() 가 참인 신호가 하나는 있어야 통과)
 * - fallback      : 1차 신호가 없을 때만 시도(URL 문맥)
 * - secondary     : 게이트 통과 후 보너스/감점
 * 순서 = 신호 기록 순서.
 */
public final class DetectorRegistry {

    private final List<Disqualifier> disqualifiers;
    private final List<SignalDetector> primary;
    private final List<SignalDetector> fallback;
    private final List<SignalDetector> secondary;

    private DetectorRegistry(Builder b) {
        this.disqualifiers = List.copyOf(b.disqualifiers);
        this.primary = List.copyOf(b.primary);
        this.fallback = List.copyOf(b.fallback);
        this.secondary = List.copyOf(b.secondary);
    }

    public List<Disqualifier> disqualifiers() { return disqualifiers; }
    public List<SignalDetector> primary() { return primary; }
    public List<SignalDetector> fallback() { return fallback; }
    public List<SignalDetector> secondary() { return secondary; }

    public static DetectorRegistry defaults(ScoutConfig.Classifier cfg) {
        Objects.requireNonNull(cfg, "cfg");
        return builder()
                .disqualifier(new ErrorPageDisqualifier(cfg.getErrorPageMinBytes()))
                .disqualifier(new NonEnglishDisqualifier())
                .disqualifier(new ExcludedCategoryDisqualifier())
                .primary(new IndexPageDetector())
                .primary(new AddressListDetector())
                .primary(new CoordinateDetector())
                .primary(new GoogleMapsDetector())
                .primary(new FinderFormDetector())
                .fallback(new UrlContextDetector())
                .secondary(new JsonLdDetector())
                .secondary(MapLibraryDetector.mapbox())
                .secondary(MapLibraryDetector.leaflet())
                .secondary(MapLibraryDetector.arcgis())
                .secondary(new LocationIframeDetector())
                .secondary(new PdfLinkDetector())
                .secondary(new LowValuePageDetector(cfg.getLowValueUrlPatterns()))
                .secondary(new NonUsLocaleDetector(cfg.getNonUsUrlPatterns(), cfg.getUsUrlPatterns()))
                .build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final List<Disqualifier> disqualifiers = new ArrayList<>();
        private final List<SignalDetector> primary = new ArrayList<>();
        private final List<SignalDetector> fallback = new ArrayList<>();
        private final List<SignalDetector> secondary = new ArrayList<>();

        public Builder disqualifier(Disqualifier d) { disqualifiers.add(Objects.requireNonNull(d)); return this; }
        public Builder primary(SignalDetector d) { primary.add(Objects.requireNonNull(d)); return this; }
        public Builder fallback(SignalDetector d) { fallback.add(Objects.requireNonNull(d)); return this; }
        public Builder secondary(SignalDetector d) { secondary.add(Objects.requireNonNull(d)); return this; }

        public DetectorRegistry build() { return new DetectorRegistry(this); }
    }
}
