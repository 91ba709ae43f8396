package com.locationscout.core.classifier;

import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.PageClassification;
import com.locationscout.core.model.ScoutConfig;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 페이지 1건 분류기: 실격 → 1차 게이트 → 2차 신호 → 점수 합산.
 * 점수 = 모든 신호 점수 합(0 미만은 0), accepted = 합 &gt;= 임계값.
 * 탐지기 하나가 RuntimeException 을 던지면 그 탐지기만 무시하고 계속한다.
 * 상태가 없으므로 여러 스레드에서 공유해도 된다.
 */
public final class LocationClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(LocationClassifier.class);

    private final DetectorRegistry registry;
    private final int threshold;

    public LocationClassifier(ScoutConfig.Classifier cfg) {
        this(DetectorRegistry.defaults(cfg), cfg.getAcceptThreshold());
    }

    public LocationClassifier(DetectorRegistry registry, int threshold) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.threshold = threshold;
    }

    public int threshold() { return threshold; }

    public PageClassification classify(String html, String url) {
        return classify(PageContext.of(html, url));
    }

    public PageClassification classify(PageContext page) {
        // 1) 실격
        for (Disqualifier d : registry.disqualifiers()) {
            Optional<Signal> reason = run(d, page);
            if (reason.isPresent()) {
                return PageClassification.disqualified(page.url(), page.title(), reason.get());
            }
        }

        // 2) 1차 게이트
        List<Signal> signals = new ArrayList<>();
        boolean gate = false;
        for (SignalDetector det : registry.primary()) {
            Optional<Signal> s = run(det, page);
            if (s.isPresent()) {
                signals.add(s.get());
                if (det.qualifies(s.get())) gate = true;
            }
        }
        if (!gate) {
            for (SignalDetector det : registry.fallback()) {
                Optional<Signal> s = run(det, page);
                if (s.isPresent() && det.qualifies(s.get())) {
                    signals.add(s.get());
                    gate = true;
                    break;
                }
            }
        }
        if (!gate) {
            List<Signal> diag = signals.isEmpty()
                    ? List.of(Signal.of(SignalKind.NO_LOCATION_CONTENT, Confidence.HIGH, 0,
                            "No primary location signals found", ""))
                    : signals;
            return PageClassification.rejected(page.url(), page.title(), diag);
        }

        // 3) 2차 신호(보너스/감점)
        for (SignalDetector det : registry.secondary()) {
            run(det, page).ifPresent(signals::add);
        }

        int sum = 0;
        for (Signal s : signals) sum += s.points();
        return PageClassification.scored(page.url(), page.title(), signals, sum, threshold);
    }

    private static Optional<Signal> run(SignalDetector det, PageContext page) {
        try {
            Optional<Signal> s = det.detect(page);
            return s == null ? Optional.empty() : s;
        } catch (RuntimeException e) {
            LOG.warn("detector {} failed on {}: {}", det.getClass().getSimpleName(), page.url(), e.toString());
            return Optional.empty();
        }
    }

    private static Optional<Signal> run(Disqualifier d, PageContext page) {
        try {
            Optional<Signal> s = d.check(page);
            return s == null ? Optional.empty() : s;
        } catch (RuntimeException e) {
            LOG.warn("disqualifier {} failed on {}: {}", d.getClass().getSimpleName(), page.url(), e.toString());
            return Optional.empty();
        }
    }
}
