package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** URL 이 "전체 위치 목록" 인덱스 페이지 패턴이면 최고점(15). 단독으로 게이트 통과. */
public final class IndexPageDetector implements SignalDetector {

    static final List<String> INDEX_URL_PATTERNS = List.of(
            "/locations/?$",
            "/locations\\.html",
            "/our-locations/?$",
            "/all-locations/?$",
            "centersresult",
            "/coverage",
            "terminals/?$",
            "/service-centers?/?$",
            "service-center-locator",
            "/service-locations",
            "/facilities/?$",
            "/branches/?$",
            "/find-us/?$",
            "/terminal-locations/?$",
            "/branch-locator",
            "/map\\.html",
            "servicemap\\.pdf",
            "/locator/?$",
            "/find-location",
            "/store-locator",
            "/dealer-locator");

    public static final int POINTS = 15;

    private final List<Pattern> patterns;

    public IndexPageDetector() { this(INDEX_URL_PATTERNS); }

    public IndexPageDetector(List<String> regexes) {
        this.patterns = regexes.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Signal> detect(PageContext page) {
        String url = page.urlLower();
        for (Pattern p : patterns) {
            if (p.matcher(url).find()) {
                return Optional.of(Signal.of(SignalKind.INDEX_PAGE, Confidence.HIGH, POINTS,
                        "URL is a location index page", Signal.clip(page.url(), 80)));
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean qualifies(Signal signal) { return true; }
}
