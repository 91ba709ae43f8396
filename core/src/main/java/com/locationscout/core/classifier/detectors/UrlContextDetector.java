package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** 1차 신호가 하나도 없을 때의 약한 대체 신호: URL 에 위치 키워드(3점). */
public final class UrlContextDetector implements SignalDetector {

    static final List<String> LOCATION_URL_KEYWORDS = List.of(
            "location", "terminal", "service-center", "service-location",
            "facility", "branch", "find-us", "depot", "yard",
            "loadboard", "load-board", "/map", "locator", "finder",
            "servicemap", "branch-locator", "store-locator");

    public static boolean hasLocationUrl(String url) {
        if (url == null || url.isEmpty()) return false;
        String u = url.toLowerCase(Locale.ROOT);
        for (String k : LOCATION_URL_KEYWORDS) {
            if (u.contains(k)) return true;
        }
        return false;
    }

    @Override
    public Optional<Signal> detect(PageContext page) {
        if (!hasLocationUrl(page.urlLower())) return Optional.empty();
        return Optional.of(Signal.of(SignalKind.URL_CONTEXT, Confidence.MEDIUM, 3,
                "URL suggests location content", Signal.clip(page.url(), 60)));
    }

    @Override
    public boolean qualifies(Signal signal) { return true; }
}
