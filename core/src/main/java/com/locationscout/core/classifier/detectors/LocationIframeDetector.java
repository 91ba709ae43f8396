package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** 위치/지도 성격의 iframe(src/title/name 키워드). Google Maps iframe 은 제외. */
public final class LocationIframeDetector implements SignalDetector {

    static final List<String> KEYWORDS = List.of(
            "map", "location", "store", "dealer", "terminal", "branch", "office", "locator");

    @Override
    public Optional<Signal> detect(PageContext page) {
        List<String> hits = new ArrayList<>();
        for (Element f : page.document().select("iframe")) {
            String src = f.attr("src").toLowerCase(Locale.ROOT);
            if (src.contains("google.com/maps") || src.contains("maps.google")) continue;
            String title = f.attr("title").toLowerCase(Locale.ROOT);
            String name = f.attr("name").toLowerCase(Locale.ROOT);
            for (String k : KEYWORDS) {
                if (src.contains(k) || title.contains(k) || name.contains(k)) {
                    hits.add(f.attr("src"));
                    break;
                }
            }
        }
        if (hits.isEmpty()) return Optional.empty();
        return Optional.of(Signal.of(SignalKind.LOCATION_IFRAME, Confidence.MEDIUM, 3,
                hits.size() + " location-related iframe(s)", Signal.clip(hits.get(0), 60)));
    }
}
