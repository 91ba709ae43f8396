package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 위치 찾기 폼.
 * - 찾기 어휘 + 반경/거리 필드 동시 존재: LOCATION_FINDER(8, 게이트 통과)
 * - 둘 중 하나만: LOCATION_SEARCH(4)
 * 견적/리드/주문 폼은 제외(우편번호만 묻는 폼이 많음).
 */
public final class FinderFormDetector implements SignalDetector {

    static final List<String> FINDER_WORDS = List.of(
            "find location", "find terminal", "find facility", "locate", "search location",
            "find near", "nearby", "service center locator", "terminal locator");
    static final List<String> RADIUS_WORDS = List.of("radius", "distance", "miles", "within");
    static final List<String> QUOTE_WORDS = List.of("quote", "lead", "contact", "order", "ship");

    @Override
    public Optional<Signal> detect(PageContext page) {
        Signal weak = null;
        for (Element form : page.document().select("form")) {
            String html = form.outerHtml().toLowerCase(Locale.ROOT);
            String text = form.text().toLowerCase(Locale.ROOT);
            String action = form.attr("action").toLowerCase(Locale.ROOT);

            if (containsAny(html, QUOTE_WORDS) || containsAny(action, QUOTE_WORDS)) continue;

            boolean finder = containsAny(html, FINDER_WORDS) || containsAny(text, FINDER_WORDS);
            boolean radius = containsAny(html, RADIUS_WORDS);
            if (finder && radius) {
                return Optional.of(Signal.of(SignalKind.LOCATION_FINDER, Confidence.HIGH, 8,
                        "Location finder/locator form", "Form with location search and radius"));
            }
            if ((finder || radius) && weak == null) {
                weak = Signal.of(SignalKind.LOCATION_SEARCH, Confidence.MEDIUM, 4,
                        finder ? "Location search form" : "Search form with radius/distance",
                        Signal.clip(action, 60));
            }
        }
        return Optional.ofNullable(weak);
    }

    @Override
    public boolean qualifies(Signal signal) {
        return signal.kind() == SignalKind.LOCATION_FINDER;
    }

    private static boolean containsAny(String s, List<String> needles) {
        for (String n : needles) {
            if (s.contains(n)) return true;
        }
        return false;
    }
}
