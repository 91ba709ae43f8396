package com.locationscout.core.classifier.disqualify;

import com.locationscout.core.classifier.Disqualifier;
import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.detectors.UrlContextDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.Optional;

/** &lt;html lang&gt; 가 있고 en* 이 아니면 실격. 단, URL 자체가 위치 페이지를 가리키면 통과. */
public final class NonEnglishDisqualifier implements Disqualifier {

    @Override
    public Optional<Signal> check(PageContext page) {
        String lang = page.declaredLang();
        if (lang.isEmpty() || lang.startsWith("en")) return Optional.empty();
        if (UrlContextDetector.hasLocationUrl(page.urlLower())) return Optional.empty();
        return Optional.of(Signal.of(SignalKind.DISQUALIFIED, Confidence.HIGH, 0,
                "Non-English page", "lang=" + Signal.clip(lang, 20)));
    }
}
