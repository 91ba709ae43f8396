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

/** 투자자/주식/분기 실적 등 저가치 페이지 감점(-5). path+query 와 제목을 본다. */
public final class LowValuePageDetector implements SignalDetector {

    public static final int PENALTY = -5;

    private final List<Pattern> patterns;

    public LowValuePageDetector(List<String> regexes) {
        this.patterns = regexes.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Signal> detect(PageContext page) {
        String path = page.pathLower();
        String title = page.titleLower();
        for (Pattern p : patterns) {
            if (p.matcher(path).find() || p.matcher(title).find()) {
                return Optional.of(Signal.of(SignalKind.LOW_VALUE_PAGE, Confidence.MEDIUM, PENALTY,
                        "Low-value page category (" + p.pattern() + ")", Signal.clip(page.url(), 60)));
            }
        }
        return Optional.empty();
    }
}
