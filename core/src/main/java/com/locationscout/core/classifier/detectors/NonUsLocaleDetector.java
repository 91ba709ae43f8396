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

/** 비미국 지역 URL 감점(-3). 미국 패턴도 함께 맞으면 감점하지 않는다. */
public final class NonUsLocaleDetector implements SignalDetector {

    public static final int PENALTY = -3;

    private final List<Pattern> nonUs;
    private final List<Pattern> us;

    public NonUsLocaleDetector(List<String> nonUsRegexes, List<String> usRegexes) {
        this.nonUs = compile(nonUsRegexes);
        this.us = compile(usRegexes);
    }

    @Override
    public Optional<Signal> detect(PageContext page) {
        String url = page.urlLower();
        if (!anyFind(nonUs, url) || anyFind(us, url)) return Optional.empty();
        return Optional.of(Signal.of(SignalKind.NON_US_LOCALE, Confidence.MEDIUM, PENALTY,
                "Non-US regional page", Signal.clip(page.url(), 60)));
    }

    private static boolean anyFind(List<Pattern> ps, String s) {
        for (Pattern p : ps) {
            if (p.matcher(s).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compile(List<String> regexes) {
        return regexes.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }
}
