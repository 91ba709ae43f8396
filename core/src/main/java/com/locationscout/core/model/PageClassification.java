package com.locationscout.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 페이지 1건의 분류 결과. 분류기에서 한 번 만들어지고 이후 변경되지 않는다.
 * totalScore 는 0 이상으로 clamp 된 값.
 */
public record PageClassification(String url,
                                 String title,
                                 List<Signal> signals,
                                 int totalScore,
                                 boolean accepted,
                                 Verdict verdict) {

    public PageClassification {
        url = url == null ? "" : url;
        title = title == null ? "" : title;
        signals = List.copyOf(Objects.requireNonNull(signals, "signals"));
        if (totalScore < 0) throw new IllegalArgumentException("totalScore must be >= 0");
        Objects.requireNonNull(verdict, "verdict");
    }

    public static PageClassification disqualified(String url, String title, Signal reason) {
        return new PageClassification(url, title, List.of(reason), 0, false, Verdict.DISQUALIFIED);
    }

    public static PageClassification rejected(String url, String title, List<Signal> signals) {
        return new PageClassification(url, title, signals, 0, false, Verdict.REJECTED);
    }

    /** 점수 합(음수 가능)을 받아 0으로 바닥 처리 후 임계값 판정 */
    public static PageClassification scored(String url, String title, List<Signal> signals, int rawSum, int threshold) {
        return new PageClassification(url, title, signals, Math.max(0, rawSum), rawSum >= threshold, Verdict.SCORED);
    }

    public List<Signal> positiveSignals() {
        return signals.stream().filter(Signal::isPositive).collect(Collectors.toList());
    }
}
