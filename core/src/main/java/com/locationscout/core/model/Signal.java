package com.locationscout.core.model;

import java.util.Objects;

/**
 * 탐지기 하나가 만든 단일 증거. 생성 후 불변.
 *
 * @param points    부호 있는 점수(감점 신호는 음수)
 * @param rationale 사람이 읽는 설명
 * @param evidence  근거 발췌(짧게 자른 URL/텍스트)
 */
public record Signal(SignalKind kind, Confidence confidence, int points, String rationale, String evidence) {

    public Signal {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(confidence, "confidence");
        rationale = rationale == null ? "" : rationale;
        evidence = evidence == null ? "" : evidence;
    }

    public static Signal of(SignalKind kind, Confidence confidence, int points, String rationale, String evidence) {
        return new Signal(kind, confidence, points, rationale, evidence);
    }

    public boolean isPositive() { return points > 0; }

    /** 근거 문자열 길이 제한용 */
    public static String clip(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }
}
