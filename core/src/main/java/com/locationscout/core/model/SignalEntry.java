package com.locationscout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Signal 의 JSON 표현(요약/보고서 파일 공용) */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SignalEntry {
    @JsonProperty("signal_type") public SignalKind kind;
    @JsonProperty("confidence")  public Confidence confidence;
    @JsonProperty("points")      public int points;
    @JsonProperty("details")     public String rationale;
    @JsonProperty("evidence")    public String evidence;

    public static SignalEntry from(Signal s) {
        SignalEntry e = new SignalEntry();
        e.kind = s.kind();
        e.confidence = s.confidence();
        e.points = s.points();
        e.rationale = s.rationale();
        e.evidence = s.evidence();
        return e;
    }

    public Signal toSignal() {
        return Signal.of(kind, confidence == null ? Confidence.LOW : confidence, points, rationale, evidence);
    }
}
