package com.locationscout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 실행 체크포인트 파일 포맷.
 * lastIndex = startIndex + results.size() - 1, 재개 위치는 lastIndex + 1.
 * startIndex 는 첫 실행의 시작 위치로, 재개를 거듭해도 유지된다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RunCheckpoint {
    @JsonProperty("timestamp")       public Instant timestamp;
    @JsonProperty("completed_count") public int completedCount;
    @JsonProperty("start_index")     public int startIndex;
    @JsonProperty("last_index")      public int lastIndex = -1;
    @JsonProperty("results")         public List<SiteOutcome> results = new ArrayList<>();

    public static RunCheckpoint of(int startIndex, List<SiteOutcome> results) {
        RunCheckpoint cp = new RunCheckpoint();
        cp.timestamp = Instant.now();
        cp.startIndex = startIndex;
        cp.results = new ArrayList<>(results);
        cp.completedCount = results.size();
        cp.lastIndex = startIndex + results.size() - 1;
        return cp;
    }

    /** 재개 시 처음 처리할 사이트 인덱스 */
    public int resumeIndex() {
        return lastIndex + 1;
    }
}
