package com.locationscout.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (모르면 0.0)
     * @param phase    "site" | "batch" | "report"
     * @param done     처리한 사이트 수(모르면 -1)
     * @param total    이번 실행 대상 사이트 수(모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
