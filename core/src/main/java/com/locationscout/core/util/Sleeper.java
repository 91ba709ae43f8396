package com.locationscout.core.util;

import java.time.Duration;

/** 페이지 간 지연/settle 대기를 주입 가능하게 분리(테스트는 기록용 구현으로 대체). */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper SYSTEM = d -> {
        long ms = (d == null) ? 0 : Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    };
}
