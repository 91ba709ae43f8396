package com.locationscout.core.classifier;

import com.locationscout.core.model.Signal;

import java.util.Optional;

/**
 * 독립 탐지 단위. 페이지 하나를 보고 신호 0~1개를 낸다.
 * 1차(게이트) 탐지기는 qualifies() 로 "이 신호 하나로 통과 가능한가"를 판단한다.
 */
@FunctionalInterface
public interface SignalDetector {
    Optional<Signal> detect(PageContext page);

    /** 게이트 통과 자격(기본: 없음) */
    default boolean qualifies(Signal signal) { return false; }
}
