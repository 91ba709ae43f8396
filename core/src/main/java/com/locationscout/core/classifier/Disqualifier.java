package com.locationscout.core.classifier;

import com.locationscout.core.model.Signal;

import java.util.Optional;

/** 1단계 실격 규칙. 해당하면 DISQUALIFIED(0점) 신호를 돌려준다. */
@FunctionalInterface
public interface Disqualifier {
    Optional<Signal> check(PageContext page);
}
