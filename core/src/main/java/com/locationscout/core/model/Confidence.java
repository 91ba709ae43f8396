package com.locationscout.core.model;

/** 신호 신뢰도 라벨. 점수 계산에는 쓰지 않는다(표시용). */
public enum Confidence { HIGH, MEDIUM, LOW }
