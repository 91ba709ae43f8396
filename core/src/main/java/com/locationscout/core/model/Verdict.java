package com.locationscout.core.model;

/**
 * 분류 결과의 진단 구분.
 * DISQUALIFIED: 1단계 실격(오류 페이지/비영어/제외 카테고리)
 * REJECTED: 1차 신호 없음
 * SCORED: 점수 계산까지 진행(accepted 여부는 임계값으로 결정)
 */
public enum Verdict { DISQUALIFIED, REJECTED, SCORED }
