package com.locationscout.core.model;

/**
 * 프론티어 우선순위 계층.
 *
 * 꺼내는 순서(비교 기준):
 * 1) INDEX, PDF_OR_MAP: 맨 앞 레인. 나중에 들어온 것이 먼저 나온다(LIFO).
 * 2) TOOL_SUBDOMAIN: 두 번째 레인. 역시 LIFO.
 * 3) ORDINARY: 마지막 레인. 들어온 순서대로(FIFO).
 * 앞 레인이 비어 있을 때만 다음 레인에서 꺼낸다.
 */
public enum FrontierPriority {
    INDEX(0),
    PDF_OR_MAP(0),
    TOOL_SUBDOMAIN(1),
    ORDINARY(2);

    private final int lane;

    FrontierPriority(int lane) { this.lane = lane; }

    /** 0 = 맨 앞, 1 = 두 번째, 2 = 뒤 */
    public int lane() { return lane; }

    /** 인덱스/문서 계층(시드 분할과 settle 판정에 사용) */
    public boolean isIndexOrDocument() { return lane == 0; }
}
