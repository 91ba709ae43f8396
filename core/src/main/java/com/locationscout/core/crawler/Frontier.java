package com.locationscout.core.crawler;

import com.locationscout.core.model.FrontierPriority;
import com.locationscout.core.model.FrontierUrl;

import java.util.*;

/**
 * 사이트 1개의 작업 큐. 3개 레인으로 우선순위를 명시한다(FrontierPriority 참고).
 * seen 집합은 큐 대기 + 방문 + 실패를 모두 덮으므로 같은 URL 은 한 번만 들어온다.
 */
public final class Frontier {
    private final Deque<FrontierUrl> front = new ArrayDeque<>();
    private final Deque<FrontierUrl> tools = new ArrayDeque<>();
    private final Deque<FrontierUrl> ordinary = new ArrayDeque<>();
    private final Set<String> seen = new HashSet<>();

    /** 루트 전용: 맨 앞 레인의 머리에 넣는다 */
    public boolean offerFirst(FrontierUrl u) {
        if (!seen.add(u.url())) return false;
        front.addFirst(u);
        return true;
    }

    /** 시드: 레인별 순서 유지(뒤에 붙임) */
    public boolean offerSeed(FrontierUrl u) {
        if (!seen.add(u.url())) return false;
        laneOf(u.priority()).addLast(u);
        return true;
    }

    /**
     * 페이지에서 새로 찾은 링크:
     * 인덱스/문서와 도구 서브도메인은 자기 레인 머리에, 일반 링크는 꼬리에.
     */
    public boolean offer(FrontierUrl u) {
        if (!seen.add(u.url())) return false;
        if (u.priority() == FrontierPriority.ORDINARY) ordinary.addLast(u);
        else laneOf(u.priority()).addFirst(u);
        return true;
    }

    public Optional<FrontierUrl> poll() {
        FrontierUrl u = front.pollFirst();
        if (u == null) u = tools.pollFirst();
        if (u == null) u = ordinary.pollFirst();
        return Optional.ofNullable(u);
    }

    public boolean hasSeen(String url) { return seen.contains(url); }
    public boolean isEmpty() { return front.isEmpty() && tools.isEmpty() && ordinary.isEmpty(); }
    public int size() { return front.size() + tools.size() + ordinary.size(); }

    /** 꺼낼 순서 그대로의 스냅샷(디버깅/테스트용) */
    public List<FrontierUrl> snapshot() {
        List<FrontierUrl> out = new ArrayList<>(size());
        out.addAll(front);
        out.addAll(tools);
        out.addAll(ordinary);
        return out;
    }

    private Deque<FrontierUrl> laneOf(FrontierPriority p) {
        return switch (p.lane()) {
            case 0 -> front;
            case 1 -> tools;
            default -> ordinary;
        };
    }
}
