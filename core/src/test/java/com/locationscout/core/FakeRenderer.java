package com.locationscout.core;

import com.locationscout.core.api.IPageRenderer;
import com.locationscout.core.api.IRenderSession;
import com.locationscout.core.api.RenderException;
import com.locationscout.core.api.RenderOptions;
import com.locationscout.core.model.RenderedPage;

import java.util.*;

/** URL → 응답 맵 기반 렌더러. 요청 순서/settle 여부를 기록한다. 스레드 안전. */
public final class FakeRenderer implements IPageRenderer {

    private final Map<String, RenderedPage> pages = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final List<String> requested = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> settled = Collections.synchronizedSet(new LinkedHashSet<>());

    public FakeRenderer page(String url, String html, String... links) {
        pages.put(url, new RenderedPage(200, url, html, "", List.of(links)));
        return this;
    }

    public FakeRenderer status(String url, int status) {
        pages.put(url, new RenderedPage(status, url, "", "", List.of()));
        return this;
    }

    public FakeRenderer fail(String url) {
        failing.add(url);
        return this;
    }

    public List<String> requested() { return List.copyOf(requested); }
    public Set<String> settled() { return Set.copyOf(settled); }

    @Override
    public IRenderSession openSession(String userAgent) {
        return (url, options) -> render(url, options);
    }

    private RenderedPage render(String url, RenderOptions options) throws RenderException {
        requested.add(url);
        if (options.settle()) settled.add(url);
        if (failing.contains(url)) throw new RenderException("timeout: " + url, null, true);
        RenderedPage p = pages.get(url);
        if (p == null) throw new RenderException("no route: " + url, null);
        return p;
    }
}
