// IRenderSession.java
package com.locationscout.core.api;

import com.locationscout.core.model.RenderedPage;

/** 사이트 하나 전용 렌더 세션: URL을 열어 최종 URL/상태/HTML/제목/링크를 돌려준다. */
public interface IRenderSession extends AutoCloseable {
    RenderedPage render(String url, RenderOptions options) throws RenderException;
    @Override default void close() {}
}
