// IPageRenderer.java
package com.locationscout.core.api;

/** 렌더러 최소 계약: 사이트마다 격리된 세션(브라우저 컨텍스트)을 연다. */
public interface IPageRenderer extends AutoCloseable {
    IRenderSession openSession(String userAgent) throws RenderException;
    @Override default void close() throws Exception {}
}
