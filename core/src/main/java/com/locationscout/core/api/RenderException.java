package com.locationscout.core.api;

/** 페이지 1건 렌더 실패(타임아웃/네트워크/JS 오류). 호출자는 해당 URL만 실패 처리한다. */
public class RenderException extends Exception {
    private final boolean timeout;

    public RenderException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public RenderException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() { return timeout; }
}
