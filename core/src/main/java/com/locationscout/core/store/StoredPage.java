package com.locationscout.core.store;

import java.nio.file.Path;

/** 저장소에서 읽은 페이지(파일 경로 + 표식 포함 HTML) */
public record StoredPage(Path file, String html) {

    /** URL 복원 실패 시 쓰는 파일명(확장자 제외) */
    public String stem() {
        String n = file.getFileName().toString();
        int dot = n.lastIndexOf('.');
        return dot > 0 ? n.substring(0, dot) : n;
    }
}
