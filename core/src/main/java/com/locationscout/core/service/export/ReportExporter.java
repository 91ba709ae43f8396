package com.locationscout.core.service.export;

import com.locationscout.core.service.RunResult;

import java.io.IOException;
import java.nio.file.Path;

/** 실행 결과를 파일로 내보내는 책임 (텍스트/JSON 보고서, 결과 목록) */
public interface ReportExporter {
    /**
     * @param outputDir 출력 루트 (null 이면 "data")
     * @param result    실행 결과
     * @return 생성된 파일 경로
     */
    Path export(Path outputDir, RunResult result) throws IOException;
}
