package com.locationscout.core.source;

import com.locationscout.core.api.ICarrierSource;
import com.locationscout.core.model.Carrier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 탭 구분 텍스트 파일에서 대상 목록을 읽는다: {@code name<TAB>website}
 * - '#' 주석/빈 줄 무시, 첫 줄이 "name" 으로 시작하면 헤더로 간주
 * - website 정리: 콤마로 여러 개면 첫 번째, 스킴 없으면 https:// 부착, 끝 '/' 제거
 * - website 가 비어도 행은 유지(실행 시 skipped-invalid-url 로 집계)
 */
public final class FlatFileCarrierSource implements ICarrierSource {
    private final Path file;

    public FlatFileCarrierSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public List<Carrier> load() throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("carrier list not found at: " + file.toAbsolutePath());
        }
        List<Carrier> out = new ArrayList<>();
        boolean first = true;
        for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (first) {
                first = false;
                if (line.toLowerCase(Locale.ROOT).startsWith("name\t")) continue; // 헤더
            }
            String[] cols = raw.split("\t", -1);
            String name = cols[0].strip();
            String website = cols.length > 1 ? cleanWebsite(cols[1]) : "";
            out.add(new Carrier(name, website));
        }
        return out;
    }

    /** 스프레드시트에서 넘어온 웹사이트 칸 정리 */
    public static String cleanWebsite(String raw) {
        if (raw == null) return "";
        String w = raw.strip();
        if (w.isEmpty() || w.equalsIgnoreCase("nan")) return "";
        int comma = w.indexOf(',');
        if (comma >= 0) w = w.substring(0, comma).strip();
        if (w.isEmpty()) return "";
        if (!w.contains("://")) w = "https://" + w;
        while (w.endsWith("/")) w = w.substring(0, w.length() - 1);
        return w;
    }
}
