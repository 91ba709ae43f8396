package com.locationscout.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationscout.core.model.RunCheckpoint;
import com.locationscout.core.util.JsonSupport;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * 실행 체크포인트 파일 입출력(JSON).
 * 임시 파일에 쓴 뒤 교체하므로 쓰다 죽어도 이전 체크포인트는 남는다.
 */
public final class CheckpointStore {

    private final Path file;
    private final ObjectMapper om = JsonSupport.mapper();

    public CheckpointStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() { return file; }

    public void save(RunCheckpoint cp) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), cp);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** 파일이 없으면 empty */
    public Optional<RunCheckpoint> load() throws IOException {
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(om.readValue(file.toFile(), RunCheckpoint.class));
    }
}
