package com.semsort.persist;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON file persistence that never exposes a partially written file to readers.
 *
 * <p>Writes go to a sibling temp file which is then moved over the target. Reads treat a missing or
 * empty file as absent; a file that fails to parse is moved aside to {@code <name>.corrupt.<epochMs>}
 * and also treated as absent.
 */
public class AtomicJsonFile {
    private static final Logger log = LoggerFactory.getLogger(AtomicJsonFile.class);

    private final ObjectMapper mapper;

    public AtomicJsonFile() {
        this(JsonMapper.builder().findAndAddModules().build());
    }

    public AtomicJsonFile(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> Optional<T> read(Path path, Class<T> type) throws IOException {
        return read(path, mapper.getTypeFactory().constructType(type));
    }

    public <T> Optional<T> read(Path path, JavaType type) throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(path.toFile(), type));
        } catch (JsonProcessingException e) {
            Path backup = path.resolveSibling(path.getFileName() + ".corrupt." + System.currentTimeMillis());
            Files.move(path, backup, StandardCopyOption.REPLACE_EXISTING);
            log.warn("persist.corrupt path={} backup={} reason={}", path, backup, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void write(Path path, Object value) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
