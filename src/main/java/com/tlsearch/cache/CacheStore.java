package com.tlsearch.cache;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tlsearch.runtime.AppConfig;
import com.tlsearch.source.TrainingResource;

/**
 * File-backed store for the last complete build, its freshness metadata and the partial progress of an
 * interrupted build.
 * <p>
 * Snapshot and partial I/O failures are thrown to the caller. Metadata failures are logged and read as
 * "no metadata", which makes the cache invalid and forces a rebuild.
 */
public class CacheStore {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);
    private static final TypeReference<List<TrainingResource>> RESOURCE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path snapshotPath;
    private final Path metadataPath;
    private final Path partialPath;
    private final Duration freshness;
    private final Clock clock;

    public CacheStore(Path snapshotPath, Path metadataPath, Path partialPath, Duration freshness, Clock clock) {
        this.snapshotPath = snapshotPath;
        this.metadataPath = metadataPath;
        this.partialPath = partialPath;
        this.freshness = freshness;
        this.clock = clock;
    }

    public static CacheStore fromConfig(AppConfig.CacheConfig cache, Clock clock) {
        return new CacheStore(
                cache.snapshotPath(),
                cache.metadataPath(),
                cache.partialPath(),
                Duration.ofHours(cache.getFreshnessHours()),
                clock);
    }

    /**
     * True only when metadata with a timestamp exists, less than the freshness window has passed since
     * it, and the snapshot file is present.
     */
    public boolean isValid() {
        Optional<CacheMetadata> metadata = readMetadata();
        if (metadata.isEmpty() || metadata.get().lastUpdated() == null) {
            return false;
        }
        Duration age = Duration.between(metadata.get().lastUpdated(), clock.instant());
        return age.compareTo(freshness) < 0 && Files.exists(snapshotPath);
    }

    public Optional<CacheMetadata> readMetadata() {
        if (!Files.exists(metadataPath)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(metadataPath.toFile(), CacheMetadata.class));
        } catch (IOException e) {
            log.warn("cache.metadata.unreadable path={} reason={}", metadataPath, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean snapshotExists() {
        return Files.exists(snapshotPath);
    }

    public List<TrainingResource> load() throws IOException {
        return mapper.readValue(snapshotPath.toFile(), RESOURCE_LIST);
    }

    /**
     * Removes the old metadata, writes the snapshot, then the new metadata. A metadata failure is logged
     * only; with no metadata left on disk the cache then reads as invalid.
     */
    public void save(List<TrainingResource> resources, CacheMetadata metadata) throws IOException {
        Files.deleteIfExists(metadataPath);
        writeAtomically(snapshotPath, resources);
        try {
            writeAtomically(metadataPath, metadata);
        } catch (IOException e) {
            log.warn("cache.metadata.write.failed path={} reason={}", metadataPath, e.getMessage(), e);
        }
    }

    public CacheMetadata freshMetadata(int itemCount, String version) {
        return new CacheMetadata(Instant.now(clock), itemCount, version);
    }

    public Optional<List<TrainingResource>> loadPartial() throws IOException {
        if (!Files.exists(partialPath)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(partialPath.toFile(), RESOURCE_LIST));
    }

    public void savePartial(List<TrainingResource> resources) throws IOException {
        writeAtomically(partialPath, resources);
    }

    public void deletePartial() throws IOException {
        Files.deleteIfExists(partialPath);
    }

    public Path snapshotPath() {
        return snapshotPath;
    }

    public Path metadataPath() {
        return metadataPath;
    }

    public Path partialPath() {
        return partialPath;
    }

    private void writeAtomically(Path target, Object value) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Path tmp = target.resolveSibling(target.getFileName().toString() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("cache.write.atomic-move-unsupported path={}", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
