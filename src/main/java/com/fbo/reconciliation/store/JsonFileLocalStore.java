package com.fbo.reconciliation.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fbo.reconciliation.core.model.FacilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link LocalStore} persisted as a single JSON document.
 *
 * <p>The file is loaded once at construction. Every write serializes the full snapshot to a
 * sibling temp file and moves it over the store file, so a crash mid-write leaves the previous
 * version intact. Reads are served from memory.</p>
 */
public class JsonFileLocalStore implements LocalStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileLocalStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ConcurrentMap<String, List<FacilityRecord>> collections = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private volatile StoreMetadata metadata = StoreMetadata.initial();

    public JsonFileLocalStore(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        load();
    }

    @Override
    public List<FacilityRecord> get(String locationCode) {
        return collections.getOrDefault(InMemoryLocalStore.key(locationCode), List.of());
    }

    @Override
    public void replace(String locationCode, List<FacilityRecord> records) {
        synchronized (writeLock) {
            String key = InMemoryLocalStore.key(locationCode);
            List<FacilityRecord> previous = collections.put(key, List.copyOf(records));
            try {
                flush();
            } catch (LocalStoreException e) {
                if (previous != null) {
                    collections.put(key, previous);
                } else {
                    collections.remove(key);
                }
                throw e;
            }
        }
    }

    @Override
    public Set<String> locationCodes() {
        return Set.copyOf(collections.keySet());
    }

    @Override
    public StoreMetadata metadata() {
        return metadata;
    }

    @Override
    public void updateMetadata(StoreMetadata newMetadata) {
        synchronized (writeLock) {
            StoreMetadata previous = this.metadata;
            this.metadata = newMetadata;
            try {
                flush();
            } catch (LocalStoreException e) {
                this.metadata = previous;
                throw e;
            }
        }
    }

    @Override
    public void clear() {
        synchronized (writeLock) {
            collections.clear();
            metadata = StoreMetadata.initial();
            flush();
        }
    }

    public Path getFile() {
        return file;
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("store.created file={}", file);
            return;
        }
        try {
            StoreDocument document = objectMapper.readValue(file.toFile(), StoreDocument.class);
            if (document.metadata() != null) {
                metadata = document.metadata();
            }
            if (document.locations() != null) {
                document.locations().forEach((code, stored) ->
                        collections.put(InMemoryLocalStore.key(code),
                                stored.stream().map(StoredFacility::toRecord).toList()));
            }
            log.info("store.loaded file={} locations={} datasetVersion={}",
                    file, collections.size(), metadata.importedDatasetVersion());
        } catch (IOException e) {
            throw new LocalStoreException("Failed to read local store " + file, e);
        }
    }

    private void flush() {
        Map<String, List<StoredFacility>> locations = new TreeMap<>();
        collections.forEach((code, records) ->
                locations.put(code, records.stream().map(StoredFacility::from).toList()));
        StoreDocument document = new StoreDocument(metadata, new LinkedHashMap<>(locations));

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("store.flushed file={} locations={}", file, locations.size());
        } catch (IOException e) {
            throw new LocalStoreException("Failed to write local store " + file, e);
        }
    }

    record StoreDocument(StoreMetadata metadata, Map<String, List<StoredFacility>> locations) {}
}
