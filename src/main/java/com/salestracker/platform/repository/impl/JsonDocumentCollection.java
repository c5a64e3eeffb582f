package com.salestracker.platform.repository.impl;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One collection of documents kept in memory and mirrored to {@code <collection>.json}.
 * Every mutation runs under the collection lock and rewrites the file.
 */
public class JsonDocumentCollection<T> {

    private static final Logger logger = LoggerFactory.getLogger(JsonDocumentCollection.class);

    private final File file;
    private final ObjectMapper objectMapper;
    private final JavaType listType;
    private final Function<T, String> idExtractor;
    private final Map<String, T> documents = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public JsonDocumentCollection(String dataDirectory, String collection, Class<T> documentType,
                                  Function<T, String> idExtractor) {
        this.file = new File(dataDirectory, collection + ".json");
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, documentType);
        this.idExtractor = idExtractor;
        initializeDirectory(dataDirectory);
        load();
    }

    private void initializeDirectory(String dataDirectory) {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create data directory: " + dataDirectory, e);
        }
    }

    private void load() {
        if (!file.exists()) {
            return;
        }
        try {
            List<T> stored = objectMapper.readValue(file, listType);
            if (stored == null) {
                return;
            }
            stored.forEach(document -> documents.put(idExtractor.apply(document), document));
            logger.info("Loaded {} documents from {}", documents.size(), file);
        } catch (IOException e) {
            logger.error("Failed to load documents from {}, starting empty", file, e);
        }
    }

    public Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(id));
    }

    public List<T> findAll() {
        return new ArrayList<>(documents.values());
    }

    public T save(T document) {
        return withLock(() -> {
            documents.put(idExtractor.apply(document), document);
            persist();
            return document;
        });
    }

    public boolean delete(String id) {
        return withLock(() -> {
            boolean removed = documents.remove(id) != null;
            if (removed) {
                persist();
            }
            return removed;
        });
    }

    /**
     * Runs a read-modify-write sequence atomically with respect to other mutations.
     */
    public <R> R withLock(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the collection to disk. Callers must hold the lock.
     */
    public void persist() {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, new ArrayList<>(documents.values()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist documents to " + file, e);
        }
    }

    public void putWithoutPersist(T document) {
        documents.put(idExtractor.apply(document), document);
    }

    public void removeWithoutPersist(String id) {
        documents.remove(id);
    }
}
