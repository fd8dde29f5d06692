package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.exception.DocumentNotFoundException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

public class InMemoryDocumentRepository implements DocumentRepository {

    private static final Comparator<Document> NEWEST_FIRST =
        Comparator.comparing(Document::uploadTime).reversed();

    private final Map<UUID, Document> documents = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void save(Document document) {
        lock.lock();
        try {
            documents.put(document.id(), document);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Document> findById(UUID id) {
        lock.lock();
        try {
            return Optional.ofNullable(documents.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status, String errorMessage) {
        lock.lock();
        try {
            Document existing = documents.get(id);
            if (existing == null) {
                throw new DocumentNotFoundException(id);
            }
            documents.put(id, existing.withStatus(status, errorMessage));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Document> findAll(int limit, int offset) {
        List<Document> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(documents.values());
        } finally {
            lock.unlock();
        }
        // List.sort is stable, so equal upload times keep insertion order
        snapshot.sort(NEWEST_FIRST);
        return Pages.slice(snapshot, limit, offset);
    }
}
