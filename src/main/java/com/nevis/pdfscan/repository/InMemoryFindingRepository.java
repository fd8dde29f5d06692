package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

public class InMemoryFindingRepository implements FindingRepository {

    private static final Comparator<Finding> HIGHEST_CONFIDENCE_FIRST =
        Comparator.comparingDouble(Finding::confidence).reversed();

    private final Map<UUID, Finding> findings = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void save(Finding finding) {
        lock.lock();
        try {
            findings.put(finding.id(), finding);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Finding> findByDocumentId(UUID documentId) {
        return sorted(finding -> finding.documentId().equals(documentId));
    }

    @Override
    public List<Finding> findAll(int limit, int offset, Optional<FindingType> findingType) {
        List<Finding> matching = sorted(finding -> findingType
            .map(type -> finding.findingType() == type)
            .orElse(true));
        return Pages.slice(matching, limit, offset);
    }

    @Override
    public long count(Optional<UUID> documentId) {
        lock.lock();
        try {
            return documentId
                .map(id -> findings.values().stream().filter(f -> f.documentId().equals(id)).count())
                .orElse((long) findings.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long countByType(FindingType findingType) {
        lock.lock();
        try {
            return findings.values().stream()
                .filter(finding -> finding.findingType() == findingType)
                .count();
        } finally {
            lock.unlock();
        }
    }

    private List<Finding> sorted(Predicate<Finding> filter) {
        List<Finding> matching;
        lock.lock();
        try {
            matching = new ArrayList<>(findings.values().stream().filter(filter).toList());
        } finally {
            lock.unlock();
        }
        matching.sort(HIGHEST_CONFIDENCE_FIRST);
        return matching;
    }
}
