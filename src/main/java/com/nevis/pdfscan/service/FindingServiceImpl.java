package com.nevis.pdfscan.service;

import com.nevis.pdfscan.config.Backends;
import com.nevis.pdfscan.controller.FindingResponse;
import com.nevis.pdfscan.controller.FindingsPageResponse;
import com.nevis.pdfscan.controller.PaginationResponse;
import com.nevis.pdfscan.model.FindingType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class FindingServiceImpl implements FindingService {

    private final Backends backends;

    @Override
    public FindingsPageResponse list(int limit, int offset, Optional<FindingType> findingType) {
        List<FindingResponse> findings = backends.findings().findAll(limit, offset, findingType).stream()
            .map(FindingResponse::from)
            .toList();

        long total = findingType
            .map(type -> backends.findings().countByType(type))
            .orElseGet(() -> backends.findings().count(Optional.empty()));

        return new FindingsPageResponse(findings, new PaginationResponse(limit, offset, total, findings.size()));
    }
}
