package com.nevis.pdfscan.service;

import com.nevis.pdfscan.controller.FindingsPageResponse;
import com.nevis.pdfscan.model.FindingType;

import java.util.Optional;

public interface FindingService {
    FindingsPageResponse list(int limit, int offset, Optional<FindingType> findingType);
}
