package com.nevis.pdfscan.controller;

import java.util.List;

public record FindingsPageResponse(
    List<FindingResponse> findings,
    PaginationResponse pagination
) {}
