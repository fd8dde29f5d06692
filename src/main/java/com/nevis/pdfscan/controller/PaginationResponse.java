package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Paging block of a listing. {@code total} is omitted where the store does not count the listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaginationResponse(
    int limit,
    int offset,
    Long total,
    int returned
) {}
