package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String message,

    @JsonProperty("error_code")
    String errorCode,

    int status,

    long timestamp
) {}
