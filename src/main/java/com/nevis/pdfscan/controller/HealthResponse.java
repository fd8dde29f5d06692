package com.nevis.pdfscan.controller;

public record HealthResponse(String status, String version) {}
