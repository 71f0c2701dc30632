package org.a11yrag.retrieval_service.rest;

public record ApiError(String code, String field, String message, Integer httpStatus) {}
