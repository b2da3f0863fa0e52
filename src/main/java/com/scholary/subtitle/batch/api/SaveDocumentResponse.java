package com.scholary.subtitle.batch.api;

public record SaveDocumentResponse(String path) {}
