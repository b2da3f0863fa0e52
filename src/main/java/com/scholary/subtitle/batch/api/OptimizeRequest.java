package com.scholary.subtitle.batch.api;

/**
 * Request to optimize the loaded document.
 *
 * @param prompt extra instructions, optional
 * @param targetLanguage translate into this language, optional
 */
public record OptimizeRequest(String prompt, String targetLanguage) {}
