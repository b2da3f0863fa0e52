package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.codec.SubtitleFormat;
import com.scholary.subtitle.batch.codec.SubtitleLayout;

/**
 * Request to save the loaded document. Every field is optional.
 *
 * @param path destination, defaults to {@code <name>_optimized} next to the loaded file
 * @param style ASS style section, ignored by other formats
 */
public record SaveDocumentRequest(
    String path, SubtitleFormat format, SubtitleLayout layout, String style) {}
