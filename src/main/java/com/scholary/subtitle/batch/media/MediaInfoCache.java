package com.scholary.subtitle.batch.media;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Caffeine cache of probe results.
 *
 * <p>Keys include the file size and modification time, so a file that changes on disk is probed
 * again.
 */
@Component
public class MediaInfoCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaInfoCache.class);

  private final Cache<String, MediaInfo> cache;

  public MediaInfoCache(
      @Value("${probe.cache.maxSize:500}") int maxSize,
      @Value("${probe.cache.ttlMinutes:60}") int ttlMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
            .recordStats()
            .build();

    LOGGER.info("Initialized media info cache: maxSize={}, ttlMinutes={}", maxSize, ttlMinutes);
  }

  public Optional<MediaInfo> get(Path file) {
    MediaInfo info = cache.getIfPresent(cacheKey(file));
    if (info != null) {
      LOGGER.debug("Cache hit: file={}", file);
      return Optional.of(info);
    }
    LOGGER.debug("Cache miss: file={}", file);
    return Optional.empty();
  }

  public void put(Path file, MediaInfo info) {
    cache.put(cacheKey(file), info);
  }

  public void evict(Path file) {
    cache.invalidate(cacheKey(file));
  }

  /**
   * Get cache statistics for monitoring.
   *
   * @return cache stats
   */
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "MediaInfoCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }

  private static String cacheKey(Path file) {
    Path normalized = file.toAbsolutePath().normalize();
    try {
      return String.format(
          "%s:%d:%d",
          normalized, Files.size(normalized), Files.getLastModifiedTime(normalized).toMillis());
    } catch (IOException e) {
      return normalized.toString();
    }
  }
}
