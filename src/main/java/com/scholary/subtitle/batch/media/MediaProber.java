package com.scholary.subtitle.batch.media;

import java.nio.file.Path;

/** Reads media metadata from a file. */
public interface MediaProber {

  /**
   * @throws MediaProbeException if the file cannot be probed
   */
  MediaInfo probe(Path file);
}
