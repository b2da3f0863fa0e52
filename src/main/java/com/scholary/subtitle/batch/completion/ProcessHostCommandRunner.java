package com.scholary.subtitle.batch.completion;

import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Starts host commands with {@link ProcessBuilder}. Does not wait: a suspended or shut down host
 * will not report back.
 */
@Component
public class ProcessHostCommandRunner implements HostCommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessHostCommandRunner.class);

  @Override
  public void run(List<String> command) {
    LOGGER.warn("Running host command: {}", String.join(" ", command));
    try {
      new ProcessBuilder(command).inheritIO().start();
    } catch (IOException e) {
      throw new HostCommandException("Failed to run host command: " + String.join(" ", command), e);
    }
  }
}
