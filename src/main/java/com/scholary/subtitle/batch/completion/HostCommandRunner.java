package com.scholary.subtitle.batch.completion;

import java.util.List;

/** Runs a power command on the host. */
public interface HostCommandRunner {

  /**
   * @throws HostCommandException if the command cannot be started
   */
  void run(List<String> command);
}
