package com.scholary.subtitle.batch.completion;

/** Ends the application process. */
public interface ProcessTerminator {

  void terminate(int exitCode);
}
