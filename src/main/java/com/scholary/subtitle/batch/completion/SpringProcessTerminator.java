package com.scholary.subtitle.batch.completion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the Spring context and exits the JVM.
 *
 * <p>Runs on its own thread because closing the context shuts down the control thread that
 * requested the exit.
 */
@Component
public class SpringProcessTerminator implements ProcessTerminator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpringProcessTerminator.class);

  private final ApplicationContext context;

  public SpringProcessTerminator(ApplicationContext context) {
    this.context = context;
  }

  @Override
  public void terminate(int exitCode) {
    LOGGER.warn("Exiting application: exitCode={}", exitCode);
    Thread exitThread =
        new Thread(() -> System.exit(SpringApplication.exit(context, () -> exitCode)), "app-exit");
    exitThread.setDaemon(false);
    exitThread.start();
  }
}
