package com.scholary.subtitle.batch.completion;

import java.util.List;
import java.util.Locale;

/** Power commands per operating system. */
public enum HostPlatform {
  WINDOWS(
      List.of("rundll32.exe", "powrprof.dll,SetSuspendState", "0,1,0"),
      List.of("shutdown", "/s", "/t", "1")),
  MAC(List.of("pmset", "sleepnow"), List.of("sudo", "shutdown", "-h", "now")),
  LINUX(List.of("sudo", "systemctl", "suspend"), List.of("sudo", "shutdown", "now"));

  private final List<String> suspendCommand;
  private final List<String> shutdownCommand;

  HostPlatform(List<String> suspendCommand, List<String> shutdownCommand) {
    this.suspendCommand = suspendCommand;
    this.shutdownCommand = shutdownCommand;
  }

  public static HostPlatform current() {
    return fromOsName(System.getProperty("os.name", ""));
  }

  static HostPlatform fromOsName(String osName) {
    String os = osName.toLowerCase(Locale.ROOT);
    if (os.startsWith("windows")) {
      return WINDOWS;
    }
    if (os.contains("mac") || os.contains("darwin")) {
      return MAC;
    }
    return LINUX;
  }

  /**
   * @throws IllegalArgumentException for policies that do not run a host command
   */
  public List<String> commandFor(CompletionPolicy policy) {
    return switch (policy) {
      case SUSPEND_HOST -> suspendCommand;
      case SHUTDOWN_HOST -> shutdownCommand;
      case DO_NOTHING, EXIT_PROCESS ->
          throw new IllegalArgumentException("No host command for " + policy);
    };
  }
}
