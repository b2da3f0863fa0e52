package com.scholary.subtitle.batch.completion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HostPlatformTest {

  @Test
  void fromOsName_shouldDetectPlatforms() {
    assertThat(HostPlatform.fromOsName("Windows 11")).isEqualTo(HostPlatform.WINDOWS);
    assertThat(HostPlatform.fromOsName("Mac OS X")).isEqualTo(HostPlatform.MAC);
    assertThat(HostPlatform.fromOsName("Linux")).isEqualTo(HostPlatform.LINUX);
    assertThat(HostPlatform.fromOsName("")).isEqualTo(HostPlatform.LINUX);
  }

  @Test
  void commandFor_shouldReturnPowerCommands() {
    assertThat(HostPlatform.WINDOWS.commandFor(CompletionPolicy.SHUTDOWN_HOST))
        .containsExactly("shutdown", "/s", "/t", "1");
    assertThat(HostPlatform.MAC.commandFor(CompletionPolicy.SUSPEND_HOST))
        .containsExactly("pmset", "sleepnow");
  }

  @Test
  void commandFor_shouldRejectPoliciesWithoutHostCommand() {
    assertThatThrownBy(() -> HostPlatform.LINUX.commandFor(CompletionPolicy.EXIT_PROCESS))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
