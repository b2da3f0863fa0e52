package com.scholary.subtitle.batch.events;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchEventPublisherTest {

  @Test
  void publish_shouldReachRemainingListenersWhenOneFails() {
    List<String> received = new ArrayList<>();
    BatchEventListener failing =
        new BatchEventListener() {
          @Override
          public void batchFinished() {
            throw new IllegalStateException("listener bug");
          }
        };
    BatchEventListener recording =
        new BatchEventListener() {
          @Override
          public void batchFinished() {
            received.add("batchFinished");
          }
        };
    BatchEventPublisher publisher = new BatchEventPublisher(List.of(failing, recording));

    publisher.batchFinished();

    assertThat(received).containsExactly("batchFinished");
  }

  @Test
  void removeListener_shouldStopDelivery() {
    List<Integer> counts = new ArrayList<>();
    BatchEventListener listener =
        new BatchEventListener() {
          @Override
          public void batchStarted(int jobCount) {
            counts.add(jobCount);
          }
        };
    BatchEventPublisher publisher = new BatchEventPublisher(List.of());
    publisher.addListener(listener);

    publisher.batchStarted(3);
    publisher.removeListener(listener);
    publisher.batchStarted(4);

    assertThat(counts).containsExactly(3);
  }
}
