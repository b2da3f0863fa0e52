package com.scholary.subtitle.batch.batch;

/** Whether the scheduler is driving a batch. */
public enum SchedulerState {
  IDLE,
  ACTIVE
}
