package com.scholary.subtitle.batch.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.subtitle.batch.media.MediaInfo;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobListTest {

  private JobList jobs;

  @BeforeEach
  void setUp() {
    jobs = new JobList();
  }

  private static SubtitleJob job(String name) {
    return new SubtitleJob(
        Path.of("/videos", name),
        JobKind.TRANSCRIPTION_ONLY,
        JobParameters.defaults(),
        MediaInfo.ofSubtitle(name, 0));
  }

  @Test
  void add_shouldKeepInsertionOrder() {
    jobs.add(job("b.mp4"));
    jobs.add(job("a.mp4"));
    jobs.add(job("c.mp4"));

    assertThat(jobs.jobs())
        .extracting(j -> j.getSource().getFileName().toString())
        .containsExactly("b.mp4", "a.mp4", "c.mp4");
  }

  @Test
  void add_shouldRejectDuplicateSource() {
    jobs.add(job("a.mp4"));

    assertThatThrownBy(() -> jobs.add(job("a.mp4")))
        .isInstanceOf(DuplicateJobException.class)
        .hasMessageContaining("a.mp4");
    assertThat(jobs.size()).isEqualTo(1);
  }

  @Test
  void addAll_shouldAddNothingWhenOneIsDuplicate() {
    jobs.add(job("a.mp4"));

    assertThatThrownBy(() -> jobs.addAll(List.of(job("b.mp4"), job("a.mp4"))))
        .isInstanceOf(DuplicateJobException.class);
    assertThat(jobs.size()).isEqualTo(1);
    assertThat(jobs.contains(SubtitleJob.idFor(Path.of("/videos/b.mp4")))).isFalse();
  }

  @Test
  void addAll_shouldRejectDuplicatesWithinBatch() {
    assertThatThrownBy(() -> jobs.addAll(List.of(job("x.mp4"), job("x.mp4"))))
        .isInstanceOf(DuplicateJobException.class);
    assertThat(jobs.isEmpty()).isTrue();
  }

  @Test
  void remove_shouldRejectUnknownId() {
    assertThatThrownBy(() -> jobs.remove("/nowhere.mp4"))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void require_shouldReturnListedJob() {
    SubtitleJob job = job("a.mp4");
    jobs.add(job);

    assertThat(jobs.require(job.getId())).isSameAs(job);
    assertThat(jobs.find("/missing")).isEmpty();
  }

  @Test
  void jobs_shouldReturnSnapshotOfList() {
    jobs.add(job("a.mp4"));
    List<SubtitleJob> view = jobs.jobs();

    jobs.clear();

    assertThat(view).hasSize(1);
    assertThat(jobs.isEmpty()).isTrue();
  }
}
