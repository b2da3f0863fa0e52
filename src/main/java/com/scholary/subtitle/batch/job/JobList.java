package com.scholary.subtitle.batch.job;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Ordered list of jobs, unique by id. List order is batch order.
 *
 * <p>Owned by the control thread.
 */
@Component
public class JobList {

  private final Map<String, SubtitleJob> jobs = new LinkedHashMap<>();

  /**
   * Append a job.
   *
   * @throws DuplicateJobException if a job with the same id is already listed
   */
  public void add(SubtitleJob job) {
    if (jobs.containsKey(job.getId())) {
      throw new DuplicateJobException(job.getId());
    }
    jobs.put(job.getId(), job);
  }

  /**
   * Append several jobs, or none of them if any is a duplicate.
   *
   * @throws DuplicateJobException naming the first duplicate
   */
  public void addAll(Collection<SubtitleJob> newJobs) {
    Set<String> seen = new HashSet<>(jobs.keySet());
    for (SubtitleJob job : newJobs) {
      if (!seen.add(job.getId())) {
        throw new DuplicateJobException(job.getId());
      }
    }
    newJobs.forEach(job -> jobs.put(job.getId(), job));
  }

  public boolean contains(String id) {
    return jobs.containsKey(id);
  }

  public Optional<SubtitleJob> find(String id) {
    return Optional.ofNullable(jobs.get(id));
  }

  /**
   * @throws JobNotFoundException if no job has this id
   */
  public SubtitleJob require(String id) {
    SubtitleJob job = jobs.get(id);
    if (job == null) {
      throw new JobNotFoundException(id);
    }
    return job;
  }

  public SubtitleJob remove(String id) {
    SubtitleJob removed = jobs.remove(id);
    if (removed == null) {
      throw new JobNotFoundException(id);
    }
    return removed;
  }

  public void clear() {
    jobs.clear();
  }

  public int size() {
    return jobs.size();
  }

  public boolean isEmpty() {
    return jobs.isEmpty();
  }

  /** Jobs in batch order. */
  public List<SubtitleJob> jobs() {
    return Collections.unmodifiableList(new ArrayList<>(jobs.values()));
  }

  public List<JobSnapshot> snapshot() {
    return jobs.values().stream().map(SubtitleJob::snapshot).toList();
  }
}
