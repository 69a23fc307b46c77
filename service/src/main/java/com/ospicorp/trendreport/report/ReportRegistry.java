package com.ospicorp.trendreport.report;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Latest outcome per report. A completed run replaces the previous result and clears any
 * recorded failure; a failed run only records its diagnostic, so the last good result stays
 * readable.
 */
@Component
public class ReportRegistry {
  private final Map<String, ReportResult> results = new ConcurrentHashMap<>();
  private final Map<String, RunFailure> failures = new ConcurrentHashMap<>();

  public void completed(ReportResult result) {
    results.put(result.name(), result);
    failures.remove(result.name());
  }

  public void failed(String name, RunFailure failure) {
    failures.put(name, failure);
  }

  public Optional<ReportResult> result(String name) {
    return Optional.ofNullable(results.get(name));
  }

  public Optional<RunFailure> failure(String name) {
    return Optional.ofNullable(failures.get(name));
  }

  public ReportStatus status(String name) {
    if (failures.containsKey(name)) {
      return ReportStatus.FAILED;
    }
    return results.containsKey(name) ? ReportStatus.COMPLETED : ReportStatus.PENDING;
  }

  /**
   * The last completed result.
   *
   * @throws ReportUnavailableException when the report never completed a run
   */
  public ReportResult require(String name) {
    ReportResult result = results.get(name);
    if (result != null) {
      return result;
    }
    RunFailure failure = failures.get(name);
    if (failure != null) {
      throw new ReportUnavailableException("Report " + name + " failed: " + failure.message());
    }
    throw new ReportUnavailableException("Report " + name + " has not completed a run yet");
  }
}
