package com.flamingo.ai.segmentation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * One page's analysis as delivered by the vision page analyzer.
 *
 * <p>A record whose analysis did not succeed carries no payload; consumers treat it as "no data for
 * this page" and never as a fault. The declared page number may be missing or inconsistent with the
 * record's position, which {@code PageRecordLookup} tolerates.
 *
 * @param pageNumber declared 1-based page number, may be {@code null}
 * @param succeeded whether the analyzer produced a usable payload
 * @param payload the analysis, present only when {@code succeeded} is true
 * @param error analyzer error message for failed pages, passed through untouched
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageRecord(
    @JsonProperty("page_number") Integer pageNumber,
    @JsonProperty("success") boolean succeeded,
    @JsonProperty("data") PageAnalysis payload,
    @JsonProperty("error") String error) {

  public static PageRecord succeeded(int pageNumber, PageAnalysis payload) {
    return new PageRecord(pageNumber, true, payload, null);
  }

  public static PageRecord failed(int pageNumber, String error) {
    return new PageRecord(pageNumber, false, null, error);
  }

  /** The payload, if the analysis succeeded and produced one. */
  public Optional<PageAnalysis> analysis() {
    return succeeded && payload != null ? Optional.of(payload) : Optional.empty();
  }
}
