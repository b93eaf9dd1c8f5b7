package com.flamingo.ai.segmentation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Identifiers the vision analyzer read off a page. Not used for decisions. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageIdentifiers(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("document_title") String documentTitle,
    @JsonProperty("date") String date,
    @JsonProperty("page_indicator") String pageIndicator,
    @JsonProperty("company_name") String companyName) {}
