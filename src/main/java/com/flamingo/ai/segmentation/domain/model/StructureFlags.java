package com.flamingo.ai.segmentation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.segmentation.domain.enums.DataDensity;

/** Structural observations about a page. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructureFlags(
    @JsonProperty("has_tables") boolean hasTables,
    @JsonProperty("has_forms") boolean hasForms,
    @JsonProperty("has_key_values") boolean hasKeyValues,
    @JsonProperty("data_density") DataDensity dataDensity) {

  public StructureFlags {
    dataDensity = dataDensity != null ? dataDensity : DataDensity.LOW;
  }

  public static StructureFlags empty() {
    return new StructureFlags(false, false, false, DataDensity.LOW);
  }
}
