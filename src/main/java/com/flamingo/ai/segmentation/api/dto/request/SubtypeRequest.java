package com.flamingo.ai.segmentation.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for detecting the sub-type of a block of text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubtypeRequest {

  @NotNull(message = "Snippets are required")
  private List<String> snippets;
}
