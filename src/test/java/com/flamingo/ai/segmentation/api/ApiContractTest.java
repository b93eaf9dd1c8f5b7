package com.flamingo.ai.segmentation.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.segmentation.api.dto.request.SegmentationRequest;
import com.flamingo.ai.segmentation.api.dto.request.SubtypeRequest;
import com.flamingo.ai.segmentation.api.rest.SegmentationController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the public endpoints:
 *
 * <ul>
 *   <li>POST /api/segmentation - Segment and classify page records
 *   <li>POST /api/segmentation/subtype - Detect the sub-type of text snippets
 *   <li>GET /api/segmentation/catalog - Sub-type catalog and extraction routing
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("SegmentationController API contract")
  class SegmentationControllerContract {

    @Test
    @DisplayName("should be mapped to /api/segmentation")
    void shouldBeMappedToApiSegmentation() {
      RequestMapping mapping = SegmentationController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/segmentation");
    }

    @Test
    @DisplayName("should expose segment, subtype and catalog operations")
    void shouldExposeOperations() throws Exception {
      PostMapping segment =
          SegmentationController.class
              .getMethod("segment", SegmentationRequest.class)
              .getAnnotation(PostMapping.class);
      PostMapping subtype =
          SegmentationController.class
              .getMethod("detectSubtype", SubtypeRequest.class)
              .getAnnotation(PostMapping.class);
      GetMapping catalog =
          SegmentationController.class.getMethod("catalog").getAnnotation(GetMapping.class);

      assertThat(segment).isNotNull();
      assertThat(segment.value()).isEmpty();
      assertThat(subtype.value()).containsExactly("/subtype");
      assertThat(catalog.value()).containsExactly("/catalog");
    }
  }
}
