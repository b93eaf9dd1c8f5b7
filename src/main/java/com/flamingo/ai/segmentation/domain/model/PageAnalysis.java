package com.flamingo.ai.segmentation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.PageKind;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;

/**
 * Payload of a successfully analyzed page.
 *
 * <p>Missing fields default to their empty value: no hints, no snippets, {@link
 * StructureFlags#empty()} and {@link PageKind#UNKNOWN}. Hints the analyzer could not map to a main
 * type (e.g. {@code OTHER}) are dropped.
 *
 * @param pageKind layout role of the page
 * @param typeHints main types suggested by the vision model
 * @param textSnippets short extracted text fragments, in page order
 * @param structureFlags tables/forms/key-value flags and data density
 * @param vlmConfidence vision model's self-reported confidence in [0,1]
 * @param segmentStart page looks like the first page of a new document
 * @param segmentEnd page looks like the last page of a document
 * @param continuesPrevious page continues the previous page
 * @param pageNumber page number echoed inside the payload, may be {@code null}
 * @param identifiers raw identifiers seen on the page, passed through
 * @param notes free-text analyzer notes, passed through
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageAnalysis(
    @JsonProperty("page_type") PageKind pageKind,
    @JsonProperty("document_type_hints") Set<MainDocumentType> typeHints,
    @JsonProperty("key_text_snippets") List<String> textSnippets,
    @JsonProperty("data_assessment") StructureFlags structureFlags,
    @JsonProperty("confidence") double vlmConfidence,
    @JsonProperty("is_document_start") boolean segmentStart,
    @JsonProperty("is_document_end") boolean segmentEnd,
    @JsonProperty("continues_previous") boolean continuesPrevious,
    @JsonProperty("page_number") Integer pageNumber,
    @JsonProperty("identifiers") PageIdentifiers identifiers,
    @JsonProperty("notes") String notes) {

  public PageAnalysis {
    pageKind = pageKind != null ? pageKind : PageKind.UNKNOWN;
    EnumSet<MainDocumentType> hints = EnumSet.noneOf(MainDocumentType.class);
    if (typeHints != null) {
      typeHints.stream().filter(Objects::nonNull).forEach(hints::add);
    }
    hints.remove(MainDocumentType.UNKNOWN);
    typeHints = Collections.unmodifiableSet(hints);
    textSnippets =
        textSnippets != null
            ? textSnippets.stream().filter(Objects::nonNull).toList()
            : List.of();
    structureFlags = structureFlags != null ? structureFlags : StructureFlags.empty();
    vlmConfidence = Math.max(0.0, Math.min(1.0, vlmConfidence));
  }

  public boolean hints(MainDocumentType type) {
    return typeHints.contains(type);
  }
}
