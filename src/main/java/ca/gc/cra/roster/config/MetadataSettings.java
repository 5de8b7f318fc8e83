package ca.gc.cra.roster.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved {@code metadata} section.
 *
 * @param sampleAnnotation sample table; never {@code null}
 * @param sampleSubannotations subsample tables in declaration order; empty when none are declared
 * @param outputDir optional output directory
 * @param sampleTableIndex column that names samples; {@code sample_name} unless overridden
 *
 * @since 0.1.0
 */
public record MetadataSettings(
    Path sampleAnnotation, List<Path> sampleSubannotations, Path outputDir, String sampleTableIndex) {
  static final String SECTION = "metadata";
  static final String SAMPLE_ANNOTATION = "sample_annotation";
  static final String SAMPLE_SUBANNOTATION = "sample_subannotation";
  static final String OUTPUT_DIR = "output_dir";
  static final String SAMPLE_TABLE_INDEX = "sample_table_index";

  public MetadataSettings {
    sampleAnnotation = Objects.requireNonNull(sampleAnnotation, "sampleAnnotation");
    sampleSubannotations = sampleSubannotations == null ? List.of() : List.copyOf(sampleSubannotations);
    sampleTableIndex = Objects.requireNonNull(sampleTableIndex, "sampleTableIndex");
  }

  public Optional<Path> output() {
    return Optional.ofNullable(outputDir);
  }
}
