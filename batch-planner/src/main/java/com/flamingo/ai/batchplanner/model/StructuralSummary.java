package com.flamingo.ai.batchplanner.model;

import java.util.List;
import lombok.Builder;

/**
 * Structural facts about a file, produced by the upstream analyzer. All list fields are non-null.
 *
 * @param language language reported by the analyzer, may be null
 * @param totalLines number of lines in the file
 * @param imports import statements or module specifiers
 * @param exports exported names
 * @param functions function and method declarations
 * @param classes class declarations
 * @param interfaces interface and type declarations
 * @param maxNesting deepest block nesting seen
 * @param complexityScore analyzer-specific complexity score
 * @param dependencies internal and external dependencies
 */
@Builder
public record StructuralSummary(
    String language,
    int totalLines,
    List<String> imports,
    List<String> exports,
    List<CodeSymbol> functions,
    List<CodeSymbol> classes,
    List<CodeSymbol> interfaces,
    int maxNesting,
    double complexityScore,
    Dependencies dependencies) {

  public StructuralSummary {
    imports = imports == null ? List.of() : List.copyOf(imports);
    exports = exports == null ? List.of() : List.copyOf(exports);
    functions = functions == null ? List.of() : List.copyOf(functions);
    classes = classes == null ? List.of() : List.copyOf(classes);
    interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    dependencies = dependencies == null ? Dependencies.NONE : dependencies;
  }

  public static StructuralSummary empty() {
    return StructuralSummary.builder().build();
  }

  /**
   * @param internal project-internal module references
   * @param external third-party package references
   */
  public record Dependencies(List<String> internal, List<String> external) {

    public static final Dependencies NONE = new Dependencies(List.of(), List.of());

    public Dependencies {
      internal = internal == null ? List.of() : List.copyOf(internal);
      external = external == null ? List.of() : List.copyOf(external);
    }
  }
}
