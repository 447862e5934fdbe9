package com.flamingo.ai.batchplanner.service.boundary;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.batchplanner.model.StructuralSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LanguageRules Tests")
class LanguageRulesTest {

  @Test
  @DisplayName("should detect the language from the extension")
  void shouldDetectLanguage_fromExtension() {
    assertThat(LanguageRules.detectLanguage("src/app.tsx", null)).isEqualTo("typescript");
    assertThat(LanguageRules.detectLanguage("lib/util.MJS", null)).isEqualTo("javascript");
    assertThat(LanguageRules.detectLanguage("tools/build.py", null)).isEqualTo("python");
    assertThat(LanguageRules.detectLanguage("docs.v2/README", null)).isEqualTo("default");
  }

  @Test
  @DisplayName("should prefer the language reported by the analyzer")
  void shouldPreferSummaryLanguage_whenPresent() {
    StructuralSummary summary = StructuralSummary.builder().language("Java").build();

    assertThat(LanguageRules.detectLanguage("src/Main.kt", summary)).isEqualTo("java");
  }

  @Test
  @DisplayName("should classify declarations and skip control flow")
  void shouldClassifyDeclarations() {
    LanguageRules java = LanguageRules.forLanguage("java");

    assertThat(java.declarationType("  public void run() {")).isEqualTo(BoundaryType.FUNCTION);
    assertThat(java.declarationType("public final class Engine {")).isEqualTo(BoundaryType.CLASS);
    assertThat(java.declarationType("public interface Port {")).isEqualTo(BoundaryType.INTERFACE);
    assertThat(java.declarationType("    if (ready) {")).isNull();
    assertThat(java.declarationType("    } else {")).isNull();
  }

  @Test
  @DisplayName("should recognize imports and comments per language")
  void shouldRecognizeImportsAndComments() {
    LanguageRules python = LanguageRules.forLanguage("py");
    LanguageRules javascript = LanguageRules.forLanguage("javascript");

    assertThat(python.isImport("from os import path")).isTrue();
    assertThat(python.isComment("# note")).isTrue();
    assertThat(python.braceDelimited()).isFalse();
    assertThat(javascript.isImport("const fs = require('fs');")).isTrue();
    assertThat(javascript.isComment("* continued doc")).isTrue();
  }
}
