package com.flamingo.ai.batchplanner.service.boundary;

import com.flamingo.ai.batchplanner.model.StructuralSummary;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Per-language patterns used to find declarations, header imports and comment syntax.
 *
 * @param language canonical language name
 * @param declarations declaration patterns checked in order; the first match decides the type
 * @param importPattern matches a stripped header import line
 * @param lineComment prefix of a single-line comment
 * @param braceDelimited whether blocks are delimited by braces
 */
public record LanguageRules(
    String language,
    List<Declaration> declarations,
    Pattern importPattern,
    String lineComment,
    boolean braceDelimited) {

  public static final String DEFAULT_LANGUAGE = "default";

  private static final Pattern CONTROL_FLOW =
      Pattern.compile(
          "^\\s*(?:}\\s*)?(?:if|else|for|while|do|switch|case|try|catch|finally|return|throw)\\b");

  private static final Map<String, String> EXTENSIONS =
      Map.ofEntries(
          Map.entry("js", "javascript"),
          Map.entry("jsx", "javascript"),
          Map.entry("mjs", "javascript"),
          Map.entry("cjs", "javascript"),
          Map.entry("ts", "typescript"),
          Map.entry("tsx", "typescript"),
          Map.entry("py", "python"),
          Map.entry("java", "java"));

  private static final LanguageRules JAVASCRIPT =
      new LanguageRules(
          "javascript",
          List.of(
              decl(
                  BoundaryType.CLASS,
                  "^\\s*(?:export\\s+(?:default\\s+)?)?(?:abstract\\s+)?class\\s+\\w+"),
              decl(
                  BoundaryType.FUNCTION,
                  "^\\s*(?:export\\s+(?:default\\s+)?)?(?:async\\s+)?function\\b"),
              decl(
                  BoundaryType.FUNCTION,
                  "^\\s*(?:export\\s+)?(?:const|let|var)\\s+\\w+\\s*=\\s*(?:async\\s+)?"
                      + "(?:function\\b|\\([^)]*\\)\\s*=>|\\w+\\s*=>)"),
              decl(
                  BoundaryType.FUNCTION,
                  "^\\s+(?:static\\s+)?(?:async\\s+)?(?:get\\s+|set\\s+)?"
                      + "\\w+\\s*\\([^)]*\\)\\s*\\{"),
              decl(BoundaryType.MODULE, "^\\s*(?:import|export)\\s+"),
              decl(BoundaryType.COMMENT, "^\\s*/\\*\\*"),
              decl(BoundaryType.COMMENT, "^\\s*//\\s*[=\\-#]{3,}")),
          Pattern.compile(
              "^(?:import\\s|import\\{|export\\s+\\*\\s+from\\s|(?:const|let|var)\\s+"
                  + "(?:\\w+|\\{[^}]*\\})\\s*=\\s*require\\()"),
          "//",
          true);

  private static final LanguageRules TYPESCRIPT =
      new LanguageRules(
          "typescript",
          List.of(
              decl(
                  BoundaryType.CLASS,
                  "^\\s*(?:export\\s+(?:default\\s+)?)?(?:declare\\s+)?"
                      + "(?:abstract\\s+)?class\\s+\\w+"),
              decl(BoundaryType.INTERFACE, "^\\s*(?:export\\s+)?(?:declare\\s+)?interface\\s+\\w+"),
              decl(
                  BoundaryType.FUNCTION,
                  "^\\s*(?:export\\s+(?:default\\s+)?)?(?:declare\\s+)?(?:async\\s+)?function\\b"),
              decl(
                  BoundaryType.FUNCTION,
                  "^\\s*(?:export\\s+)?(?:const|let|var)\\s+\\w+\\s*(?::[^=]+)?=\\s*(?:async\\s+)?"
                      + "(?:function\\b|\\([^)]*\\)\\s*(?::[^=]+)?=>|\\w+\\s*=>)"),
              decl(
                  BoundaryType.FUNCTION,
                  "^\\s+(?:(?:public|private|protected|static|readonly|async|abstract)\\s+)*"
                      + "\\w+\\s*(?:<[^>]*>)?\\s*\\([^)]*\\)\\s*(?::[^{]+)?\\{"),
              decl(
                  BoundaryType.TYPE,
                  "^\\s*(?:export\\s+)?(?:declare\\s+)?"
                      + "(?:type\\s+\\w+.*=|(?:const\\s+)?enum\\s+\\w+"
                      + "|namespace\\s+\\w+)"),
              decl(BoundaryType.MODULE, "^\\s*(?:import|export)\\s+"),
              decl(BoundaryType.COMMENT, "^\\s*/\\*\\*"),
              decl(BoundaryType.COMMENT, "^\\s*//\\s*[=\\-#]{3,}")),
          JAVASCRIPT.importPattern(),
          "//",
          true);

  private static final LanguageRules PYTHON =
      new LanguageRules(
          "python",
          List.of(
              decl(BoundaryType.CLASS, "^\\s*class\\s+\\w+"),
              decl(BoundaryType.FUNCTION, "^\\s*(?:async\\s+)?def\\s+\\w+"),
              decl(BoundaryType.MODULE, "^(?:from\\s+\\S+\\s+)?import\\s+"),
              decl(BoundaryType.COMMENT, "^\\s*#\\s*[=\\-#]{3,}")),
          Pattern.compile("^(?:import\\s|from\\s+\\S+\\s+import\\s)"),
          "#",
          false);

  private static final LanguageRules JAVA =
      new LanguageRules(
          "java",
          List.of(
              decl(
                  BoundaryType.INTERFACE,
                  "^\\s*(?:@\\w+\\s+)*"
                      + "(?:(?:public|protected|private|abstract|static|sealed|non-sealed)\\s+)*"
                      + "@?interface\\s+\\w+"),
              decl(
                  BoundaryType.CLASS,
                  "^\\s*(?:@\\w+\\s+)*(?:(?:public|protected|private|abstract|final|static|sealed"
                      + "|non-sealed|strictfp)\\s+)*(?:class|record|enum)\\s+\\w+"),
              decl(
                  BoundaryType.FUNCTION,
                  "^\\s*(?:@\\w+\\s+)*"
                      + "(?:(?:public|protected|private|static|final|abstract|synchronized"
                      + "|native|default)\\s+)+(?:<[^>]*>\\s+)?[\\w.$]+(?:<[^()]*?>)?(?:\\[\\])*"
                      + "\\s+\\w+\\s*\\("),
              decl(BoundaryType.FUNCTION, "^\\s*(?:public|protected|private)\\s+\\w+\\s*\\("),
              decl(BoundaryType.MODULE, "^\\s*(?:import|package)\\s+[\\w.]+"),
              decl(BoundaryType.COMMENT, "^\\s*/\\*\\*")),
          Pattern.compile("^(?:import|package)\\s"),
          "//",
          true);

  private static final LanguageRules DEFAULT =
      new LanguageRules(
          DEFAULT_LANGUAGE,
          List.of(
              decl(BoundaryType.CLASS, "^\\s*(?:pub\\s+)?(?:class|struct|impl|trait)\\b"),
              decl(BoundaryType.FUNCTION, "^\\s*(?:pub\\s+)?(?:fn|func|function|def|sub)\\s+\\w+"),
              decl(BoundaryType.MODULE, "^\\s*(?:import|use|require|include|package)\\b"),
              decl(BoundaryType.COMMENT, "^\\s*/\\*\\*")),
          Pattern.compile("^(?:import\\s|use\\s|#include|require\\b|package\\s)"),
          "//",
          true);

  public LanguageRules {
    declarations = List.copyOf(declarations);
  }

  /** Returns the rules for a language name, or the default rules for anything unrecognized. */
  public static LanguageRules forLanguage(String language) {
    if (language == null) {
      return DEFAULT;
    }
    return switch (language.toLowerCase(Locale.ROOT)) {
      case "javascript", "js", "jsx" -> JAVASCRIPT;
      case "typescript", "ts", "tsx" -> TYPESCRIPT;
      case "python", "py" -> PYTHON;
      case "java" -> JAVA;
      default -> DEFAULT;
    };
  }

  /** Language from the analyzer summary when present, otherwise from the file extension. */
  public static String detectLanguage(String path, StructuralSummary summary) {
    if (summary != null && summary.language() != null && !summary.language().isBlank()) {
      return summary.language().toLowerCase(Locale.ROOT);
    }
    return EXTENSIONS.getOrDefault(extensionOf(path), DEFAULT_LANGUAGE);
  }

  static String extensionOf(String path) {
    if (path == null) {
      return "";
    }
    int slash = path.lastIndexOf('/');
    int dot = path.lastIndexOf('.');
    return dot > slash ? path.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
  }

  /** Returns the declaration type of the line, or null when the line declares nothing. */
  public BoundaryType declarationType(String line) {
    if (CONTROL_FLOW.matcher(line).find()) {
      return null;
    }
    for (Declaration declaration : declarations) {
      if (declaration.pattern().matcher(line).find()) {
        return declaration.type();
      }
    }
    return null;
  }

  public boolean isImport(String strippedLine) {
    return importPattern.matcher(strippedLine).find();
  }

  /** Whether a stripped line is a comment line in this language. */
  public boolean isComment(String strippedLine) {
    if (strippedLine.startsWith(lineComment)) {
      return true;
    }
    return braceDelimited
        && (strippedLine.startsWith("/*")
            || strippedLine.startsWith("*")
            || strippedLine.startsWith("*/"));
  }

  private static Declaration decl(BoundaryType type, String regex) {
    return new Declaration(type, Pattern.compile(regex));
  }

  /**
   * @param type boundary type a match stands for
   * @param pattern pattern matched against the raw line
   */
  public record Declaration(BoundaryType type, Pattern pattern) {}
}
