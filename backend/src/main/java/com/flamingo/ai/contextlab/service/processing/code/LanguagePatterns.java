package com.flamingo.ai.contextlab.service.processing.code;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-language definition patterns. Each pattern is matched at the start of a single line; the
 * element name is the first capturing group that participated in the match.
 */
record LanguagePatterns(
    Pattern function, Pattern classDef, Pattern struct, Pattern importStmt, Pattern comment) {

  private static final Map<String, LanguagePatterns> PATTERNS =
      Map.of(
          "python",
          new LanguagePatterns(
              Pattern.compile("^\\s*def\\s+(\\w+)"),
              Pattern.compile("^\\s*class\\s+(\\w+)"),
              null,
              Pattern.compile("^\\s*(?:from\\s+[\\w.]+\\s+)?import\\s+(.+)"),
              Pattern.compile("^\\s*#(.+)")),
          "javascript",
          new LanguagePatterns(
              Pattern.compile(
                  "^\\s*(?:function\\s+(\\w+)|const\\s+(\\w+)\\s*=\\s*(?:async\\s+)?\\()"),
              Pattern.compile("^\\s*class\\s+(\\w+)"),
              null,
              Pattern.compile("^\\s*import\\s+(.+)"),
              Pattern.compile("^\\s*//(.+)")),
          "java",
          new LanguagePatterns(
              Pattern.compile(
                  "^\\s*(?:public|private|protected)?\\s+(?:static\\s+)?[\\w<>]+\\s+(\\w+)\\s*\\("),
              Pattern.compile("^\\s*(?:public\\s+)?class\\s+(\\w+)"),
              null,
              Pattern.compile("^\\s*import\\s+(.+);"),
              Pattern.compile("^\\s*//(.+)")),
          "go",
          new LanguagePatterns(
              Pattern.compile("^\\s*func\\s+(?:\\(\\w+\\s+\\*?\\w+\\)\\s+)?(\\w+)"),
              null,
              Pattern.compile("^\\s*type\\s+(\\w+)\\s+struct"),
              Pattern.compile("^\\s*import\\s+(.+)"),
              Pattern.compile("^\\s*//(.+)")));

  /** Returns the patterns for a language, or {@code null} when it has none. */
  static LanguagePatterns forLanguage(String language) {
    return PATTERNS.get(language);
  }

  /** Element kinds in scan order. */
  Map<String, Pattern> elementPatterns() {
    Map<String, Pattern> elements = new LinkedHashMap<>();
    if (function != null) {
      elements.put("function", function);
    }
    if (classDef != null) {
      elements.put("class", classDef);
    }
    if (struct != null) {
      elements.put("struct", struct);
    }
    return elements;
  }

  List<CodeElement> scanElements(List<String> lines) {
    Map<String, Pattern> elements = elementPatterns();
    List<CodeElement> found = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      for (Map.Entry<String, Pattern> entry : elements.entrySet()) {
        String name = matchName(entry.getValue(), line);
        if (name != null) {
          found.add(new CodeElement(entry.getKey(), name, i));
        }
      }
    }
    return found;
  }

  List<String> findAll(Pattern pattern, List<String> lines) {
    List<String> names = new ArrayList<>();
    for (String line : lines) {
      String name = matchName(pattern, line);
      if (name != null) {
        names.add(name);
      }
    }
    return names;
  }

  private static String matchName(Pattern pattern, String line) {
    Matcher matcher = pattern.matcher(line);
    if (!matcher.lookingAt()) {
      return null;
    }
    for (int g = 1; g <= matcher.groupCount(); g++) {
      if (matcher.group(g) != null) {
        return matcher.group(g).strip();
      }
    }
    return null;
  }
}
