package com.flamingo.ai.contextlab.service.ingestion;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shell-style wildcard matching where {@code *} also matches path separators, so {@code
 * *node_modules*} matches any path containing that segment.
 */
final class GlobPatterns {

  private GlobPatterns() {}

  static List<Pattern> compile(List<String> globs) {
    if (globs == null) {
      return List.of();
    }
    return globs.stream().map(GlobPatterns::toPattern).collect(Collectors.toList());
  }

  static boolean anyMatch(List<Pattern> patterns, String value) {
    return patterns.stream().anyMatch(p -> p.matcher(value).matches());
  }

  static Pattern toPattern(String glob) {
    StringBuilder regex = new StringBuilder();
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      if (c == '*') {
        regex.append(".*");
      } else if (c == '?') {
        regex.append('.');
      } else if (c == '[') {
        int close = glob.indexOf(']', i + 2);
        if (close < 0) {
          regex.append("\\[");
        } else {
          String body = glob.substring(i + 1, close).replace("\\", "\\\\");
          if (body.startsWith("!")) {
            body = "^" + body.substring(1);
          }
          regex.append('[').append(body).append(']');
          i = close;
        }
      } else {
        regex.append(Pattern.quote(String.valueOf(c)));
      }
      i++;
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }
}
