package com.flamingo.ai.contextlab.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GlobPatterns Tests")
class GlobPatternsTest {

  private static boolean matches(String glob, String value) {
    return GlobPatterns.toPattern(glob).matcher(value).matches();
  }

  @Test
  @DisplayName("Should match star and question mark wildcards")
  void shouldMatchWildcards() {
    assertThat(matches("*.py", "script.py")).isTrue();
    assertThat(matches("*.py", "script.pyc")).isFalse();
    assertThat(matches("data?.csv", "data1.csv")).isTrue();
    assertThat(matches("data?.csv", "data10.csv")).isFalse();
  }

  @Test
  @DisplayName("Should let star cross path separators")
  void shouldCrossSeparators() {
    assertThat(matches("*node_modules*", "/repo/node_modules/lib/index.js")).isTrue();
    assertThat(matches("*/build/*", "/repo/build/out.json")).isTrue();
  }

  @Test
  @DisplayName("Should support character classes and negation")
  void shouldSupportCharacterClasses() {
    assertThat(matches("[ab].txt", "a.txt")).isTrue();
    assertThat(matches("[ab].txt", "c.txt")).isFalse();
    assertThat(matches("[!ab].txt", "c.txt")).isTrue();
    assertThat(matches("[oops.txt", "[oops.txt")).isTrue();
  }

  @Test
  @DisplayName("Should treat regex metacharacters literally")
  void shouldQuoteMetacharacters() {
    assertThat(matches("a+b(1).md", "a+b(1).md")).isTrue();
    assertThat(matches("a+b(1).md", "aab1.md")).isFalse();
  }

  @Test
  @DisplayName("Should compile null to no patterns and match any of several")
  void shouldCompileLists() {
    assertThat(GlobPatterns.compile(null)).isEmpty();

    List<Pattern> patterns = GlobPatterns.compile(List.of("*.py", "*.json"));

    assertThat(GlobPatterns.anyMatch(patterns, "config.json")).isTrue();
    assertThat(GlobPatterns.anyMatch(patterns, "notes.md")).isFalse();
  }
}
