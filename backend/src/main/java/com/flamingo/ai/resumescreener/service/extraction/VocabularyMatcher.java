package com.flamingo.ai.resumescreener.service.extraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Whole-token matcher over one vocabulary category.
 *
 * <p>A variant only matches when it is not embedded in a longer word: {@code java} does not match
 * {@code javascript}, and {@code c} does not match {@code c++} or {@code c#}. Whitespace inside a
 * multi-word variant matches any whitespace run, so a line break between "machine" and "learning"
 * still counts.
 *
 * @param <T> canonical token type
 */
public final class VocabularyMatcher<T> {

  private static final String LEADING_BOUNDARY = "(?<![\\p{L}\\p{N}])";
  private static final String TRAILING_BOUNDARY = "(?![\\p{L}\\p{N}+#])";

  private final Map<T, List<Pattern>> patterns;
  private final Map<String, T> variantIndex;

  private VocabularyMatcher(Map<T, List<Pattern>> patterns, Map<String, T> variantIndex) {
    this.patterns = patterns;
    this.variantIndex = variantIndex;
  }

  /**
   * Compiles a matcher for the given table.
   *
   * @param table canonical token to its match variants, iteration order is kept
   * @param canonicalName how to render a canonical token as text, used to add the token itself as
   *     an implicit variant (pass {@code null} to skip)
   */
  public static <T> VocabularyMatcher<T> compile(
      Map<T, List<String>> table, Function<T, String> canonicalName) {
    Map<T, List<Pattern>> patterns = new LinkedHashMap<>();
    Map<String, T> variantIndex = new LinkedHashMap<>();
    for (Map.Entry<T, List<String>> entry : table.entrySet()) {
      Set<String> variants = new LinkedHashSet<>();
      if (canonicalName != null) {
        variants.add(clean(canonicalName.apply(entry.getKey())));
      }
      entry.getValue().stream().map(VocabularyMatcher::clean).forEach(variants::add);
      variants.remove("");

      List<Pattern> compiled = new ArrayList<>();
      for (String variant : variants) {
        compiled.add(tokenPattern(variant));
        variantIndex.putIfAbsent(variant, entry.getKey());
      }
      patterns.put(entry.getKey(), Collections.unmodifiableList(compiled));
    }
    return new VocabularyMatcher<>(
        Collections.unmodifiableMap(patterns), Collections.unmodifiableMap(variantIndex));
  }

  /** Compiles a matcher whose canonical tokens are strings. */
  public static VocabularyMatcher<String> forTokens(Map<String, List<String>> table) {
    return compile(table, token -> token);
  }

  /**
   * Finds every canonical token with at least one variant present in the text.
   *
   * @param text normalized text
   * @return matched tokens in vocabulary order
   */
  public Set<T> findAll(String text) {
    if (text == null || text.isEmpty()) {
      return Set.of();
    }
    return patterns.entrySet().stream()
        .filter(entry -> entry.getValue().stream().anyMatch(p -> p.matcher(text).find()))
        .map(Map.Entry::getKey)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Maps a user-supplied token (canonical or variant) to its canonical form.
   *
   * @param token raw token
   * @return the canonical token, or empty if the vocabulary does not know it
   */
  public Optional<T> canonicalize(String token) {
    return Optional.ofNullable(variantIndex.get(clean(token)));
  }

  public boolean isKnown(String token) {
    return variantIndex.containsKey(clean(token));
  }

  public int size() {
    return patterns.size();
  }

  /**
   * Tests whether a free-form token occurs in the text as a whole token, using the same boundary
   * rules as vocabulary variants.
   */
  public static boolean containsToken(String text, String token) {
    String cleaned = clean(token);
    if (text == null || cleaned.isEmpty()) {
      return false;
    }
    return tokenPattern(cleaned).matcher(text).find();
  }

  static Pattern tokenPattern(String variant) {
    String body =
        Arrays.stream(variant.split("\\s+"))
            .map(Pattern::quote)
            .collect(Collectors.joining("\\s+"));
    return Pattern.compile(LEADING_BOUNDARY + body + TRAILING_BOUNDARY);
  }

  static String clean(String token) {
    return token == null ? "" : token.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
  }
}
