package com.flamingo.ai.resumescreener.service.extraction;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes decoded document text for pattern matching.
 *
 * <p>The output is lower-case NFKC text with one logical line per resume line or bullet, single
 * spaces inside lines and unicode dashes folded to {@code -}. Line structure is kept because date
 * ranges are detected per line. {@code normalize(normalize(x))} equals {@code normalize(x)}.
 */
@Component
public class TextNormalizer {

  private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?|[\\u2028\\u2029\\u0085]");
  private static final Pattern BULLETS =
      Pattern.compile("[\\u2022\\u25CF\\u25AA\\u25E6\\u2023\\u2219\\u00B7]");
  private static final Pattern DASHES =
      Pattern.compile("[\\u2010-\\u2015\\u2212\\uFE58\\uFE63\\uFF0D]");
  private static final Pattern SPACES = Pattern.compile("[\\t\\x0B\\f\\p{Zs}]+");
  private static final Pattern CONTROL =
      Pattern.compile("[\\p{Cc}\\p{Cf}\\p{Co}\\p{Cn}&&[^\\n\\r\\t\\x0B\\f\\u0085]]");
  private static final Pattern MULTI_SPACE = Pattern.compile(" {2,}");

  /**
   * Normalizes raw text.
   *
   * @param rawText decoded document text, may be {@code null}
   * @return canonical text, empty for {@code null} or blank input
   */
  public String normalize(String rawText) {
    if (rawText == null || rawText.isEmpty()) {
      return "";
    }

    // Stripped before NFKC so marks around a removed character compose in this pass
    String text = CONTROL.matcher(rawText).replaceAll("");
    text = Normalizer.normalize(text, Normalizer.Form.NFKC);
    text = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFKC);
    text = LINE_BREAKS.matcher(text).replaceAll("\n");
    text = BULLETS.matcher(text).replaceAll("\n");
    text = DASHES.matcher(text).replaceAll("-");
    text = SPACES.matcher(text).replaceAll(" ");

    return Arrays.stream(text.split("\n"))
        .map(line -> MULTI_SPACE.matcher(line).replaceAll(" ").trim())
        .filter(line -> !line.isEmpty())
        .collect(Collectors.joining("\n"));
  }
}
