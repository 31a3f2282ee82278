package com.flamingo.ai.resumescreener.service.extraction;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds email addresses and phone numbers by shape. Numbers that merely look like phones (for
 * example a {@code 2018-2021} year span) are kept; a recruiter reviews contacts visually.
 */
@Component
public class ContactExtractor {

  private static final Pattern EMAIL =
      Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}", Pattern.CASE_INSENSITIVE);

  // Spaces only, not \s: a phone number never spans two lines
  private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d ().-]{7,}\\d");

  public List<String> extractEmails(String text) {
    return distinctMatches(EMAIL, text);
  }

  public List<String> extractPhones(String text) {
    return distinctMatches(PHONE, text);
  }

  private List<String> distinctMatches(Pattern pattern, String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      found.add(matcher.group().trim());
    }
    return List.copyOf(found);
  }
}
