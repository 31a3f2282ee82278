package com.flamingo.ai.resumescreener.service.extraction;

import com.flamingo.ai.resumescreener.config.ScreeningConfig;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Estimates cumulative professional experience from date ranges in normalized text.
 *
 * <p>Recognized forms:
 *
 * <ul>
 *   <li>{@code jan 2019 - mar 2022}, {@code february 2021 to present}
 *   <li>{@code 01/2019 - 03/2022}
 *   <li>{@code 2018 - 2021}, {@code 2020 - current}
 * </ul>
 *
 * <p>Month-precision ranges run from the first day of the start month to the first day of the end
 * month. Year-only ranges run from January 1 to December 31. Open ends ("present", "now",
 * "current", "today") resolve to the processing date, and no range extends past it. Ranges are
 * merged into a union before summing, so a role listed twice is only counted once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExperienceExtractor {

  static final double DAYS_PER_YEAR = 365.25;

  private static final String MONTH_NAME =
      "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
          + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";
  private static final String YEAR = "((?:19|20)\\d{2})";
  private static final String OPEN_END = "(present|now|current|today)";
  private static final String SEPARATOR = "\\s*(?:-|to|until)\\s*";

  private static final Pattern MONTH_NAME_RANGE =
      Pattern.compile(
          "\\b"
              + MONTH_NAME
              + "\\s+"
              + YEAR
              + SEPARATOR
              + "(?:"
              + MONTH_NAME
              + "\\s+"
              + YEAR
              + "|"
              + OPEN_END
              + ")\\b");

  private static final Pattern NUMERIC_MONTH_RANGE =
      Pattern.compile(
          "(?<![\\d/])(\\d{1,2})/"
              + YEAR
              + SEPARATOR
              + "(?:(\\d{1,2})/"
              + YEAR
              + "|"
              + OPEN_END
              + ")(?![\\d/])");

  private static final Pattern YEAR_RANGE =
      Pattern.compile("(?<!\\d)" + YEAR + SEPARATOR + "(?:" + YEAR + "|" + OPEN_END + ")(?!\\d)");

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("jan", 1),
          Map.entry("feb", 2),
          Map.entry("mar", 3),
          Map.entry("apr", 4),
          Map.entry("may", 5),
          Map.entry("jun", 6),
          Map.entry("jul", 7),
          Map.entry("aug", 8),
          Map.entry("sep", 9),
          Map.entry("oct", 10),
          Map.entry("nov", 11),
          Map.entry("dec", 12));

  private static final Set<String> OPEN_END_WORDS = Set.of("present", "now", "current", "today");

  private final Clock clock;
  private final ScreeningConfig screeningConfig;

  /** A closed date interval. */
  record DateRange(LocalDate start, LocalDate end) {

    long days() {
      return ChronoUnit.DAYS.between(start, end);
    }
  }

  /**
   * Sums the merged date ranges found in the text.
   *
   * @param text normalized text
   * @return experience in years rounded to one decimal, 0 if no range is present
   */
  public double extractYears(String text) {
    List<DateRange> ranges = findRanges(text);
    if (ranges.isEmpty()) {
      return 0.0;
    }

    long totalDays = mergeRanges(ranges).stream().mapToLong(DateRange::days).sum();
    double totalYears = totalDays / DAYS_PER_YEAR;
    double capped = Math.min(totalYears, screeningConfig.getExperience().getMaxYears());
    return Math.round(capped * 10.0) / 10.0;
  }

  /**
   * Finds all well-formed date ranges. Month-precision matches are blanked out before the
   * year-only scan so {@code mar 2019 - present} is not also read as {@code 2019 - present}.
   */
  List<DateRange> findRanges(String text) {
    List<DateRange> ranges = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return ranges;
    }
    LocalDate today = LocalDate.now(clock);
    StringBuilder remaining = new StringBuilder(text);

    Matcher named = MONTH_NAME_RANGE.matcher(text);
    while (named.find()) {
      LocalDate start = monthStart(MONTHS.get(named.group(1).substring(0, 3)), named.group(2));
      LocalDate end =
          named.group(5) != null
              ? today
              : monthStart(MONTHS.get(named.group(3).substring(0, 3)), named.group(4));
      addRange(ranges, start, end, today, named.group());
      blank(remaining, named.start(), named.end());
    }

    Matcher numeric = NUMERIC_MONTH_RANGE.matcher(remaining.toString());
    while (numeric.find()) {
      LocalDate start = monthStart(Integer.parseInt(numeric.group(1)), numeric.group(2));
      LocalDate end =
          numeric.group(5) != null
              ? today
              : monthStart(Integer.parseInt(numeric.group(3)), numeric.group(4));
      addRange(ranges, start, end, today, numeric.group());
      blank(remaining, numeric.start(), numeric.end());
    }

    Matcher years = YEAR_RANGE.matcher(remaining.toString());
    while (years.find()) {
      LocalDate start = LocalDate.of(Integer.parseInt(years.group(1)), 1, 1);
      LocalDate end =
          isOpenEnd(years.group(3))
              ? today
              : LocalDate.of(Integer.parseInt(years.group(2)), 12, 31);
      addRange(ranges, start, end, today, years.group());
    }

    return ranges;
  }

  /**
   * Merges overlapping or touching ranges into their union.
   *
   * @param ranges ranges in any order
   * @return disjoint ranges sorted by start
   */
  static List<DateRange> mergeRanges(List<DateRange> ranges) {
    List<DateRange> sorted = new ArrayList<>(ranges);
    sorted.sort(Comparator.comparing(DateRange::start));

    List<DateRange> merged = new ArrayList<>();
    for (DateRange current : sorted) {
      if (merged.isEmpty()) {
        merged.add(current);
        continue;
      }
      DateRange last = merged.get(merged.size() - 1);
      if (!current.start().isAfter(last.end())) {
        LocalDate end = current.end().isAfter(last.end()) ? current.end() : last.end();
        merged.set(merged.size() - 1, new DateRange(last.start(), end));
      } else {
        merged.add(current);
      }
    }
    return merged;
  }

  private void addRange(
      List<DateRange> ranges, LocalDate start, LocalDate end, LocalDate today, String source) {
    if (start == null || end == null) {
      log.debug("Ignoring unparseable date range '{}'", source);
      return;
    }
    if (end.isAfter(today)) {
      end = today;
    }
    if (end.isBefore(start)) {
      log.debug("Ignoring reversed or future date range '{}'", source);
      return;
    }
    ranges.add(new DateRange(start, end));
  }

  private LocalDate monthStart(Integer month, String year) {
    if (month == null) {
      return null;
    }
    try {
      return LocalDate.of(Integer.parseInt(year), month, 1);
    } catch (DateTimeException e) {
      return null;
    }
  }

  private static boolean isOpenEnd(String token) {
    return token != null && OPEN_END_WORDS.contains(token);
  }

  private static void blank(StringBuilder text, int start, int end) {
    for (int i = start; i < end; i++) {
      text.setCharAt(i, ' ');
    }
  }
}
