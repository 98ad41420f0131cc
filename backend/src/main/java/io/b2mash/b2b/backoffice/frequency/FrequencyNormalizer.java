package io.b2mash.b2b.backoffice.frequency;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps free-text frequency labels (Norwegian, English, historical misspellings) onto {@link
 * TaskFrequency}. Total over its input: unknown labels fall back to {@link TaskFrequency#MONTHLY}.
 */
public final class FrequencyNormalizer {

  public static final TaskFrequency FALLBACK = TaskFrequency.MONTHLY;

  private static final Map<String, TaskFrequency> NORWEGIAN =
      Map.ofEntries(
          Map.entry("daglig", TaskFrequency.DAILY),
          Map.entry("ukentlig", TaskFrequency.WEEKLY),
          Map.entry("månedlig", TaskFrequency.MONTHLY),
          Map.entry("maanedlig", TaskFrequency.MONTHLY),
          Map.entry("mnd", TaskFrequency.MONTHLY),
          Map.entry("annenhver måned", TaskFrequency.BI_MONTHLY),
          Map.entry("annenhver mnd", TaskFrequency.BI_MONTHLY),
          Map.entry("2 hver mnd", TaskFrequency.BI_MONTHLY),
          // historical misspelling still present in imported data
          Map.entry("2 vær mnd", TaskFrequency.BI_MONTHLY),
          Map.entry("kvartalsvis", TaskFrequency.QUARTERLY),
          Map.entry("årlig", TaskFrequency.YEARLY),
          Map.entry("aarlig", TaskFrequency.YEARLY),
          Map.entry("engangs", TaskFrequency.ONCE),
          Map.entry("engang", TaskFrequency.ONCE),
          Map.entry("spesifikk dato", TaskFrequency.ONCE),
          Map.entry("bestemt dato", TaskFrequency.ONCE),
          Map.entry("løpende", TaskFrequency.DAILY));

  private static final Map<String, TaskFrequency> ENGLISH_ALIASES =
      Map.ofEntries(
          Map.entry("daily", TaskFrequency.DAILY),
          Map.entry("day", TaskFrequency.DAILY),
          Map.entry("weekly", TaskFrequency.WEEKLY),
          Map.entry("week", TaskFrequency.WEEKLY),
          Map.entry("monthly", TaskFrequency.MONTHLY),
          Map.entry("month", TaskFrequency.MONTHLY),
          Map.entry("bi-monthly", TaskFrequency.BI_MONTHLY),
          Map.entry("bimonthly", TaskFrequency.BI_MONTHLY),
          Map.entry("quarterly", TaskFrequency.QUARTERLY),
          Map.entry("yearly", TaskFrequency.YEARLY),
          Map.entry("annual", TaskFrequency.YEARLY),
          Map.entry("once", TaskFrequency.ONCE),
          // former name of ONCE
          Map.entry("specific_date", TaskFrequency.ONCE));

  private static final Pattern EVERY_OTHER_MONTH = Pattern.compile("(2|annenhver).*(mån|mnd)");

  private FrequencyNormalizer() {}

  /** Normalizes any label to a canonical frequency. Never throws; null counts as empty. */
  public static TaskFrequency normalize(String label) {
    return match(label).orElse(FALLBACK);
  }

  /** Database enum value of the normalized label, e.g. {@code "2 hver mnd"} to BI_MONTHLY. */
  public static String toDbValue(String label) {
    return normalize(label).name();
  }

  /** Returns false when {@link #normalize(String)} would only return the fallback. */
  public static boolean isRecognized(String label) {
    return match(label).isPresent();
  }

  private static Optional<TaskFrequency> match(String label) {
    String key = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);

    var norwegian = NORWEGIAN.get(key);
    if (norwegian != null) {
      return Optional.of(norwegian);
    }
    var english = ENGLISH_ALIASES.get(key);
    if (english != null) {
      return Optional.of(english);
    }
    if (EVERY_OTHER_MONTH.matcher(key).find()) {
      return Optional.of(TaskFrequency.BI_MONTHLY);
    }
    return Optional.empty();
  }
}
