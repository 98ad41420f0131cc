package io.b2mash.b2b.backoffice.frequency;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canonical recurrence vocabulary shared by the front end ({@link #code()}) and the database
 * ({@link #name()}).
 */
public enum TaskFrequency {
  DAILY("daily", "Daglig"),
  WEEKLY("weekly", "Ukentlig"),
  MONTHLY("monthly", "Månedlig"),
  BI_MONTHLY("bi-monthly", "Annenhver måned"),
  QUARTERLY("quarterly", "Kvartalsvis"),
  YEARLY("yearly", "Årlig"),
  ONCE("once", "Engangs");

  private static final Map<String, TaskFrequency> BY_CODE =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(TaskFrequency::code, Function.identity()));

  private final String code;
  private final String displayName;

  TaskFrequency(String code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  public String code() {
    return code;
  }

  public String displayName() {
    return displayName;
  }

  /** Returns true for every frequency that produces more than one occurrence. */
  public boolean isRecurring() {
    return this != ONCE;
  }

  /**
   * Exact lookup by front-end code. Use {@link FrequencyNormalizer#normalize(String)} for
   * user-entered labels.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static TaskFrequency fromCode(String code) {
    var frequency = code != null ? BY_CODE.get(code) : null;
    if (frequency == null) {
      throw new IllegalArgumentException("Unknown frequency code: " + code);
    }
    return frequency;
  }

  /**
   * Exact lookup by database enum value.
   *
   * @throws IllegalArgumentException if the value is unknown
   */
  public static TaskFrequency fromDbValue(String dbValue) {
    if (dbValue == null) {
      throw new IllegalArgumentException("Unknown frequency db value: null");
    }
    try {
      return valueOf(dbValue);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown frequency db value: " + dbValue, e);
    }
  }
}
