package io.b2mash.b2b.backoffice.frequency;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** Parsing and validation of schedule date arguments. */
public final class ScheduleDates {

  private ScheduleDates() {}

  /**
   * Parses an ISO-8601 calendar date.
   *
   * @throws InvalidScheduleDateException if the value is null, blank or not a valid date
   */
  public static LocalDate parse(String argument, String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidScheduleDateException(argument, value);
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new InvalidScheduleDateException(argument, value, e);
    }
  }

  /** Same as {@link #parse(String, String)} but returns the fallback for a null or blank value. */
  public static LocalDate parseOrDefault(String argument, String value, LocalDate fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return parse(argument, value);
  }

  static LocalDate require(String argument, LocalDate value) {
    if (value == null) {
      throw new InvalidScheduleDateException(argument, null);
    }
    return value;
  }
}
