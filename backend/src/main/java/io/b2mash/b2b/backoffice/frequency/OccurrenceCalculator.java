package io.b2mash.b2b.backoffice.frequency;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Computes the next due date of a recurring task. Occurrences are anchored on the start date's
 * weekday (WEEKLY), day-of-month (MONTHLY, BI_MONTHLY, QUARTERLY) or month and day (YEARLY).
 *
 * <p>A day-of-month that does not exist in the target month rolls over into the following month
 * instead of being clamped: day 31 anchored into February 2025 yields March 3. QUARTERLY re-applies
 * the anchor day once in the month it rolled into, so the same anchor yields March 31.
 */
@Component
public class OccurrenceCalculator {

  /**
   * Returns the next occurrence relative to {@code fromDate}.
   *
   * <ul>
   *   <li>ONCE always returns {@code startDate}; detecting an expired one-off task is up to the
   *       caller.
   *   <li>Every other frequency returns {@code startDate} itself while it lies after {@code
   *       fromDate}, and otherwise the first anchored date strictly after {@code fromDate}.
   * </ul>
   *
   * @throws InvalidScheduleDateException if either date is null, or the next occurrence would lie
   *     beyond the supported date range
   */
  public LocalDate nextOccurrence(
      TaskFrequency frequency, LocalDate startDate, LocalDate fromDate) {
    if (frequency == null) {
      throw new IllegalArgumentException("Frequency must not be null");
    }
    ScheduleDates.require("startDate", startDate);
    ScheduleDates.require("fromDate", fromDate);

    if (frequency == TaskFrequency.ONCE) {
      return startDate;
    }
    if (startDate.isAfter(fromDate)) {
      return startDate;
    }

    try {
      return switch (frequency) {
        case DAILY -> fromDate.plusDays(1);
        case WEEKLY -> fromDate.with(TemporalAdjusters.next(startDate.getDayOfWeek()));
        case MONTHLY -> advancePast(monthCandidate(startDate, fromDate), fromDate, 1);
        case BI_MONTHLY -> advancePast(monthCandidate(startDate, fromDate), fromDate, 2);
        case QUARTERLY -> advancePast(quarterCandidate(startDate, fromDate), fromDate, 3);
        case YEARLY -> advancePast(yearCandidate(startDate, fromDate), fromDate, 12);
        case ONCE -> startDate;
      };
    } catch (DateTimeException e) {
      throw InvalidScheduleDateException.outOfRange("fromDate", fromDate.toString(), e);
    }
  }

  /**
   * Returns the next {@code count} occurrences, each computed from the previous one. A ONCE
   * frequency yields a single date.
   */
  public List<LocalDate> upcoming(
      TaskFrequency frequency, LocalDate startDate, LocalDate fromDate, int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Count must be >= 1, got: " + count);
    }
    var dates = new ArrayList<LocalDate>(count);
    LocalDate reference = fromDate;
    while (dates.size() < count) {
      LocalDate next = nextOccurrence(frequency, startDate, reference);
      dates.add(next);
      if (!frequency.isRecurring()) {
        break;
      }
      reference = next;
    }
    return List.copyOf(dates);
  }

  private static LocalDate monthCandidate(LocalDate startDate, LocalDate fromDate) {
    return onDay(fromDate.withDayOfMonth(1), startDate.getDayOfMonth());
  }

  /**
   * Like {@link #monthCandidate} but an overflowed anchor day is applied once more in the month it
   * rolled into, so day 31 from April lands on May 31 rather than May 1.
   */
  private static LocalDate quarterCandidate(LocalDate startDate, LocalDate fromDate) {
    LocalDate candidate = monthCandidate(startDate, fromDate);
    if (candidate.getDayOfMonth() != startDate.getDayOfMonth()) {
      candidate = onDay(candidate.withDayOfMonth(1), startDate.getDayOfMonth());
    }
    return candidate;
  }

  private static LocalDate yearCandidate(LocalDate startDate, LocalDate fromDate) {
    return onDay(
        LocalDate.of(fromDate.getYear(), startDate.getMonth(), 1), startDate.getDayOfMonth());
  }

  private static LocalDate advancePast(LocalDate candidate, LocalDate fromDate, int stepMonths) {
    LocalDate result = candidate;
    while (!result.isAfter(fromDate)) {
      result = plusMonthsRolling(result, stepMonths);
    }
    return result;
  }

  /** Adds months keeping the day-of-month, rolling over when the target month is shorter. */
  static LocalDate plusMonthsRolling(LocalDate date, long months) {
    return onDay(date.withDayOfMonth(1).plusMonths(months), date.getDayOfMonth());
  }

  private static LocalDate onDay(LocalDate firstOfMonth, int dayOfMonth) {
    return firstOfMonth.plusDays(dayOfMonth - 1L);
  }
}
