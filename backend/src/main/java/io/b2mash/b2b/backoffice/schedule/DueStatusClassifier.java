package io.b2mash.b2b.backoffice.schedule;

import io.b2mash.b2b.backoffice.frequency.TaskFrequency;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class DueStatusClassifier {

  private static final Comparator<ScheduledOccurrence> BY_DUE_DATE =
      Comparator.comparing(
          ScheduledOccurrence::dueDate, Comparator.nullsLast(Comparator.naturalOrder()));

  /**
   * Classifies an occurrence for display. A past ONCE occurrence is {@link DueStatus#EXPIRED}
   * rather than overdue, since it will never recur.
   */
  public DueStatus classify(TaskFrequency frequency, LocalDate occurrence, LocalDate today) {
    if (occurrence == null || today == null) {
      throw new IllegalArgumentException("Occurrence and today must not be null");
    }
    if (occurrence.isBefore(today)) {
      return frequency == TaskFrequency.ONCE ? DueStatus.EXPIRED : DueStatus.OVERDUE;
    }
    if (occurrence.isEqual(today)) {
      return DueStatus.DUE_TODAY;
    }
    if (YearMonth.from(occurrence).equals(YearMonth.from(today))) {
      return DueStatus.DUE_THIS_MONTH;
    }
    return DueStatus.UPCOMING;
  }

  /** Soonest first; entries without a due date go last. */
  public List<ScheduledOccurrence> sortByDueDate(List<ScheduledOccurrence> occurrences) {
    return occurrences.stream().sorted(BY_DUE_DATE).toList();
  }
}
