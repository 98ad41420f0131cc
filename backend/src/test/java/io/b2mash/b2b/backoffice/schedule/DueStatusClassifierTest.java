package io.b2mash.b2b.backoffice.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.backoffice.frequency.TaskFrequency;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class DueStatusClassifierTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 3, 12);

  private final DueStatusClassifier classifier = new DueStatusClassifier();

  @Test
  void pastRecurringOccurrence_isOverdue() {
    assertThat(classifier.classify(TaskFrequency.MONTHLY, TODAY.minusDays(1), TODAY))
        .isEqualTo(DueStatus.OVERDUE);
  }

  @Test
  void pastOneOffOccurrence_isExpired() {
    assertThat(classifier.classify(TaskFrequency.ONCE, TODAY.minusDays(1), TODAY))
        .isEqualTo(DueStatus.EXPIRED);
  }

  @Test
  void today_isDueToday() {
    assertThat(classifier.classify(TaskFrequency.ONCE, TODAY, TODAY))
        .isEqualTo(DueStatus.DUE_TODAY);
    assertThat(DueStatus.DUE_TODAY.requiresAttention()).isTrue();
  }

  @Test
  void laterThisMonth_isDueThisMonth() {
    assertThat(classifier.classify(TaskFrequency.WEEKLY, LocalDate.of(2024, 3, 31), TODAY))
        .isEqualTo(DueStatus.DUE_THIS_MONTH);
  }

  @Test
  void nextMonth_isUpcoming() {
    assertThat(classifier.classify(TaskFrequency.WEEKLY, LocalDate.of(2024, 4, 1), TODAY))
        .isEqualTo(DueStatus.UPCOMING);
    assertThat(DueStatus.UPCOMING.requiresAttention()).isFalse();
  }

  @Test
  void sameMonthOtherYear_isUpcoming() {
    assertThat(classifier.classify(TaskFrequency.YEARLY, LocalDate.of(2025, 3, 12), TODAY))
        .isEqualTo(DueStatus.UPCOMING);
  }

  @Test
  void nullOccurrence_throws() {
    assertThatThrownBy(() -> classifier.classify(TaskFrequency.DAILY, null, TODAY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sortByDueDate_soonestFirstAndUndatedLast() {
    var undated = new ScheduledOccurrence("MVA-melding", TaskFrequency.BI_MONTHLY, null);
    var late =
        new ScheduledOccurrence("Årsoppgjør", TaskFrequency.YEARLY, LocalDate.of(2024, 5, 31));
    var soon = new ScheduledOccurrence("Lønn", TaskFrequency.MONTHLY, LocalDate.of(2024, 3, 15));

    assertThat(classifier.sortByDueDate(List.of(undated, late, soon)))
        .containsExactly(soon, late, undated);
  }
}
