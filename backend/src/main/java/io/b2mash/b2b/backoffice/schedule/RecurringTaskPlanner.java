package io.b2mash.b2b.backoffice.schedule;

import io.b2mash.b2b.backoffice.frequency.FrequencyNormalizer;
import io.b2mash.b2b.backoffice.frequency.OccurrenceCalculator;
import io.b2mash.b2b.backoffice.frequency.TaskFrequency;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides, for one recurring client task, whether a task instance is due and which due date the
 * recurring task moves on to. The persisting job calls this once per recurring task per run.
 *
 * <p>Re-runs are idempotent: a due date that already has an instance only advances the recurring
 * task.
 */
@Component
public class RecurringTaskPlanner {

  private static final Logger log = LoggerFactory.getLogger(RecurringTaskPlanner.class);

  static final String DEFAULT_DESCRIPTION_PREFIX = "Gjentagende oppgave: ";

  private final OccurrenceCalculator occurrenceCalculator;

  public RecurringTaskPlanner(OccurrenceCalculator occurrenceCalculator) {
    this.occurrenceCalculator = occurrenceCalculator;
  }

  /**
   * Plans the next instance of {@code task}.
   *
   * @param today the reference date of this run
   * @param existingDueDates due dates that already have an instance for this task
   * @return empty when the task is not yet due
   */
  public Optional<PlannedTask> plan(
      RecurringTask task, LocalDate today, Set<LocalDate> existingDueDates) {
    if (task.startDate() == null) {
      log.warn("Skipping recurring task without start date: name={}", task.name());
      return Optional.empty();
    }

    TaskFrequency frequency = FrequencyNormalizer.normalize(task.frequencyLabel());
    if (!FrequencyNormalizer.isRecognized(task.frequencyLabel())) {
      log.warn(
          "Unrecognized frequency on recurring task, using {}: name={}, label={}",
          frequency,
          task.name(),
          task.frequencyLabel());
    }

    LocalDate dueDate = task.dueDate() != null ? task.dueDate() : task.startDate();
    if (dueDate.isAfter(today)) {
      return Optional.empty();
    }

    LocalDate following =
        occurrenceCalculator.nextOccurrence(frequency, task.startDate(), dueDate);
    boolean alreadyCreated = existingDueDates.contains(dueDate);
    if (alreadyCreated) {
      log.debug("Instance already exists: name={}, dueDate={}", task.name(), dueDate);
    }

    String description =
        task.description() != null && !task.description().isBlank()
            ? task.description()
            : DEFAULT_DESCRIPTION_PREFIX + task.name();

    return Optional.of(
        new PlannedTask(
            !alreadyCreated,
            task.name(),
            description,
            frequency,
            dueDate,
            frequency.isRecurring() ? following : null,
            !frequency.isRecurring()));
  }
}
