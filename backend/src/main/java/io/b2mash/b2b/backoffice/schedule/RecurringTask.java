package io.b2mash.b2b.backoffice.schedule;

import java.time.LocalDate;

/**
 * A recurring client task as stored by the task module.
 *
 * @param name task title given to every generated instance
 * @param description optional description copied to generated instances
 * @param frequencyLabel user-entered or imported frequency label, normalized on use
 * @param startDate first date the task is eligible
 * @param dueDate current due date; null until the first instance has been planned
 */
public record RecurringTask(
    String name,
    String description,
    String frequencyLabel,
    LocalDate startDate,
    LocalDate dueDate) {

  public RecurringTask {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Recurring task name must not be blank");
    }
  }
}
