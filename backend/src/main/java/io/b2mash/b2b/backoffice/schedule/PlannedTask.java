package io.b2mash.b2b.backoffice.schedule;

import io.b2mash.b2b.backoffice.frequency.TaskFrequency;
import java.time.LocalDate;

/**
 * Result of planning one recurring task.
 *
 * @param createInstance whether a task instance should be created for {@code dueDate}
 * @param title instance title
 * @param description instance description
 * @param frequency normalized frequency
 * @param dueDate due date of the instance
 * @param followingDueDate due date to store on the recurring task afterwards
 * @param finalInstance true when the recurring task should be deactivated afterwards (ONCE)
 */
public record PlannedTask(
    boolean createInstance,
    String title,
    String description,
    TaskFrequency frequency,
    LocalDate dueDate,
    LocalDate followingDueDate,
    boolean finalInstance) {}
