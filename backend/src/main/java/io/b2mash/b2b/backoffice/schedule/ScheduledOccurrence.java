package io.b2mash.b2b.backoffice.schedule;

import io.b2mash.b2b.backoffice.frequency.TaskFrequency;
import java.time.LocalDate;

/** A task title with its frequency and (possibly unknown) due date, as listed on the dashboard. */
public record ScheduledOccurrence(String title, TaskFrequency frequency, LocalDate dueDate) {}
