package io.b2mash.b2b.backoffice.frequency.dto;

import java.time.LocalDate;

public record NextOccurrenceResponse(
    String frequency,
    LocalDate startDate,
    LocalDate fromDate,
    LocalDate nextOccurrence,
    String dueStatus,
    boolean requiresAttention) {}
