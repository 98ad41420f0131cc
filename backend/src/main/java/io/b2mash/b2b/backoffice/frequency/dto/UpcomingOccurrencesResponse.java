package io.b2mash.b2b.backoffice.frequency.dto;

import java.time.LocalDate;
import java.util.List;

public record UpcomingOccurrencesResponse(
    String frequency, LocalDate startDate, LocalDate fromDate, List<LocalDate> dates) {}
