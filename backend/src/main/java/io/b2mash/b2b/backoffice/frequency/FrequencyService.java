package io.b2mash.b2b.backoffice.frequency;

import io.b2mash.b2b.backoffice.config.SchedulingProperties;
import io.b2mash.b2b.backoffice.exception.InvalidStateException;
import io.b2mash.b2b.backoffice.exception.ResourceNotFoundException;
import io.b2mash.b2b.backoffice.frequency.dto.FrequencyResponse;
import io.b2mash.b2b.backoffice.frequency.dto.NextOccurrenceResponse;
import io.b2mash.b2b.backoffice.frequency.dto.NormalizedFrequencyResponse;
import io.b2mash.b2b.backoffice.frequency.dto.UpcomingOccurrencesResponse;
import io.b2mash.b2b.backoffice.schedule.DueStatusClassifier;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FrequencyService {

  private static final Logger log = LoggerFactory.getLogger(FrequencyService.class);

  private final OccurrenceCalculator occurrenceCalculator;
  private final DueStatusClassifier dueStatusClassifier;
  private final Clock clock;
  private final SchedulingProperties properties;

  public FrequencyService(
      OccurrenceCalculator occurrenceCalculator,
      DueStatusClassifier dueStatusClassifier,
      Clock clock,
      SchedulingProperties properties) {
    this.occurrenceCalculator = occurrenceCalculator;
    this.dueStatusClassifier = dueStatusClassifier;
    this.clock = clock;
    this.properties = properties;
  }

  /** Today's calendar date in the configured zone. */
  public LocalDate today() {
    return LocalDate.now(clock.withZone(properties.zone()));
  }

  public List<FrequencyResponse> listFrequencies() {
    return Arrays.stream(TaskFrequency.values()).map(FrequencyResponse::from).toList();
  }

  /**
   * Exact lookup by front-end code ({@code bi-monthly}) or database value ({@code BI_MONTHLY}).
   * Free-text labels are not normalized here.
   *
   * @throws ResourceNotFoundException if the value is neither
   */
  public FrequencyResponse getFrequency(String value) {
    try {
      var frequency =
          value.equals(value.toUpperCase(Locale.ROOT))
              ? TaskFrequency.fromDbValue(value)
              : TaskFrequency.fromCode(value);
      return FrequencyResponse.from(frequency);
    } catch (IllegalArgumentException e) {
      throw new ResourceNotFoundException("Frequency", value);
    }
  }

  /** Normalizes a label, logging labels that only matched the fallback. */
  public TaskFrequency normalize(String label) {
    var frequency = FrequencyNormalizer.normalize(label);
    if (!FrequencyNormalizer.isRecognized(label)) {
      log.warn("Unrecognized frequency label, defaulting to {}: label='{}'", frequency, label);
    }
    return frequency;
  }

  public NormalizedFrequencyResponse describe(String label) {
    var frequency = normalize(label);
    return new NormalizedFrequencyResponse(
        label,
        frequency.code(),
        frequency.name(),
        frequency.displayName(),
        FrequencyNormalizer.isRecognized(label));
  }

  /** Next occurrence relative to today. */
  public LocalDate nextOccurrence(TaskFrequency frequency, LocalDate startDate) {
    return occurrenceCalculator.nextOccurrence(frequency, startDate, today());
  }

  /**
   * Next occurrence for a free-text frequency label and ISO date strings. A missing {@code
   * fromDate} means today.
   *
   * @throws InvalidScheduleDateException if a date cannot be parsed
   */
  public NextOccurrenceResponse nextOccurrence(String label, String startDate, String fromDate) {
    LocalDate today = today();
    LocalDate start = ScheduleDates.parse("startDate", startDate);
    LocalDate from = ScheduleDates.parseOrDefault("fromDate", fromDate, today);
    var frequency = normalize(label);

    LocalDate next = occurrenceCalculator.nextOccurrence(frequency, start, from);
    var dueStatus = dueStatusClassifier.classify(frequency, next, today);
    log.debug(
        "Calculated next occurrence: frequency={}, startDate={}, fromDate={}, next={}",
        frequency,
        start,
        from,
        next);
    return new NextOccurrenceResponse(
        frequency.code(), start, from, next, dueStatus.name(), dueStatus.requiresAttention());
  }

  /**
   * Preview of the next {@code count} occurrences.
   *
   * @throws InvalidStateException if count is outside 1..previewLimit
   */
  public UpcomingOccurrencesResponse upcoming(
      String label, String startDate, String fromDate, int count) {
    if (count < 1 || count > properties.previewLimit()) {
      throw new InvalidStateException(
          "Invalid preview count",
          "Count must be between 1 and " + properties.previewLimit() + ", got " + count);
    }
    LocalDate start = ScheduleDates.parse("startDate", startDate);
    LocalDate from = ScheduleDates.parseOrDefault("fromDate", fromDate, today());
    var frequency = normalize(label);

    var dates = occurrenceCalculator.upcoming(frequency, start, from, count);
    return new UpcomingOccurrencesResponse(frequency.code(), start, from, dates);
  }
}
