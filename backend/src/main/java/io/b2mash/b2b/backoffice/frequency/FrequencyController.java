package io.b2mash.b2b.backoffice.frequency;

import io.b2mash.b2b.backoffice.frequency.dto.FrequencyResponse;
import io.b2mash.b2b.backoffice.frequency.dto.NextOccurrenceResponse;
import io.b2mash.b2b.backoffice.frequency.dto.NormalizedFrequencyResponse;
import io.b2mash.b2b.backoffice.frequency.dto.UpcomingOccurrencesResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/frequencies")
public class FrequencyController {

  private final FrequencyService frequencyService;

  public FrequencyController(FrequencyService frequencyService) {
    this.frequencyService = frequencyService;
  }

  @GetMapping
  public ResponseEntity<List<FrequencyResponse>> listFrequencies() {
    return ResponseEntity.ok(frequencyService.listFrequencies());
  }

  @GetMapping("/{value}")
  public ResponseEntity<FrequencyResponse> getFrequency(@PathVariable String value) {
    return ResponseEntity.ok(frequencyService.getFrequency(value));
  }

  @GetMapping("/normalize")
  public ResponseEntity<NormalizedFrequencyResponse> normalize(
      @RequestParam(defaultValue = "") String label) {
    return ResponseEntity.ok(frequencyService.describe(label));
  }

  @GetMapping("/next-occurrence")
  public ResponseEntity<NextOccurrenceResponse> nextOccurrence(
      @RequestParam String frequency,
      @RequestParam(required = false) String startDate,
      @RequestParam(required = false) String fromDate) {
    return ResponseEntity.ok(frequencyService.nextOccurrence(frequency, startDate, fromDate));
  }

  @GetMapping("/upcoming")
  public ResponseEntity<UpcomingOccurrencesResponse> upcoming(
      @RequestParam String frequency,
      @RequestParam(required = false) String startDate,
      @RequestParam(required = false) String fromDate,
      @RequestParam(defaultValue = "5") int count) {
    return ResponseEntity.ok(frequencyService.upcoming(frequency, startDate, fromDate, count));
  }
}
