package io.b2mash.b2b.backoffice.frequency.dto;

import io.b2mash.b2b.backoffice.frequency.TaskFrequency;

public record FrequencyResponse(String code, String dbValue, String displayName) {

  public static FrequencyResponse from(TaskFrequency frequency) {
    return new FrequencyResponse(frequency.code(), frequency.name(), frequency.displayName());
  }
}
