package io.b2mash.b2b.backoffice.frequency.dto;

public record NormalizedFrequencyResponse(
    String label, String frequency, String dbValue, String displayName, boolean recognized) {}
