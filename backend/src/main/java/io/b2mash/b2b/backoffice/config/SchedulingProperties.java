package io.b2mash.b2b.backoffice.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for due date calculation.
 *
 * @param zone time zone that decides which calendar date "today" is
 * @param previewLimit maximum number of occurrences returned by one upcoming-dates preview
 */
@ConfigurationProperties(prefix = "scheduling")
public record SchedulingProperties(
    @DefaultValue("Europe/Oslo") ZoneId zone, @DefaultValue("24") int previewLimit) {}
