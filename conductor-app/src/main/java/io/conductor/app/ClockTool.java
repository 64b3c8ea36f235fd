package io.conductor.app;

import io.conductor.core.tool.Tool;
import io.conductor.core.tool.ToolContext;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Built-in tool reporting the current date and time, so tool-augmented chat works without any
 * external backend.
 */
public final class ClockTool implements Tool {

    @Override
    public String name() {
        return "current_time";
    }

    @Override
    public String description() {
        return "Return the current date and time, optionally in a given IANA time zone";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "timezone", Map.of("type", "string", "description", "IANA zone id, e.g. Europe/Paris")
            )
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        Clock clock = context.service("clock", Clock.class);
        if (clock == null) {
            clock = Clock.systemUTC();
        }
        String zone = String.valueOf(input.getOrDefault("timezone", "UTC")).trim();
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone.isBlank() ? "UTC" : zone);
        } catch (DateTimeException e) {
            return "Error: unknown time zone " + zone;
        }
        return ZonedDateTime.now(clock.withZone(zoneId)).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
