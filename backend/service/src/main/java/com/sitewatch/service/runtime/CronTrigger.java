package com.sitewatch.service.runtime;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.sitewatch.core.model.ScheduleParseException;
import com.sitewatch.core.model.ScheduleSpec;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Next fire times of a five-field cron schedule in a fixed zone. When day-of-month and
 * day-of-week are both restricted a day matches if either field matches, so the expression is
 * split into one schedule per day field and the earlier next time wins.
 */
public final class CronTrigger {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final ScheduleSpec.Cron spec;
    private final ZoneId zone;
    private final List<ExecutionTime> executionTimes;

    private CronTrigger(ScheduleSpec.Cron spec, ZoneId zone, List<ExecutionTime> executionTimes) {
        this.spec = spec;
        this.zone = zone;
        this.executionTimes = executionTimes;
    }

    /** @throws ScheduleParseException when a field is not valid cron syntax */
    public static CronTrigger of(ScheduleSpec.Cron spec, ZoneId zone) {
        Objects.requireNonNull(spec, "spec is required");
        Objects.requireNonNull(zone, "zone is required");
        ExecutionTime whole = executionTime(spec);
        List<ExecutionTime> executionTimes = spec.restrictsBothDayFields()
                ? List.of(executionTime(spec.withDayOfWeek(ScheduleSpec.ANY)), executionTime(spec.withDayOfMonth(ScheduleSpec.ANY)))
                : List.of(whole);
        return new CronTrigger(spec, zone, executionTimes);
    }

    public static CronTrigger parse(String expression, ZoneId zone) {
        ScheduleSpec parsed = ScheduleSpec.parse(expression);
        if (!(parsed instanceof ScheduleSpec.Cron cron)) {
            throw new ScheduleParseException(expression, "Not a cron schedule: " + expression);
        }
        return of(cron, zone);
    }

    /**
     * First fire time strictly after {@code reference}, or empty when the expression can never
     * match again (for example the 30th of February).
     */
    public Optional<Instant> nextAfter(Instant reference) {
        ZonedDateTime base = reference.atZone(zone);
        Instant earliest = null;
        for (ExecutionTime executionTime : executionTimes) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(base);
            if (next.isPresent() && !next.get().isAfter(base)) {
                next = executionTime.nextExecution(base.plusSeconds(1));
            }
            if (next.isPresent() && (earliest == null || next.get().toInstant().isBefore(earliest))) {
                earliest = next.get().toInstant();
            }
        }
        return Optional.ofNullable(earliest);
    }

    public String expression() {
        return spec.expression();
    }

    public ZoneId zone() {
        return zone;
    }

    private static ExecutionTime executionTime(ScheduleSpec.Cron cron) {
        try {
            return ExecutionTime.forCron(PARSER.parse(cron.expression()));
        } catch (RuntimeException e) {
            throw new ScheduleParseException(cron.expression(), "Invalid cron schedule '" + cron.expression() + "': " + e.getMessage(), e);
        }
    }
}
