package com.sitewatch.service.runtime;

import com.sitewatch.core.model.ScheduleParseException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronTriggerTest {
    @Test
    void stepMinutesFireOnTheNextBoundary() {
        CronTrigger trigger = CronTrigger.parse("*/15 * * * *", ZoneOffset.UTC);

        assertEquals(Instant.parse("2026-02-09T10:15:00Z"), next(trigger, "2026-02-09T10:07:30Z"));
    }

    @Test
    void allFiveFieldsAreHonoured() {
        CronTrigger trigger = CronTrigger.parse("0 9 * * 1-5", ZoneOffset.UTC);

        // Friday after 09:00 rolls over the weekend to Monday.
        assertEquals(Instant.parse("2026-02-16T09:00:00Z"), next(trigger, "2026-02-13T10:00:00Z"));
    }

    @Test
    void monthFieldRestrictsTheYear() {
        CronTrigger trigger = CronTrigger.parse("30 6 15 6 *", ZoneOffset.UTC);

        assertEquals(Instant.parse("2026-06-15T06:30:00Z"), next(trigger, "2026-02-09T00:00:00Z"));
    }

    @Test
    void nextTimeIsStrictlyAfterTheReference() {
        CronTrigger trigger = CronTrigger.parse("0 12 * * *", ZoneOffset.UTC);

        assertEquals(Instant.parse("2026-02-10T12:00:00Z"), next(trigger, "2026-02-09T12:00:00Z"));
    }

    @Test
    void restrictedDayFieldsAreOredTogether() {
        // Midnight on the 1st of the month, or any Monday.
        CronTrigger trigger = CronTrigger.parse("0 0 1 * 1", ZoneOffset.UTC);

        assertEquals(Instant.parse("2026-02-16T00:00:00Z"), next(trigger, "2026-02-10T12:00:00Z"));
        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), next(trigger, "2026-02-24T12:00:00Z"));
        assertEquals(Instant.parse("2026-03-02T00:00:00Z"), next(trigger, "2026-03-01T00:00:00Z"));
    }

    @Test
    void evaluatesInTheConfiguredZone() {
        CronTrigger trigger = CronTrigger.parse("0 9 * * *", ZoneId.of("America/New_York"));

        assertEquals(Instant.parse("2026-02-09T14:00:00Z"), next(trigger, "2026-02-09T12:00:00Z"));
    }

    @Test
    void malformedExpressionsAreRejected() {
        assertThrows(ScheduleParseException.class, () -> CronTrigger.parse("61 * * * *", ZoneOffset.UTC));
        assertThrows(ScheduleParseException.class, () -> CronTrigger.parse("* * * *", ZoneOffset.UTC));
        assertThrows(ScheduleParseException.class, () -> CronTrigger.parse("every minute", ZoneOffset.UTC));
        assertThrows(ScheduleParseException.class, () -> CronTrigger.parse("interval:10", ZoneOffset.UTC));
    }

    private static Instant next(CronTrigger trigger, String reference) {
        return trigger.nextAfter(Instant.parse(reference)).orElseThrow();
    }
}
