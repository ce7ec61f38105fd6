package com.sitewatch.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleSpecTest {
    @Test
    void intervalFormParsesSeconds() {
        ScheduleSpec spec = ScheduleSpec.parse("interval:10");

        ScheduleSpec.Interval interval = assertInstanceOf(ScheduleSpec.Interval.class, spec);
        assertEquals(10, interval.seconds());
        assertEquals("interval:10", interval.expression());
    }

    @Test
    void cronFormKeepsAllFiveFields() {
        ScheduleSpec spec = ScheduleSpec.parse("  */5 9-17 1 * MON-FRI ");

        ScheduleSpec.Cron cron = assertInstanceOf(ScheduleSpec.Cron.class, spec);
        assertEquals("*/5", cron.minute());
        assertEquals("9-17", cron.hour());
        assertEquals("1", cron.dayOfMonth());
        assertEquals("*", cron.month());
        assertEquals("MON-FRI", cron.dayOfWeek());
        assertTrue(cron.restrictsBothDayFields());
        assertEquals("*/5 9-17 1 * MON-FRI", cron.expression());
    }

    @Test
    void everyMinuteCronRestrictsNoDayField() {
        ScheduleSpec.Cron cron = (ScheduleSpec.Cron) ScheduleSpec.parse("* * * * *");

        assertFalse(cron.restrictsBothDayFields());
        assertFalse(cron.withDayOfMonth("15").restrictsBothDayFields());
        assertTrue(cron.withDayOfMonth("15").withDayOfWeek("1").restrictsBothDayFields());
    }

    @Test
    void steppedWildcardDayFieldIsNotARestriction() {
        ScheduleSpec.Cron stepped = (ScheduleSpec.Cron) ScheduleSpec.parse("0 0 */2 * 1");

        assertFalse(stepped.restrictsBothDayFields());
        assertFalse(stepped.withDayOfMonth("1-15").withDayOfWeek("*/3").restrictsBothDayFields());
        assertTrue(stepped.withDayOfMonth("1-15").restrictsBothDayFields());
    }

    @Test
    void malformedSchedulesAreRejected() {
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse(null));
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse(" "));
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse("interval:0"));
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse("interval:-5"));
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse("interval:ten"));
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse("interval:99999999999999999999"));
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse("*/5 * * *"));
        assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse("0 0 * * * 2026"));
    }

    @Test
    void parseErrorCarriesOffendingSchedule() {
        ScheduleParseException ex = assertThrows(ScheduleParseException.class, () -> ScheduleSpec.parse("1 2 3"));

        assertEquals("1 2 3", ex.schedule());
        assertTrue(ex.getMessage().contains("5 fields"));
    }
}
