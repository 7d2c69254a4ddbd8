package planner.model;

import org.junit.Before;
import org.junit.Test;
import planner.TestConfigs;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;

/**
 * Tests {@link Schedule}
 */
public final class ScheduleTest {
    private Config config;

    @Before
    public void setUp() {
        config = TestConfigs.twoSequentialPapers();
    }

    @Test
    public void endDatesComeFromDurations() {
        Map<String, LocalDate> starts = new LinkedHashMap<>();
        starts.put("P1", d("2024-06-01"));
        starts.put("P2", d("2024-08-30"));
        Schedule s = Schedule.fromStartDates(starts, config);

        assertEquals(new Interval(d("2024-06-01"), d("2024-08-30")), s.getInterval("P1").get());
        assertEquals(d("2024-11-28"), s.getInterval("P2").get().getEndDate());
        assertEquals(d("2024-06-01"), s.startDate().get());
        assertEquals(d("2024-11-28"), s.endDate().get());
        assertEquals(180, s.calculateDurationDays());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownSubmissionIsRejected() {
        Schedule.fromStartDates(Map.of("nope", d("2025-01-01")), config);
    }

    @Test(expected = IllegalArgumentException.class)
    public void intervalShorterThanTheSubmissionIsRejected() {
        Schedule.of(Map.of("P1", new Interval(d("2024-06-01"), d("2024-06-02"))), config);
    }

    @Test
    public void intervalsOfTheRightLengthAreCopied() {
        Interval p1 = Interval.of(config.getSubmission("P1").get(), d("2024-06-01"), config);
        Schedule s = Schedule.of(Map.of("P1", p1), config);
        assertEquals(Schedule.fromStartDates(Map.of("P1", d("2024-06-01")), config), s);
    }

    @Test
    public void emptySchedule() {
        Schedule s = Schedule.empty();
        assertTrue(s.isEmpty());
        assertEquals(0, s.calculateDurationDays());
        assertFalse(s.startDate().isPresent());
    }

    @Test
    public void intervalsAreHalfOpen() {
        Interval a = new Interval(d("2025-01-01"), d("2025-01-11"));
        Interval b = new Interval(d("2025-01-11"), d("2025-01-20"));
        assertFalse(a.overlaps(b));
        assertTrue(a.covers(d("2025-01-10")));
        assertFalse(a.covers(d("2025-01-11")));
        assertTrue(a.overlaps(new Interval(d("2025-01-10"), d("2025-01-12"))));
        assertEquals(10, a.getDurationDays());
    }

    @Test(expected = IllegalArgumentException.class)
    public void intervalMustNotEndBeforeItStarts() {
        new Interval(d("2025-01-02"), d("2025-01-01"));
    }
}
