package planner.validation;

import org.junit.Test;
import planner.TestConfigs;
import planner.constraints.Candidate;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;

/**
 * Tests {@link ResourceValidator}
 */
public final class ResourceValidatorTest {

    private static Config limit(int n) {
        return Config.builder().maxConcurrentSubmissions(n).build();
    }

    @Test
    public void sweepMatchesDayByDayCount() {
        Random random = new Random(3);
        LocalDate origin = d("2025-01-01");
        for (int round = 0; round < 20; round++) {
            Map<String, Interval> intervals = new LinkedHashMap<>();
            for (int i = 0; i < 12; i++) {
                LocalDate start = origin.plusDays(random.nextInt(200));
                intervals.put("s" + i, new Interval(start, start.plusDays(1 + random.nextInt(60))));
            }

            TreeMap<LocalDate, Integer> brute = new TreeMap<>();
            for (Interval iv : intervals.values()) {
                for (LocalDate day = iv.getStartDate(); day.isBefore(iv.getEndDate()); day = day.plusDays(1)) {
                    brute.merge(day, 1, Integer::sum);
                }
            }

            LoadProfile profile = ResourceValidator.sweep(intervals);
            assertEquals(brute, new TreeMap<>(profile.toDailyLoad()));
            assertEquals(brute.size(), profile.getActiveDays());
            assertEquals(brute.values().stream().mapToInt(Integer::intValue).max().getAsInt(), profile.getPeakLoad());

            int cap = 3;
            long overDays = brute.values().stream().filter(load -> load > cap).count();
            ScheduleView view = () -> intervals;
            assertEquals(overDays, new ResourceValidator().validate(view, limit(cap)).getViolations().size());
        }
    }

    @Test
    public void backToBackIntervalsDoNotOverlap() {
        Map<String, Interval> intervals = new LinkedHashMap<>();
        intervals.put("a", new Interval(d("2025-01-01"), d("2025-01-11")));
        intervals.put("b", new Interval(d("2025-01-11"), d("2025-01-21")));
        ScheduleView view = () -> intervals;
        ValidationResult r = new ResourceValidator().validate(view, limit(1));
        assertTrue(r.isValid());
        assertEquals(20, r.getTotal());
        assertEquals(1, r.getMetadata().get("max_concurrent"));
    }

    @Test
    public void oneViolationPerOverloadedDay() {
        Map<String, Interval> intervals = new LinkedHashMap<>();
        intervals.put("a", new Interval(d("2025-01-01"), d("2025-01-11")));
        intervals.put("b", new Interval(d("2025-01-08"), d("2025-01-20")));
        intervals.put("c", new Interval(d("2025-01-09"), d("2025-01-10")));
        ScheduleView view = () -> intervals;
        ValidationResult r = new ResourceValidator().validate(view, limit(1));

        // 01-08 and 01-10 carry two, 01-09 carries three
        assertEquals(3, r.getViolations().size());
        Violation peak = r.getViolations().get(1);
        assertEquals(d("2025-01-09"), peak.getDate().get());
        assertEquals(2, peak.getMagnitude());
        assertEquals("a, b, c", peak.getSubmissionId());
        assertEquals(Severity.HIGH, peak.getSeverity());
        assertEquals(Severity.MEDIUM, r.getViolations().get(0).getSeverity());
    }

    @Test
    public void oracleRespectsTheCap() {
        Config config = TestConfigs.twoSequentialPapers();
        PartialSchedule state = new PartialSchedule(config);
        state.place("P1", d("2024-06-01"));
        ResourceValidator validator = new ResourceValidator();
        assertFalse(validator.test(state, new Candidate("P2", d("2024-08-29"))));
        assertTrue(validator.test(state, new Candidate("P2", d("2024-08-30"))));
    }
}
