package planner.validation;

import org.junit.Test;
import planner.TestConfigs;
import planner.model.Config;
import planner.model.Schedule;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;

/**
 * Tests {@link ScheduleConstraints}
 */
public final class ScheduleConstraintsTest {

    private static Schedule schedule(Config config, String p1, String p2) {
        Map<String, LocalDate> starts = new LinkedHashMap<>();
        starts.put("P1", d(p1));
        starts.put("P2", d(p2));
        return Schedule.fromStartDates(starts, config);
    }

    @Test
    public void everyFamilyIsReported() {
        Config config = TestConfigs.twoSequentialPapers();
        ValidationReport report = ScheduleConstraints.validateScheduleConstraints(
                schedule(config, "2024-06-01", "2024-08-30"), config);
        assertEquals(EnumSet.allOf(ConstraintFamily.class), report.getResults().keySet());
        assertTrue(report.toString(), report.isValid());
        assertEquals(100.0, report.getComplianceRate(), 1e-9);
    }

    @Test
    public void overlapLowersCompliance() {
        Config config = TestConfigs.twoSequentialPapers();
        ValidationReport report = ScheduleConstraints.validateScheduleConstraints(
                schedule(config, "2024-06-01", "2024-06-11"), config);
        assertFalse(report.isValid());
        assertEquals(80, report.get(ConstraintFamily.RESOURCE).getViolations().size());
        assertEquals(80, report.getViolationCount());
        assertTrue(report.getComplianceRate() < 100.0);
    }

    @Test
    public void sameInputSameReport() {
        Config config = TestConfigs.twoSequentialPapers();
        Schedule s = schedule(config, "2024-06-01", "2024-06-11");
        assertEquals(ScheduleConstraints.validateScheduleConstraints(s, config),
                ScheduleConstraints.validateScheduleConstraints(s, config));
    }
}
