package planner.scoring;

import org.junit.Test;
import planner.TestConfigs;
import planner.model.Config;
import planner.model.Schedule;
import planner.model.SubmissionKind;

import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;

/**
 * Tests {@link ScheduleAnalyzer}
 */
public final class ScheduleAnalyzerTest {
    private static final double EPS = 1e-6;

    @Test
    public void emptyScheduleListsEverySubmissionAsMissing() {
        Config config = TestConfigs.twoSequentialPapers();
        ScheduleMetrics m = ScheduleAnalyzer.analyze(Schedule.empty(), config);
        assertEquals(2, m.getSubmissionCount());
        assertEquals(0, m.getScheduledCount());
        assertEquals(List.of("P1", "P2"), m.getMissingSubmissions());
        assertEquals(0.0, m.getTotalPenalty(), EPS);
        assertEquals(0.0, m.getCompletionRate(), EPS);
        assertFalse(m.getStartDate().isPresent());
    }

    @Test
    public void partialScheduleReportsWhatIsMissing() {
        Config config = TestConfigs.twoSequentialPapers();
        ScheduleMetrics m = ScheduleAnalyzer.analyze(
                Schedule.fromStartDates(Map.of("P1", d("2024-06-01")), config), config);
        assertEquals(1, m.getScheduledCount());
        assertEquals(List.of("P2"), m.getMissingSubmissions());
        assertEquals(50.0, m.getCompletionRate(), EPS);
        assertEquals(100.0, m.getKindPercentage(SubmissionKind.PAPER), EPS);
        assertEquals(0.0, m.getKindPercentage(SubmissionKind.ABSTRACT), EPS);
    }

    @Test
    public void metricsAgreeWithTheCalculators() {
        Config config = TestConfigs.twoSequentialPapers();
        Schedule s = Schedule.fromStartDates(Map.of("P1", d("2024-06-01"), "P2", d("2024-08-30")), config);
        ScheduleMetrics m = ScheduleAnalyzer.analyze(s, config);

        assertEquals(180, m.getMakespanDays());
        assertEquals(d("2024-06-01"), m.getStartDate().get());
        assertEquals(d("2024-11-28"), m.getEndDate().get());
        assertEquals(1, m.getPeakLoad());
        assertEquals(1.0, m.getAverageLoad(), EPS);
        assertEquals(100.0, m.getUtilizationRate(), EPS);
        assertEquals(1.0, m.getAverageDailyLoad(), EPS);
        assertEquals(100.0, m.getComplianceRate(), EPS);
        assertEquals(Scoring.calculateQualityScore(s, config), m.getQualityScore(), EPS);
        assertEquals(Scoring.calculateEfficiencyScore(s, config), m.getEfficiencyScore(), EPS);
        assertEquals(0.0, m.getTotalPenalty(), EPS);
        assertEquals(Integer.valueOf(2), m.getKindCounts().get(SubmissionKind.PAPER));
        assertEquals(Integer.valueOf(1), m.getMonthlyDistribution().get(YearMonth.of(2024, 6)));
        assertEquals(Integer.valueOf(1), m.getMonthlyDistribution().get(YearMonth.of(2024, 8)));
    }

    @Test
    public void overlapShowsUpAsPeakLoadAndPenalty() {
        Config config = TestConfigs.twoSequentialPapers();
        Schedule s = Schedule.fromStartDates(Map.of("P1", d("2024-06-01"), "P2", d("2024-06-01")), config);
        ScheduleMetrics m = ScheduleAnalyzer.analyze(s, config);
        assertEquals(2, m.getPeakLoad());
        assertTrue(m.getPenalties().get(PenaltyBreakdown.RESOURCE) > 0);
        assertTrue(m.getComplianceRate() < 100.0);
    }
}
