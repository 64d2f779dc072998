package it.floro.analytics.simulator;

import it.floro.analytics.domain.DataPoint;
import it.floro.analytics.domain.Dataset;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

public class ClimateSeriesSimulatorTest {

    @Test
    void testSameSeedSameData() {
        Dataset a = new ClimateSeriesSimulator(1L, LocalDate.of(2022, 1, 1), 90).withMissingRate(0.1).generate("a");
        Dataset b = new ClimateSeriesSimulator(1L, LocalDate.of(2022, 1, 1), 90).withMissingRate(0.1).generate("a");
        assertEquals(a.points(), b.points());
    }

    @Test
    void testDailyOrderedPointsWithMetadata() {
        Dataset ds = new ClimateSeriesSimulator(3L, LocalDate.of(2022, 6, 1), 30)
                .withStation("ST07", "mm")
                .generate("rain");

        assertEquals(30, ds.size());
        assertEquals("simulator", ds.source());
        for (int i = 1; i < ds.size(); i++) {
            assertEquals(Duration.ofDays(1),
                    Duration.between(ds.points().get(i - 1).timestamp(), ds.points().get(i).timestamp()));
        }
        DataPoint p = ds.points().get(0);
        assertEquals("ST07", p.metadata().get("station"));
        assertEquals("mm", p.metadata().get("unit"));
        assertFalse(p.isMissing());
    }

    @Test
    void testSeasonalCycle() {
        // peakShift 100: massimo del ciclo attorno al giorno 191 (metà luglio)
        Dataset ds = new ClimateSeriesSimulator(5L, LocalDate.of(2022, 1, 1), 365)
                .withNoise(0.1, 0.0)
                .generate("temp");
        double january = ds.points().get(15).value();
        double july = ds.points().get(195).value();
        assertTrue(july > january + 10.0, "gennaio=" + january + " luglio=" + july);
    }

    @Test
    void testAllMissing() {
        Dataset ds = new ClimateSeriesSimulator(9L, LocalDate.of(2022, 1, 1), 10).withMissingRate(1.0).generate("x");
        assertTrue(ds.points().stream().allMatch(DataPoint::isMissing));
    }
}
