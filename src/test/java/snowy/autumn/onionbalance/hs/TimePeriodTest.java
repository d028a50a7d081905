package snowy.autumn.onionbalance.hs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimePeriodTest {

    static final PermanentId ZERO = PermanentId.fromBytes(new byte[PermanentId.LENGTH]);

    @Test
    void zeroPhaseStartsPeriodsAtMidnight() {
        var timePeriod = TimePeriod.at(ZERO, 432000);

        assertEquals(0, timePeriod.phase());
        assertEquals(5, timePeriod.index());
        assertEquals(86400, timePeriod.secondsValid());
        assertEquals(4, TimePeriod.index(ZERO, 431999));
        assertEquals(1, TimePeriod.secondsValid(ZERO, 431999));
    }

    @ParameterizedTest
    @CsvSource({
            "051101151689f5192273, 1700000000, 19675, 4713",
            "ff000000000000000000, 0, 0, 338",
            "ff000000000000000000, 338, 1, 86400",
            "01000000000000000000, 0, 0, 86063",
            "80000000000000000000, 43200, 1, 86400"
    })
    void phaseShiftedPeriods(String permanentId, long timestamp, long index, long secondsValid) {
        var timePeriod = TimePeriod.at(PermanentId.fromBytes(HexFormat.of().parseHex(permanentId)), timestamp);

        assertEquals(index, timePeriod.index());
        assertEquals(secondsValid, timePeriod.secondsValid());
    }

    @Test
    void secondsValidCompletesThePeriod() {
        for (int phase = 0; phase < 256; phase += 17) {
            var raw = new byte[PermanentId.LENGTH];
            raw[0] = (byte) phase;
            var permanentId = PermanentId.fromBytes(raw);
            for (long t = 0; t < 3 * TimePeriod.PERIOD_LENGTH; t += 4321) {
                long elapsed = (t + TimePeriod.phaseOffset(phase)) % TimePeriod.PERIOD_LENGTH;
                assertEquals(TimePeriod.PERIOD_LENGTH, TimePeriod.secondsValid(permanentId, t) + elapsed);
            }
        }
    }

    @Test
    void monotonicInTime() {
        var permanentId = PermanentId.of(PermanentIdTest.KEY);
        long previous = Long.MIN_VALUE;
        for (long t = 1_600_000_000L; t < 1_600_000_000L + 10 * TimePeriod.PERIOD_LENGTH; t += 997) {
            long index = TimePeriod.index(permanentId, t);
            assertTrue(index >= previous);
            previous = index;
        }
    }

    @Test
    void deviationShiftsWholePeriods() {
        var now = TimePeriod.at(ZERO, 1_000_000);

        assertEquals(now.index() + 1, TimePeriod.at(ZERO, 1_000_000, 1).index());
        assertEquals(now.index() - 1, TimePeriod.at(ZERO, 1_000_000, -1).index());
        assertEquals(now.secondsValid(), TimePeriod.at(ZERO, 1_000_000, 1).secondsValid());
        assertEquals(now.shift(2), TimePeriod.at(ZERO, 1_000_000, 2));
    }

    @Test
    void currentUsesClock() {
        var clock = Clock.fixed(Instant.ofEpochSecond(432000), ZoneOffset.UTC);

        assertEquals(TimePeriod.at(ZERO, 432000), TimePeriod.current(ZERO, clock));
    }

}
