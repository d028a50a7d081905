package snowy.autumn.onionbalance.hs;

import java.time.Clock;

/**
 The rotating period a legacy descriptor id is valid for. Every service is phase shifted by the first byte of its
 permanent id, so descriptor ids of different services do not all change at the same moment.
 **/
public record TimePeriod(long index, int phase, long secondsValid) {

    public static final long PERIOD_LENGTH = 86400;
    public static final int PHASE_STEPS = 256;

    public static long phaseOffset(int phase) {
        return phase * PERIOD_LENGTH / PHASE_STEPS;
    }

    public static TimePeriod at(PermanentId permanentId, long timestamp, int deviation) {
        int phase = permanentId.phase();
        // time-period = (current-time + permanent-id-byte * 86400 / 256) / 86400
        long shifted = timestamp + phaseOffset(phase);
        long index = Math.floorDiv(shifted, PERIOD_LENGTH) + deviation;
        long secondsValid = PERIOD_LENGTH - Math.floorMod(shifted, PERIOD_LENGTH);
        return new TimePeriod(index, phase, secondsValid);
    }

    public static TimePeriod at(PermanentId permanentId, long timestamp) {
        return at(permanentId, timestamp, 0);
    }

    public static TimePeriod current(PermanentId permanentId, Clock clock) {
        return at(permanentId, clock.instant().getEpochSecond());
    }

    public static long index(PermanentId permanentId, long timestamp) {
        return at(permanentId, timestamp).index();
    }

    public static long secondsValid(PermanentId permanentId, long timestamp) {
        return at(permanentId, timestamp).secondsValid();
    }

    // Adjacent periods share the rotation boundary, so only the index moves.
    public TimePeriod shift(int deviation) {
        return new TimePeriod(index + deviation, phase, secondsValid);
    }

}
