package snowy.autumn.onionbalance.hs;

import snowy.autumn.onionbalance.InvalidEncodingException;
import snowy.autumn.onionbalance.crypto.Cryptography;
import snowy.autumn.onionbalance.utils.Utils;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.OptionalLong;

/**
 Identifier under which a legacy (v2) hidden service descriptor is stored in the directory.
 **/
public final class DescriptorId {

    public static final int COOKIE_LENGTH = 16;
    public static final long MAX_TIME_PERIOD = 0xFFFFFFFFL;
    public static final int MAX_REPLICA = 0xFF;

    private final byte[] id;
    private final OptionalLong secondsValid;

    private DescriptorId(byte[] id, OptionalLong secondsValid) {
        this.id = id;
        this.secondsValid = secondsValid;
    }

    /**
     secret-id-part = H(time-period | descriptor-cookie | replica)
     <p>
     The time period is written as 4 bytes big endian and the replica as a single byte. The cookie is left out
     entirely when null or empty.
     **/
    public static byte[] secretIdPart(long timePeriod, byte[] descriptorCookie, int replica) {
        if (timePeriod < 0 || timePeriod > MAX_TIME_PERIOD)
            throw new InvalidEncodingException("Time period " + timePeriod + " does not fit in 4 unsigned bytes.");
        if (replica < 0 || replica > MAX_REPLICA)
            throw new InvalidEncodingException("Replica " + replica + " does not fit in a single byte.");
        boolean hasCookie = descriptorCookie != null && descriptorCookie.length != 0;
        if (hasCookie && descriptorCookie.length != COOKIE_LENGTH)
            throw new InvalidEncodingException("Descriptor cookies are " + COOKIE_LENGTH + " bytes long, got " + descriptorCookie.length + " bytes.");

        ByteBuffer buffer = ByteBuffer.allocate(4 + (hasCookie ? COOKIE_LENGTH : 0) + 1);
        buffer.putInt((int) timePeriod);
        if (hasCookie) buffer.put(descriptorCookie);
        buffer.put((byte) replica);
        return Cryptography.sha1(buffer.array());
    }

    private static DescriptorId of(PermanentId permanentId, byte[] secretIdPart, OptionalLong secondsValid) {
        if (secretIdPart.length != Cryptography.SHA1_LENGTH)
            throw new InvalidEncodingException("A secret-id-part is " + Cryptography.SHA1_LENGTH + " bytes long, got " + secretIdPart.length + " bytes.");
        // descriptor-id = H(permanent-id | secret-id-part)
        return new DescriptorId(Cryptography.sha1(permanentId.bytes(), secretIdPart), secondsValid);
    }

    public static DescriptorId of(PermanentId permanentId, byte[] secretIdPart) {
        return of(permanentId, secretIdPart, OptionalLong.empty());
    }

    public static DescriptorId compute(PermanentId permanentId, long timestamp, int replica, int deviation, byte[] descriptorCookie) {
        TimePeriod timePeriod = TimePeriod.at(permanentId, timestamp, deviation);
        byte[] secretIdPart = secretIdPart(timePeriod.index(), descriptorCookie, replica);
        return of(permanentId, secretIdPart, OptionalLong.of(timePeriod.secondsValid()));
    }

    public static DescriptorId compute(String onionAddress, long timestamp, int replica, int deviation, byte[] descriptorCookie) {
        return compute(OnionAddress.decodePermanentId(onionAddress), timestamp, replica, deviation, descriptorCookie);
    }

    /**
     Computes the descriptor id of a legacy onion service and returns it base32 encoded, in lowercase.
     **/
    public static String computeBase32(String onionAddress, long timestamp, int replica, int deviation, byte[] descriptorCookie) {
        return compute(onionAddress, timestamp, replica, deviation, descriptorCookie).toBase32();
    }

    public static String computeBase32(String onionAddress, long timestamp, int replica) {
        return computeBase32(onionAddress, timestamp, replica, 0, null);
    }

    public byte[] bytes() {
        return id.clone();
    }

    /**
     Seconds until the time period this id was computed for rolls over. Empty when it was built from a bare secret-id-part.
     **/
    public OptionalLong secondsValid() {
        return secondsValid;
    }

    public String toBase32() {
        return Utils.base32(id);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DescriptorId other && Arrays.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(id);
    }

    @Override
    public String toString() {
        return toBase32();
    }

}
