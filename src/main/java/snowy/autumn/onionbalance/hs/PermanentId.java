package snowy.autumn.onionbalance.hs;

import snowy.autumn.onionbalance.InvalidEncodingException;
import snowy.autumn.onionbalance.crypto.Cryptography;
import snowy.autumn.onionbalance.utils.Utils;

import java.util.Arrays;

/**
 The 10 byte identifier of a legacy onion service: the first half of the SHA-1 digest of its DER encoded public key.
 **/
public final class PermanentId {

    public static final int LENGTH = 10;

    private final byte[] id;

    private PermanentId(byte[] id) {
        this.id = id;
    }

    public static PermanentId of(RsaServiceKey key) {
        return new PermanentId(Arrays.copyOf(Cryptography.keyDigest(key.modulus(), key.publicExponent()), LENGTH));
    }

    public static PermanentId fromBytes(byte[] id) {
        if (id.length != LENGTH)
            throw new InvalidEncodingException("A permanent id is " + LENGTH + " bytes long, got " + id.length + " bytes.");
        return new PermanentId(id.clone());
    }

    public byte[] bytes() {
        return id.clone();
    }

    // The first byte, unsigned. Spreads descriptor rotation over the day.
    public int phase() {
        return id[0] & 0xFF;
    }

    public String toBase32() {
        return Utils.base32(id);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PermanentId other && Arrays.equals(id, other.id);
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
