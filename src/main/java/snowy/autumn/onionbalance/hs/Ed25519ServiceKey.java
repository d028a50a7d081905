package snowy.autumn.onionbalance.hs;

import snowy.autumn.onionbalance.KeyFormatException;

import java.util.Arrays;
import java.util.HexFormat;

public record Ed25519ServiceKey(byte[] publicKey) implements ServiceKey {

    public static final int KEY_LENGTH = 32;
    public static final int ADDRESS_VERSION = 3;

    public Ed25519ServiceKey {
        if (publicKey == null || publicKey.length != KEY_LENGTH)
            throw new KeyFormatException("Ed25519 public keys are " + KEY_LENGTH + " bytes long, got " + (publicKey == null ? "none" : publicKey.length + " bytes") + '.');
        publicKey = publicKey.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    @Override
    public byte[] publicBytes() {
        return publicKey();
    }

    @Override
    public int addressVersion() {
        return ADDRESS_VERSION;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Ed25519ServiceKey other && Arrays.equals(publicKey, other.publicKey);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
        return "Ed25519ServiceKey[" + HexFormat.of().formatHex(publicKey) + ']';
    }

}
