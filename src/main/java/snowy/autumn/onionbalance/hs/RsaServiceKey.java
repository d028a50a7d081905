package snowy.autumn.onionbalance.hs;

import snowy.autumn.onionbalance.KeyFormatException;
import snowy.autumn.onionbalance.crypto.Cryptography;

import java.math.BigInteger;

public record RsaServiceKey(BigInteger modulus, BigInteger publicExponent) implements ServiceKey {

    public static final int ADDRESS_VERSION = 2;

    public RsaServiceKey {
        if (modulus == null || modulus.signum() <= 0) throw new KeyFormatException("RSA modulus must be positive.");
        if (publicExponent == null || publicExponent.signum() <= 0) throw new KeyFormatException("RSA public exponent must be positive.");
    }

    public int bitLength() {
        return modulus.bitLength();
    }

    // DER encoded (modulus, exponent) sequence.
    @Override
    public byte[] publicBytes() {
        return Cryptography.encodeRSAPublicKey(modulus, publicExponent);
    }

    @Override
    public int addressVersion() {
        return ADDRESS_VERSION;
    }

}
