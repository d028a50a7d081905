package snowy.autumn.onionbalance.crypto;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import snowy.autumn.onionbalance.InvalidEncodingException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

public class Cryptography {

    public static final int SHA1_LENGTH = 20;
    public static final int SHA3_256_LENGTH = 32;
    public static final int PKCS1_BLOCK_LENGTH = 128;
    // 0x00 0x01 ... 0x00
    public static final int PKCS1_MAX_MESSAGE_LENGTH = PKCS1_BLOCK_LENGTH - 3;

    public static MessageDigest createDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    public static byte[] sha1(byte[]... parts) {
        MessageDigest sha1 = createDigest("SHA-1");
        for (byte[] part : parts) sha1.update(part);
        return sha1.digest();
    }

    public static byte[] sha3_256(byte[]... parts) {
        MessageDigest sha3_256 = createDigest("SHA3-256");
        for (byte[] part : parts) sha3_256.update(part);
        return sha3_256.digest();
    }

    /**
     DER encoding of the sequence (modulus, publicExponent), the same bytes as a PKCS#1 RSAPublicKey.
     **/
    public static byte[] encodeRSAPublicKey(BigInteger modulus, BigInteger publicExponent) {
        try {
            return new RSAPublicKey(modulus, publicExponent).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] keyDigest(BigInteger modulus, BigInteger publicExponent) {
        return sha1(encodeRSAPublicKey(modulus, publicExponent));
    }

    /**
     Builds a PKCS#1 type 1 block: 0x00 0x01, 0xFF padding, 0x00, then the message.
     **/
    public static byte[] addPkcs1Padding(byte[] message) {
        if (message.length > PKCS1_MAX_MESSAGE_LENGTH)
            throw new InvalidEncodingException("Message of " + message.length + " bytes does not fit a PKCS#1 block, at most " + PKCS1_MAX_MESSAGE_LENGTH + " bytes are allowed.");

        byte[] padding = new byte[PKCS1_MAX_MESSAGE_LENGTH - message.length];
        Arrays.fill(padding, (byte) 0xFF);
        ByteBuffer buffer = ByteBuffer.allocate(PKCS1_BLOCK_LENGTH);
        buffer.put(new byte[]{0, 1});
        buffer.put(padding);
        buffer.put((byte) 0);
        buffer.put(message);

        if (buffer.hasRemaining()) throw new IllegalStateException("Padded message is not " + PKCS1_BLOCK_LENGTH + " bytes long.");
        return buffer.array();
    }

}
