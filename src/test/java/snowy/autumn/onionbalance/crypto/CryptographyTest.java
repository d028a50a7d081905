package snowy.autumn.onionbalance.crypto;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import snowy.autumn.onionbalance.InvalidEncodingException;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CryptographyTest {

    static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(1023).add(BigInteger.valueOf(12345));
    static final BigInteger EXPONENT = BigInteger.valueOf(65537);

    @Test
    void encodeRSAPublicKeyIsDerSequenceOfTwoIntegers() {
        var encoded = Cryptography.encodeRSAPublicKey(MODULUS, EXPONENT);

        assertEquals(140, encoded.length);
        // SEQUENCE, long form length 0x89, INTEGER of 0x81 bytes with a leading zero for the sign bit.
        assertEquals("3081890281810080", HexFormat.of().formatHex(Arrays.copyOf(encoded, 8)));
        assertEquals("0203010001", HexFormat.of().formatHex(Arrays.copyOfRange(encoded, 135, 140)));
    }

    @Test
    void keyDigest() {
        var digest = Cryptography.keyDigest(MODULUS, EXPONENT);

        assertEquals(Cryptography.SHA1_LENGTH, digest.length);
        assertEquals("051101151689f5192273d4a33fbd125b041b9356", HexFormat.of().formatHex(digest));
    }

    @Test
    void sha1OverConcatenatedParts() {
        assertArrayEquals(Cryptography.sha1("abcdef".getBytes(US_ASCII)), Cryptography.sha1("abc".getBytes(US_ASCII), "def".getBytes(US_ASCII)));
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", HexFormat.of().formatHex(Cryptography.sha1("abc".getBytes(US_ASCII))));
    }

    @Test
    void pkcs1PaddingOfShortMessage() {
        var padded = Cryptography.addPkcs1Padding("abc".getBytes(US_ASCII));

        assertEquals(128, padded.length);
        assertEquals(0x00, padded[0]);
        assertEquals(0x01, padded[1]);
        for (int i = 2; i < 124; i++) assertEquals((byte) 0xFF, padded[i], "byte " + i);
        assertEquals(0x00, padded[124]);
        assertArrayEquals(new byte[]{0x61, 0x62, 0x63}, Arrays.copyOfRange(padded, 125, 128));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 20, 35, 124, 125})
    void pkcs1PaddingIsAlwaysOneBlock(int length) {
        var message = new byte[length];
        Arrays.fill(message, (byte) 0x42);

        var padded = Cryptography.addPkcs1Padding(message);

        assertEquals(Cryptography.PKCS1_BLOCK_LENGTH, padded.length);
        assertEquals(0x00, padded[Cryptography.PKCS1_BLOCK_LENGTH - length - 1]);
        assertArrayEquals(message, Arrays.copyOfRange(padded, Cryptography.PKCS1_BLOCK_LENGTH - length, Cryptography.PKCS1_BLOCK_LENGTH));
    }

    @ParameterizedTest
    @ValueSource(ints = {126, 128, 256})
    void pkcs1PaddingRejectsLongMessages(int length) {
        assertThrows(InvalidEncodingException.class, () -> Cryptography.addPkcs1Padding(new byte[length]));
    }

}
