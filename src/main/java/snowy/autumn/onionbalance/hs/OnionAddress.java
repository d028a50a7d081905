package snowy.autumn.onionbalance.hs;

import snowy.autumn.onionbalance.InvalidEncodingException;
import snowy.autumn.onionbalance.KeyFormatException;
import snowy.autumn.onionbalance.crypto.Cryptography;
import snowy.autumn.onionbalance.utils.Utils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

public class OnionAddress {

    public static final String SUFFIX = ".onion";
    private static final byte[] CHECKSUM_CONSTANT = ".onion checksum".getBytes(StandardCharsets.US_ASCII);
    public static final byte VERSION_3 = 3;
    public static final int CHECKSUM_LENGTH = 2;
    public static final int V2_ADDRESS_LENGTH = 16;
    public static final int V3_ADDRESS_LENGTH = 56;

    final String address;
    final int version;
    // v2 only.
    PermanentId permanentId;
    // v3 only.
    byte[] publicKey;
    short checksum;

    public OnionAddress(String address) {
        String bare = stripSuffix(address).toLowerCase(Locale.ROOT);
        if (bare.length() == V2_ADDRESS_LENGTH) {
            this.permanentId = PermanentId.fromBytes(Utils.base32Decode(bare));
            this.version = RsaServiceKey.ADDRESS_VERSION;
        }
        else if (bare.length() == V3_ADDRESS_LENGTH) {
            byte[] decoded = Utils.base32Decode(bare);
            if (decoded.length != Ed25519ServiceKey.KEY_LENGTH + CHECKSUM_LENGTH + 1)
                throw new InvalidEncodingException("Onion address decodes to " + decoded.length + " bytes, expected " + (Ed25519ServiceKey.KEY_LENGTH + CHECKSUM_LENGTH + 1) + ": " + address);
            ByteBuffer buffer = ByteBuffer.wrap(decoded);
            publicKey = new byte[Ed25519ServiceKey.KEY_LENGTH];
            buffer.get(publicKey);
            checksum = buffer.getShort();
            byte embeddedVersion = buffer.get();
            if (embeddedVersion != VERSION_3)
                throw new InvalidEncodingException("Unsupported onion address version " + embeddedVersion + ": " + address);
            short calculatedChecksum = ByteBuffer.wrap(calculateChecksum(publicKey, embeddedVersion)).getShort();
            if (checksum != calculatedChecksum)
                throw new InvalidEncodingException("Checksums do not match for onion address: " + address + ", calculated checksum: " + calculatedChecksum + ", embedded checksum: " + checksum);
            this.version = embeddedVersion;
        }
        else throw new InvalidEncodingException("Onion addresses are " + V2_ADDRESS_LENGTH + " or " + V3_ADDRESS_LENGTH + " characters long: " + address);
        this.address = bare;
    }

    public static OnionAddress parse(String address) {
        return new OnionAddress(address);
    }

    private static String stripSuffix(String address) {
        if (address.toLowerCase(Locale.ROOT).endsWith(SUFFIX))
            return address.substring(0, address.length() - SUFFIX.length());
        return address;
    }

    public static byte[] calculateChecksum(byte[] publicKey, byte version) {
        byte[] digest = Cryptography.sha3_256(CHECKSUM_CONSTANT, publicKey, new byte[]{version});
        return Arrays.copyOf(digest, CHECKSUM_LENGTH);
    }

    public static String v2(PermanentId permanentId) {
        return permanentId.toBase32();
    }

    public static String v2(RsaServiceKey key) {
        return v2(PermanentId.of(key));
    }

    public static String v3(byte[] publicKey) {
        if (publicKey.length != Ed25519ServiceKey.KEY_LENGTH)
            throw new KeyFormatException("Ed25519 public keys are " + Ed25519ServiceKey.KEY_LENGTH + " bytes long, got " + publicKey.length + " bytes.");
        return Utils.base32(ByteBuffer.allocate(Ed25519ServiceKey.KEY_LENGTH + CHECKSUM_LENGTH + 1)
                .put(publicKey)
                .put(calculateChecksum(publicKey, VERSION_3))
                .put(VERSION_3)
                .array());
    }

    public static String of(ServiceKey key) {
        if (key instanceof RsaServiceKey rsaServiceKey) return v2(rsaServiceKey);
        else if (key instanceof Ed25519ServiceKey ed25519ServiceKey) return v3(ed25519ServiceKey.publicKey());
        throw new KeyFormatException("Unsupported service key " + key);
    }

    /**
     Base32 decodes a legacy address, with or without the .onion suffix, into its permanent id.
     **/
    public static PermanentId decodePermanentId(String address) {
        return PermanentId.fromBytes(Utils.base32Decode(stripSuffix(address)));
    }

    public int version() {
        return version;
    }

    public PermanentId permanentId() {
        if (permanentId == null) throw new IllegalStateException("Version " + version + " addresses carry no permanent id.");
        return permanentId;
    }

    public byte[] publicKey() {
        if (publicKey == null) throw new IllegalStateException("Version " + version + " addresses carry no Ed25519 public key.");
        return publicKey.clone();
    }

    public byte[] checksum() {
        if (publicKey == null) throw new IllegalStateException("Version " + version + " addresses carry no checksum.");
        return ByteBuffer.allocate(CHECKSUM_LENGTH).putShort(checksum).array();
    }

    public String withSuffix() {
        return address + SUFFIX;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OnionAddress other && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return address;
    }

}
