package snowy.autumn.onionbalance.keys;

import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.bc.BcPEMDecryptorProvider;
import snowy.autumn.onionbalance.DecryptionException;
import snowy.autumn.onionbalance.KeyFormatException;
import snowy.autumn.onionbalance.client.Logger;
import snowy.autumn.onionbalance.client.Settings;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 Reads an onion service's private key from disk.
 <p>
 Tor's v3 key files start with a fixed tag followed by the raw Ed25519 secret. Anything else is treated as a PEM
 encoded RSA key, which may be encrypted with a passphrase.
 **/
public class KeyLoader {

    private static final byte[] HS_V3_TAG = "== ed25519v1-secret: type0 ==".getBytes(StandardCharsets.US_ASCII);
    public static final int HS_V3_SECRET_OFFSET = 32;
    public static final int HS_V3_SECRET_END = 64;
    public static final String ENCRYPTED_MARKER = "Proc-Type: 4,ENCRYPTED";

    final PassphraseSource passphraseSource;
    final int retries;
    final Logger logger;

    public static byte[] hsV3Tag() {
        return HS_V3_TAG.clone();
    }

    public KeyLoader(PassphraseSource passphraseSource, int retries, Logger logger) {
        if (retries < 1) throw new IllegalArgumentException("At least one attempt is needed to load a key, got " + retries + '.');
        this.passphraseSource = passphraseSource;
        this.retries = retries;
        this.logger = logger;
    }

    public KeyLoader(PassphraseSource passphraseSource, Settings settings, Logger logger) {
        this(passphraseSource, settings.keyRetries(), logger);
    }

    public KeyLoader(Logger logger) {
        this(PassphraseSource.console(), Settings.DEFAULT_KEY_RETRIES, logger);
    }

    /**
     Loads the key or fails with {@link KeyFormatException} (not a usable private key) or
     {@link DecryptionException} (no passphrase worked).
     **/
    public PrivateServiceKey load(Path keyFile) {
        KeyLoadResult result = attempt(keyFile);
        if (result instanceof KeyLoadResult.Success success) return success.key();
        else if (result instanceof KeyLoadResult.Rejected rejected) throw new KeyFormatException(rejected.reason());
        KeyLoadResult.Exhausted exhausted = (KeyLoadResult.Exhausted) result;
        throw new DecryptionException("Could not import RSA key from " + keyFile + " after " + exhausted.attempts() + " attempts: " + exhausted.lastError(), exhausted.attempts());
    }

    public KeyLoadResult attempt(Path keyFile) {
        try {
            return attempt(Files.readAllBytes(keyFile), keyFile.toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public KeyLoadResult attempt(byte[] contents, String keyName) {
        if (startsWith(contents, HS_V3_TAG)) {
            if (contents.length < HS_V3_SECRET_END)
                return new KeyLoadResult.Rejected("Ed25519 key file " + keyName + " is truncated.");
            logger.info("Loaded Ed25519 key from " + keyName + '.');
            return new KeyLoadResult.Success(new Ed25519PrivateKey(Arrays.copyOfRange(contents, HS_V3_SECRET_OFFSET, HS_V3_SECRET_END)), 1);
        }

        String pem = new String(contents, StandardCharsets.UTF_8);
        boolean encrypted = pem.contains(ENCRYPTED_MARKER);
        String lastError = null;
        // Attempt(n) -> Success | Rejected | Retry(n + 1), until the retries run out.
        for (int attempt = 1; attempt <= retries; attempt++) {
            char[] passphrase = encrypted ? passphraseSource.passphrase(keyName, attempt) : null;
            RSAPrivateKey rsaPrivateKey;
            try {
                rsaPrivateKey = importRSAKey(pem, passphrase);
            } catch (IOException | IllegalArgumentException | IllegalStateException e) {
                lastError = e.getMessage();
                logger.warning("Attempt " + attempt + " to import private key " + keyName + " failed: " + lastError);
                continue;
            } catch (KeyFormatException e) {
                return new KeyLoadResult.Rejected(e.getMessage());
            } finally {
                if (passphrase != null) Arrays.fill(passphrase, '\0');
            }

            int bitLength = rsaPrivateKey.getModulus().bitLength();
            if (bitLength != 1023 && bitLength != 1024)
                return new KeyLoadResult.Rejected("The specified key was not a 1024 bit private key, got " + bitLength + " bits.");
            logger.info("Loaded RSA key from " + keyName + '.');
            return new KeyLoadResult.Success(RsaPrivateKey.of(rsaPrivateKey), attempt);
        }

        logger.error("Could not import RSA key from " + keyName + '.');
        return new KeyLoadResult.Exhausted(retries, lastError);
    }

    private static RSAPrivateKey importRSAKey(String pem, char[] passphrase) throws IOException {
        Object object;
        try (PEMParser pemParser = new PEMParser(new StringReader(pem))) {
            object = pemParser.readObject();
        }
        if (object == null) throw new IOException("No PEM object found.");

        PrivateKeyInfo privateKeyInfo;
        if (object instanceof PEMEncryptedKeyPair encryptedKeyPair) {
            if (passphrase == null) throw new IOException("Key is encrypted but no passphrase was given.");
            privateKeyInfo = encryptedKeyPair.decryptKeyPair(new BcPEMDecryptorProvider(passphrase)).getPrivateKeyInfo();
        }
        else if (object instanceof PEMKeyPair keyPair) privateKeyInfo = keyPair.getPrivateKeyInfo();
        else if (object instanceof PrivateKeyInfo info) privateKeyInfo = info;
        else throw new KeyFormatException("Unsupported key container " + object.getClass().getSimpleName() + ", expected an RSA private key.");

        if (privateKeyInfo == null) throw new KeyFormatException("The specified key was not a private key.");
        if (!PKCSObjectIdentifiers.rsaEncryption.equals(privateKeyInfo.getPrivateKeyAlgorithm().getAlgorithm()))
            throw new KeyFormatException("The specified key was not an RSA key.");
        return RSAPrivateKey.getInstance(privateKeyInfo.parsePrivateKey());
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        return data.length >= prefix.length && Arrays.equals(data, 0, prefix.length, prefix, 0, prefix.length);
    }

}
