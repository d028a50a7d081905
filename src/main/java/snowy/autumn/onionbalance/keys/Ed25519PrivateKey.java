package snowy.autumn.onionbalance.keys;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import snowy.autumn.onionbalance.KeyFormatException;
import snowy.autumn.onionbalance.hs.Ed25519ServiceKey;

import java.util.Arrays;

public record Ed25519PrivateKey(byte[] secret) implements PrivateServiceKey {

    public Ed25519PrivateKey {
        if (secret == null || secret.length != Ed25519PrivateKeyParameters.KEY_SIZE)
            throw new KeyFormatException("Ed25519 secrets are " + Ed25519PrivateKeyParameters.KEY_SIZE + " bytes long.");
        secret = secret.clone();
    }

    @Override
    public byte[] secret() {
        return secret.clone();
    }

    public Ed25519PrivateKeyParameters parameters() {
        return new Ed25519PrivateKeyParameters(secret, 0);
    }

    @Override
    public Ed25519ServiceKey publicKey() {
        return new Ed25519ServiceKey(parameters().generatePublicKey().getEncoded());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Ed25519PrivateKey other && Arrays.equals(secret, other.secret);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(secret);
    }

    // Keeps the secret out of logs.
    @Override
    public String toString() {
        return "Ed25519PrivateKey[" + publicKey() + ']';
    }

}
