package snowy.autumn.onionbalance.keys;

import org.bouncycastle.crypto.params.RSAPrivateCrtKeyParameters;
import snowy.autumn.onionbalance.hs.PermanentId;
import snowy.autumn.onionbalance.hs.RsaServiceKey;

public record RsaPrivateKey(RSAPrivateCrtKeyParameters parameters) implements PrivateServiceKey {

    public static RsaPrivateKey of(org.bouncycastle.asn1.pkcs.RSAPrivateKey key) {
        return new RsaPrivateKey(new RSAPrivateCrtKeyParameters(
                key.getModulus(),
                key.getPublicExponent(),
                key.getPrivateExponent(),
                key.getPrime1(),
                key.getPrime2(),
                key.getExponent1(),
                key.getExponent2(),
                key.getCoefficient()));
    }

    public int bitLength() {
        return parameters.getModulus().bitLength();
    }

    @Override
    public RsaServiceKey publicKey() {
        return new RsaServiceKey(parameters.getModulus(), parameters.getPublicExponent());
    }

    public PermanentId permanentId() {
        return PermanentId.of(publicKey());
    }

}
