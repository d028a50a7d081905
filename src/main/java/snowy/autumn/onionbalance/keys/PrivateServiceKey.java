package snowy.autumn.onionbalance.keys;

import snowy.autumn.onionbalance.hs.OnionAddress;
import snowy.autumn.onionbalance.hs.ServiceKey;

public sealed interface PrivateServiceKey permits RsaPrivateKey, Ed25519PrivateKey {

    ServiceKey publicKey();

    default String onionAddress() {
        return OnionAddress.of(publicKey());
    }

}
