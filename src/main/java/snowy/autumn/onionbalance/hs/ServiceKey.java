package snowy.autumn.onionbalance.hs;

/**
 Public key material of an onion service. RSA keys belong to legacy (v2) services, Ed25519 keys to v3 services.
 **/
public sealed interface ServiceKey permits RsaServiceKey, Ed25519ServiceKey {

    byte[] publicBytes();

    int addressVersion();

}
