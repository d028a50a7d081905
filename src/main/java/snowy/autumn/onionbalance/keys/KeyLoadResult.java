package snowy.autumn.onionbalance.keys;

/**
 Outcome of loading a private key: loaded, rejected outright, or given up on after every passphrase attempt failed.
 **/
public sealed interface KeyLoadResult {

    record Success(PrivateServiceKey key, int attempts) implements KeyLoadResult {}

    record Rejected(String reason) implements KeyLoadResult {}

    record Exhausted(int attempts, String lastError) implements KeyLoadResult {}

}
