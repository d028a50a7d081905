package snowy.autumn.onionbalance;

/**
 Thrown once every passphrase attempt for an encrypted private key has failed.
 **/
public class DecryptionException extends OnionbalanceException {

    final int attempts;

    public DecryptionException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

}
