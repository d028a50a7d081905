package snowy.autumn.onionbalance;

/**
 Thrown when a key is of the wrong type or of an unsupported size.
 **/
public class KeyFormatException extends OnionbalanceException {

    public KeyFormatException(String message) {
        super(message);
    }

    public KeyFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
