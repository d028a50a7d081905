package snowy.autumn.onionbalance;

public class InvalidEncodingException extends OnionbalanceException {

    public InvalidEncodingException(String message) {
        super(message);
    }

    public InvalidEncodingException(String message, Throwable cause) {
        super(message, cause);
    }

}
