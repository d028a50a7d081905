package snowy.autumn.onionbalance;

public class OnionbalanceException extends RuntimeException {

    public OnionbalanceException(String message) {
        super(message);
    }

    public OnionbalanceException(String message, Throwable cause) {
        super(message, cause);
    }

}
