package snowy.autumn.onionbalance.client;

/**
 An authenticated connection to a Tor control port. The protocol itself lives outside this library.
 **/
public interface ControlChannel {

    void authenticate(String password) throws AuthenticationException;

}
