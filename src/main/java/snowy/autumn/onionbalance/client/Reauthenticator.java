package snowy.autumn.onionbalance.client;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 Re-authenticates a control channel after the connection to Tor was reset. Failures are logged, never thrown, so the
 caller keeps running.
 **/
public class Reauthenticator {

    final Logger logger;
    final Duration delay;
    final ReentrantLock lock = new ReentrantLock();

    public Reauthenticator(Logger logger, Duration delay) {
        this.logger = logger;
        this.delay = delay;
    }

    public Reauthenticator(Logger logger, Settings settings) {
        this(logger, settings.reauthenticationDelay());
    }

    public boolean reauthenticate(ControlChannel controlChannel, String password) {
        lock.lock();
        try {
            if (!delay.isZero()) Thread.sleep(delay.toMillis());
            controlChannel.authenticate(password);
            logger.info("Re-authenticated controller.");
            return true;
        } catch (AuthenticationException e) {
            logger.error("Failed to re-authenticate controller: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted before re-authenticating controller.");
            return false;
        } finally {
            lock.unlock();
        }
    }

}
