package snowy.autumn.onionbalance.client;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReauthenticatorTest {

    static class FakeControlChannel implements ControlChannel {

        final String password;
        final List<String> attempts = new ArrayList<>();

        FakeControlChannel(String password) {
            this.password = password;
        }

        @Override
        public void authenticate(String password) throws AuthenticationException {
            attempts.add(password);
            if (!this.password.equals(password)) throw new AuthenticationException("Password did not match.");
        }
    }

    @Test
    void authenticatesWithGivenPassword() {
        var log = new ByteArrayOutputStream();
        var controlChannel = new FakeControlChannel("hunter2");

        assertTrue(new Reauthenticator(new Logger(log), Duration.ZERO).reauthenticate(controlChannel, "hunter2"));
        assertEquals(List.of("hunter2"), controlChannel.attempts);
        assertTrue(log.toString(StandardCharsets.UTF_8).contains("[INFO] Re-authenticated controller."));
    }

    @Test
    void failureIsLoggedNotThrown() {
        var log = new ByteArrayOutputStream();
        var controlChannel = new FakeControlChannel("hunter2");

        assertFalse(new Reauthenticator(new Logger(log), Duration.ZERO).reauthenticate(controlChannel, "letmein"));
        assertTrue(log.toString(StandardCharsets.UTF_8).contains("[ERROR] Failed to re-authenticate controller: Password did not match."));
    }

    @Test
    void waitsBeforeAuthenticating() {
        var controlChannel = new FakeControlChannel("hunter2");
        var reauthenticator = new Reauthenticator(Logger.disabled(), Duration.ofMillis(50));

        long start = System.nanoTime();
        assertTrue(reauthenticator.reauthenticate(controlChannel, "hunter2"));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 50);
    }

    @Test
    void interruptedWaitGivesUp() {
        var controlChannel = new FakeControlChannel("hunter2");
        var reauthenticator = new Reauthenticator(Logger.disabled(), Duration.ofSeconds(10));

        Thread.currentThread().interrupt();
        try {
            assertFalse(reauthenticator.reauthenticate(controlChannel, "hunter2"));
            assertTrue(Thread.currentThread().isInterrupted());
            assertTrue(controlChannel.attempts.isEmpty());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void delayComesFromSettings() {
        var settings = new Settings("hunter2", Duration.ZERO, 3, false);
        var controlChannel = new FakeControlChannel("hunter2");

        assertTrue(new Reauthenticator(Logger.disabled(), settings).reauthenticate(controlChannel, settings.controlPassword()));
    }

}
