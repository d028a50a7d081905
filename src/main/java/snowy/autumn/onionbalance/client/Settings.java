package snowy.autumn.onionbalance.client;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 Settings shared by the key loader and the control channel helpers. Passed around explicitly.
 **/
public record Settings(String controlPassword, Duration reauthenticationDelay, int keyRetries, boolean debug) {

    public static final Duration DEFAULT_REAUTHENTICATION_DELAY = Duration.ofSeconds(10);
    public static final int DEFAULT_KEY_RETRIES = 3;

    public Settings {
        if (reauthenticationDelay == null || reauthenticationDelay.isNegative())
            throw new IllegalArgumentException("Reauthentication delay must not be negative.");
        if (keyRetries < 1) throw new IllegalArgumentException("Key retries must be at least 1, got " + keyRetries + '.');
    }

    public static Settings defaults() {
        return new Settings(null, DEFAULT_REAUTHENTICATION_DELAY, DEFAULT_KEY_RETRIES, false);
    }

    public static Settings fromProperties(Properties properties) {
        return new Settings(
                properties.getProperty("control.password"),
                Duration.ofSeconds(Long.parseLong(properties.getProperty("reauth.delay.seconds", String.valueOf(DEFAULT_REAUTHENTICATION_DELAY.toSeconds())).trim())),
                Integer.parseInt(properties.getProperty("key.retries", String.valueOf(DEFAULT_KEY_RETRIES)).trim()),
                Boolean.parseBoolean(properties.getProperty("debug", "false").trim()));
    }

    public static Settings load(Path path) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return fromProperties(properties);
    }

    // Never print the password.
    @Override
    public String toString() {
        return "Settings[controlPassword=" + (controlPassword == null ? "none" : "***") + ", reauthenticationDelay=" + reauthenticationDelay + ", keyRetries=" + keyRetries + ", debug=" + debug + ']';
    }

}
