package snowy.autumn.onionbalance.client;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class Logger {

    private static final DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH_mm_ss_N")
            .withZone(ZoneOffset.UTC);

    OutputStream outputStream;
    boolean debug;

    public Logger(boolean debug) {
        this.debug = debug;
        if (debug) {
            try {
                File file = new File("onionbalance_" + formatter.format(Instant.now()) + ".log");
                if (!file.exists()) {
                    if (!file.createNewFile()) throw new IOException("Unable to create log file " + file.getName() + '.');
                }
                outputStream = new FileOutputStream(file);
                info("Logger initialised.");
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    /**
     Logs to the given stream instead of a file. Always enabled.
     **/
    public Logger(OutputStream outputStream) {
        this.debug = true;
        this.outputStream = outputStream;
    }

    public static Logger disabled() {
        return new Logger(false);
    }

    public synchronized void log(String priority, String message) {
        if (!debug) return;
        try {
            outputStream.write(('[' + LocalDateTime.now().format(DateTimeFormatter.ofPattern("HH:mm:ss")) + "] [" + priority + "] " + message + '\n').getBytes(StandardCharsets.UTF_8));
            outputStream.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warning(String message) {
        log("WARNING", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void close() {
        if (outputStream == null) return;
        try {
            outputStream.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
