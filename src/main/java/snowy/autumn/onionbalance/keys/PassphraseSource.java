package snowy.autumn.onionbalance.keys;

import snowy.autumn.onionbalance.DecryptionException;

import java.io.Console;
import java.util.concurrent.atomic.AtomicInteger;

/**
 Supplies the passphrase for an encrypted private key. Asked once per decryption attempt.
 **/
@FunctionalInterface
public interface PassphraseSource {

    char[] passphrase(String keyName, int attempt);

    static PassphraseSource console() {
        return (keyName, attempt) -> {
            Console console = System.console();
            if (console == null) throw new DecryptionException("No terminal available to ask for the passphrase of " + keyName + '.', attempt - 1);
            return console.readPassword("Enter the password for the private key (%s): ", keyName);
        };
    }

    // Hands out the given passphrases in order, then empty ones.
    static PassphraseSource of(String... passphrases) {
        AtomicInteger next = new AtomicInteger();
        return (keyName, attempt) -> {
            int index = next.getAndIncrement();
            return index < passphrases.length ? passphrases[index].toCharArray() : new char[0];
        };
    }

}
