package io.ration.error;

/** The client registry could not be reached. Callers fall back to conservative defaults. */
public class ClientRegistryUnavailableException extends Exception {
    public ClientRegistryUnavailableException(String message) {
        super(message);
    }

    public ClientRegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
