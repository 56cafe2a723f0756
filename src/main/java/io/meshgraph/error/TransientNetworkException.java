package io.meshgraph.error;

public class TransientNetworkException extends RuntimeException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
