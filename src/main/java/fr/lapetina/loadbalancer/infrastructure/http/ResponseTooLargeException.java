package fr.lapetina.loadbalancer.infrastructure.http;

import java.io.IOException;

/**
 * A backend answered with a body larger than the proxy is willing to buffer.
 */
public final class ResponseTooLargeException extends IOException {

    public ResponseTooLargeException(String backend, int maxBytes) {
        super("Response from " + backend + " exceeds " + maxBytes + " bytes");
    }
}
