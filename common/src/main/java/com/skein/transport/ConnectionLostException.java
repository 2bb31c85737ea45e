package com.skein.transport;

/**
 * The relay stream can no longer deliver frames: I/O failure, protocol violation,
 * close frame or idle timeout.  Callers reconnect from the last committed cursor.
 */
public class ConnectionLostException extends Exception {

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
