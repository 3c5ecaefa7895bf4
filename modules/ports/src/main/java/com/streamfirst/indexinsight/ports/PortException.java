package com.streamfirst.indexinsight.ports;

/**
 * Raised by adapters when the system behind a port fails: unreadable files, unreachable
 * clusters, rejected requests.
 */
public class PortException extends RuntimeException {

  public PortException(String message) {
    super(message);
  }

  public PortException(String message, Throwable cause) {
    super(message, cause);
  }
}
