package io.todoflow.taskevents.broker;

/** Transient broker failure: connection loss, timeout, or a closed in-process broker. */
public class BrokerUnavailableException extends BrokerException {

  public BrokerUnavailableException(String message) {
    super(message);
  }

  public BrokerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
