package dev.quickpick.preferences;

/** Thrown when the preference store cannot be read or written. */
public class PreferenceStoreException extends RuntimeException {

  public PreferenceStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
