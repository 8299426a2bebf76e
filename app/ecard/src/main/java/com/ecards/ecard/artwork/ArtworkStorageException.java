package com.ecards.ecard.artwork;

public class ArtworkStorageException extends RuntimeException {

  public ArtworkStorageException(String message) {
    super(message);
  }

  public ArtworkStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
