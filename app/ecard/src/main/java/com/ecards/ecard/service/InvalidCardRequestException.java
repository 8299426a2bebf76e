/*
 * Where: eCard service layer
 * What: A card request that cannot be fulfilled as given
 * Why: Normalized to 400 by the API layer
 */
package com.ecards.ecard.service;

public class InvalidCardRequestException extends RuntimeException {
  public InvalidCardRequestException(String message) {
    super(message);
  }

  public InvalidCardRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
