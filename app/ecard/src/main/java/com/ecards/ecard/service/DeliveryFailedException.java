package com.ecards.ecard.service;

import java.util.UUID;

public class DeliveryFailedException extends RuntimeException {
  public DeliveryFailedException(UUID cardId, Throwable cause) {
    super("card delivery failed: " + cardId, cause);
  }
}
