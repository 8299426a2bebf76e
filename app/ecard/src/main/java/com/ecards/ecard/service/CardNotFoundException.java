package com.ecards.ecard.service;

import java.util.UUID;

public class CardNotFoundException extends RuntimeException {
  public CardNotFoundException(UUID cardId) {
    super("card not found: " + cardId);
  }
}
