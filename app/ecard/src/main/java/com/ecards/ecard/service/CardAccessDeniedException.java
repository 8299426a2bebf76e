package com.ecards.ecard.service;

import java.util.UUID;

public class CardAccessDeniedException extends RuntimeException {
  public CardAccessDeniedException(UUID cardId) {
    super("card does not belong to caller: " + cardId);
  }
}
