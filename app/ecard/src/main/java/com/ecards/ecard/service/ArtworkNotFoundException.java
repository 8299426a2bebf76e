package com.ecards.ecard.service;

import java.util.UUID;

public class ArtworkNotFoundException extends RuntimeException {
  public ArtworkNotFoundException(UUID cardId) {
    super("no custom artwork for card: " + cardId);
  }
}
