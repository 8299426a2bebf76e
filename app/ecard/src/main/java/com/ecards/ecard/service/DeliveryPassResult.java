package com.ecards.ecard.service;

public record DeliveryPassResult(int selected, int sent, int failed, int marked) {

  public static DeliveryPassResult empty() {
    return new DeliveryPassResult(0, 0, 0, 0);
  }
}
