package com.ecards.ecard.model;

/** Request details captured alongside a view; both fields may be null. */
public record ViewContext(String ipAddress, String userAgent) {

  public static ViewContext empty() {
    return new ViewContext(null, null);
  }
}
