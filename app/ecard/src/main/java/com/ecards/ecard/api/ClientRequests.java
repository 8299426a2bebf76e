package com.ecards.ecard.api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/** Extracts caller details from a servlet request behind a reverse proxy. */
public final class ClientRequests {
  private ClientRequests() {}

  public static String clientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }

  public static String userAgent(HttpServletRequest request) {
    final String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
    return userAgent == null || userAgent.isBlank() ? null : userAgent;
  }
}
