package com.ecards.ecard.api;

public record ApiErrorResponse(String code, String message) {}
