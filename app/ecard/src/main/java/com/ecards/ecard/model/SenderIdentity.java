package com.ecards.ecard.model;

/** Authenticated sender as resolved from the bearer token claims. */
public record SenderIdentity(String email, String name) {}
