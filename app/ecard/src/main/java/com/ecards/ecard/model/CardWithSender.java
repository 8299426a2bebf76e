package com.ecards.ecard.model;

/** A card joined with its owning sender, as read by delivery and detail queries. */
public record CardWithSender(CardRecord card, SenderRecord sender) {}
