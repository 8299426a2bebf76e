/*
 * Where: eCard domain model
 * What: Snapshot of one row of the premade_templates table
 * Why: Cards reference premade artwork by template id
 */
package com.ecards.ecard.model;

public record PremadeTemplateRecord(
    String templateId,
    String name,
    String category,
    String iconEmoji,
    String description,
    String imagePath,
    boolean active,
    int sortOrder) {}
