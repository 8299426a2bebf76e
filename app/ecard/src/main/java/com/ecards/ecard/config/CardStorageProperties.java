/*
 * Where: eCard configuration binding
 * What: Location and size limit for uploaded card artwork
 */
package com.ecards.ecard.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "ecard.storage")
@Validated
public record CardStorageProperties(
    @NotBlank String customArtPath,
    @Positive @DefaultValue("5242880") long maxUploadBytes) {}
