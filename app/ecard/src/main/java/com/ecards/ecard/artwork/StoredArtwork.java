package com.ecards.ecard.artwork;

import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;

public record StoredArtwork(Resource resource, MediaType contentType) {}
