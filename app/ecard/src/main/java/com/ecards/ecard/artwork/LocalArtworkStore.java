/*
 * Where: eCard artwork storage
 * What: Keeps uploaded artwork as files under one local directory
 * Why: Card rows only record a path; the sweeper removes the file when the card expires
 */
package com.ecards.ecard.artwork;

import com.ecards.ecard.config.CardStorageProperties;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalArtworkStore implements ArtworkStore {

  private static final Logger logger = LoggerFactory.getLogger(LocalArtworkStore.class);
  private static final String DEFAULT_FILENAME = "artwork";
  private static final int MAX_FILENAME_LENGTH = 200;

  private final Path root;

  public LocalArtworkStore(CardStorageProperties properties) {
    this.root = Paths.get(properties.customArtPath()).toAbsolutePath().normalize();
  }

  @Override
  public String save(InputStream content, String originalFilename) {
    final Path target = root.resolve(UUID.randomUUID() + "_" + safeFilename(originalFilename));
    try {
      Files.createDirectories(root);
      Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      throw new ArtworkStorageException("failed to store artwork path=" + target, ex);
    }
    logger.info("artwork stored path={}", target);
    return target.toString();
  }

  @Override
  public Optional<StoredArtwork> open(String path) {
    final Path file = resolveInsideRoot(path);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    final MediaType contentType =
        MediaTypeFactory.getMediaType(file.getFileName().toString())
            .orElse(MediaType.APPLICATION_OCTET_STREAM);
    return Optional.of(new StoredArtwork(new FileSystemResource(file), contentType));
  }

  @Override
  public void delete(String path) {
    final Path file = resolveInsideRoot(path);
    try {
      if (Files.deleteIfExists(file)) {
        logger.info("artwork deleted path={}", file);
      }
    } catch (IOException ex) {
      throw new ArtworkStorageException("failed to delete artwork path=" + file, ex);
    }
  }

  @VisibleForTesting
  Path root() {
    return root;
  }

  @VisibleForTesting
  static String safeFilename(String originalFilename) {
    if (originalFilename == null || originalFilename.isBlank()) {
      return DEFAULT_FILENAME;
    }
    // Browsers may send a full client path; only the last segment is kept.
    final String normalized = originalFilename.replace('\\', '/');
    final String base = normalized.substring(normalized.lastIndexOf('/') + 1);
    final String cleaned = base.replaceAll("[^A-Za-z0-9._-]", "_");
    if (cleaned.isBlank() || cleaned.chars().allMatch(c -> c == '.')) {
      return DEFAULT_FILENAME;
    }
    return cleaned.length() > MAX_FILENAME_LENGTH
        ? cleaned.substring(cleaned.length() - MAX_FILENAME_LENGTH)
        : cleaned;
  }

  private Path resolveInsideRoot(String path) {
    if (path == null || path.isBlank()) {
      throw new ArtworkStorageException("artwork path is blank");
    }
    final Path candidate = root.resolve(path).toAbsolutePath().normalize();
    if (!candidate.startsWith(root)) {
      throw new ArtworkStorageException("artwork path outside storage root path=" + path);
    }
    return candidate;
  }
}
