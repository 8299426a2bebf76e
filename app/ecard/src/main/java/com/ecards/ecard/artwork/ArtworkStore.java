package com.ecards.ecard.artwork;

import java.io.InputStream;
import java.util.Optional;

/** Storage for uploaded card artwork, addressed by the path recorded on the card. */
public interface ArtworkStore {

  /**
   * Stores the upload under a unique name.
   *
   * @return the path to record on the card
   * @throws ArtworkStorageException when the content cannot be written
   */
  String save(InputStream content, String originalFilename);

  /** Returns the stored artwork, or empty when nothing exists at the path. */
  Optional<StoredArtwork> open(String path);

  /**
   * Removes the artwork. A path with no file behind it is not an error.
   *
   * @throws ArtworkStorageException when an existing file cannot be removed
   */
  void delete(String path);
}
