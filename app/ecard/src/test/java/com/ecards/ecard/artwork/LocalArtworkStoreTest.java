package com.ecards.ecard.artwork;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ecards.ecard.config.CardStorageProperties;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;

class LocalArtworkStoreTest {

  @TempDir Path tempDir;

  private LocalArtworkStore store;

  @BeforeEach
  void setUp() {
    store = new LocalArtworkStore(new CardStorageProperties(tempDir.resolve("art").toString(), 1024));
  }

  @Test
  void saveOpenAndDelete() throws Exception {
    final String path = store.save(content("png-bytes"), "birthday.png");

    assertThat(Path.of(path)).exists().hasParent(store.root());
    assertThat(Path.of(path).getFileName().toString()).endsWith("_birthday.png");

    final Optional<StoredArtwork> opened = store.open(path);
    assertThat(opened).isPresent();
    assertThat(opened.get().contentType()).isEqualTo(MediaType.IMAGE_PNG);
    try (InputStream in = opened.get().resource().getInputStream()) {
      assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("png-bytes");
    }

    store.delete(path);

    assertThat(Path.of(path)).doesNotExist();
    assertThat(store.open(path)).isEmpty();
  }

  @Test
  void deletingMissingFileIsNotAnError() {
    store.delete(store.root().resolve("gone.png").toString());
  }

  @Test
  void pathsOutsideRootAreRejected() throws Exception {
    final Path outside = Files.writeString(tempDir.resolve("secret.txt"), "x");

    assertThatThrownBy(() -> store.open(outside.toString()))
        .isInstanceOf(ArtworkStorageException.class);
    assertThatThrownBy(() -> store.delete("../secret.txt"))
        .isInstanceOf(ArtworkStorageException.class);
    assertThat(outside).exists();
  }

  @Test
  void blankPathIsRejected() {
    assertThatThrownBy(() -> store.delete(" ")).isInstanceOf(ArtworkStorageException.class);
  }

  @Test
  void unknownExtensionFallsBackToOctetStream() {
    final String path = store.save(content("data"), "card.unknownext");

    assertThat(store.open(path)).get().extracting(StoredArtwork::contentType)
        .isEqualTo(MediaType.APPLICATION_OCTET_STREAM);
  }

  @Test
  void filenamesAreSanitized() {
    assertThat(LocalArtworkStore.safeFilename("C:\\Users\\bob\\my card!.png")).isEqualTo("my_card_.png");
    assertThat(LocalArtworkStore.safeFilename("../../etc/passwd")).isEqualTo("passwd");
    assertThat(LocalArtworkStore.safeFilename("..")).isEqualTo("artwork");
    assertThat(LocalArtworkStore.safeFilename(null)).isEqualTo("artwork");
    assertThat(LocalArtworkStore.safeFilename("a".repeat(300) + ".png")).hasSize(200).endsWith(".png");
  }

  private static InputStream content(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }
}
