/*
 * Where: eCard service layer
 * What: Creates cards and serves them to their senders
 * Why: Keeps sender dedup, artwork handling and the lifecycle policy in one place
 */
package com.ecards.ecard.service;

import com.ecards.ecard.artwork.ArtworkStore;
import com.ecards.ecard.artwork.StoredArtwork;
import com.ecards.ecard.config.CardStorageProperties;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.CardSchedule;
import com.ecards.ecard.model.CardWithSender;
import com.ecards.ecard.model.CreateCardCommand;
import com.ecards.ecard.model.ResendResult;
import com.ecards.ecard.model.SenderIdentity;
import com.ecards.ecard.model.SenderRecord;
import com.ecards.ecard.notification.NotificationSender;
import com.ecards.ecard.repository.CardRepository;
import com.ecards.ecard.repository.PremadeTemplateRepository;
import com.ecards.ecard.repository.SenderRepository;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

@Service
@RequiredArgsConstructor
public class CardService {

  private static final Logger logger = LoggerFactory.getLogger(CardService.class);

  private final CardRepository cardRepository;
  private final SenderRepository senderRepository;
  private final PremadeTemplateRepository templateRepository;
  private final ArtworkStore artworkStore;
  private final NotificationSender notificationSender;
  private final CardLifecyclePolicy lifecyclePolicy;
  private final CardStorageProperties storageProperties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Creates a card for the sender, registering the sender on first use.
   *
   * @param customArt optional upload; an empty part counts as absent
   * @throws InvalidCardRequestException when both artwork kinds are given or the upload is too large
   * @throws TemplateNotFoundException when the premade template is unknown or inactive
   */
  public CardRecord createCard(
      SenderIdentity identity, CreateCardCommand command, MultipartFile customArt) {
    final boolean hasUpload = customArt != null && !customArt.isEmpty();
    final String premadeArtId = blankToNull(command.premadeArtId());
    if (hasUpload && premadeArtId != null) {
      throw new InvalidCardRequestException("custom artwork and premade template are exclusive");
    }
    if (premadeArtId != null && templateRepository.findActiveById(premadeArtId).isEmpty()) {
      throw new TemplateNotFoundException(premadeArtId);
    }
    if (hasUpload && customArt.getSize() > storageProperties.maxUploadBytes()) {
      throw new InvalidCardRequestException(
          "custom artwork exceeds " + storageProperties.maxUploadBytes() + " bytes");
    }

    final String artPath = hasUpload ? storeArtwork(customArt) : null;
    final Instant now = Instant.now(clock);
    final CardSchedule schedule =
        lifecyclePolicy.computeInitialSchedule(command.scheduledSendDate(), now);
    try {
      final CardRecord created =
          transactionTemplate()
              .execute(
                  status -> {
                    final SenderRecord sender = findOrCreateSender(identity, now);
                    final CardRecord card =
                        new CardRecord(
                            UUID.randomUUID(),
                            sender.senderId(),
                            command.recipientName().trim(),
                            command.recipientEmail().trim(),
                            command.message(),
                            artPath,
                            premadeArtId,
                            schedule.scheduledSendDate(),
                            false,
                            null,
                            now,
                            null,
                            0,
                            schedule.expiryDate());
                    cardRepository.insert(card);
                    return card;
                  });
      logger.info(
          "ecard created cardId={} scheduled={} expiry={}",
          created.cardId(),
          created.scheduledSendDate(),
          created.expiryDate());
      return created;
    } catch (RuntimeException ex) {
      if (artPath != null) {
        discardArtwork(artPath);
      }
      throw ex;
    }
  }

  public CardWithSender getCard(UUID cardId) {
    return cardRepository
        .findWithSenderById(cardId)
        .orElseThrow(() -> new CardNotFoundException(cardId));
  }

  public List<CardRecord> listCardsForSender(String email) {
    return senderRepository
        .findByEmail(normalizeEmail(email))
        .map(sender -> cardRepository.findBySenderId(sender.senderId()))
        .orElse(List.of());
  }

  /**
   * Sends the notification again right away. Only the card's sender may do this.
   *
   * @throws CardAccessDeniedException when the requester is not the card's sender
   * @throws DeliveryFailedException when the notification could not be sent
   */
  public ResendResult resendCard(UUID cardId, String requesterEmail) {
    final CardWithSender item = getCard(cardId);
    if (!item.sender().email().equalsIgnoreCase(normalizeEmail(requesterEmail))) {
      throw new CardAccessDeniedException(cardId);
    }
    return resend(item);
  }

  ResendResult resend(CardWithSender item) {
    final UUID cardId = item.card().cardId();
    try {
      notificationSender.send(item.card(), item.sender());
    } catch (RuntimeException ex) {
      logger.error("ecard resend failed cardId={}", cardId, ex);
      throw new DeliveryFailedException(cardId, ex);
    }
    final Instant sentAt = Instant.now(clock);
    cardRepository.markResent(cardId, sentAt);
    logger.info("ecard resent cardId={} recipient={}", cardId, item.card().recipientEmail());
    return new ResendResult(cardId, sentAt);
  }

  public StoredArtwork openArtwork(UUID cardId) {
    final CardRecord card =
        cardRepository.findById(cardId).orElseThrow(() -> new CardNotFoundException(cardId));
    if (!card.hasCustomArt()) {
      throw new ArtworkNotFoundException(cardId);
    }
    return artworkStore
        .open(card.customArtPath())
        .orElseThrow(() -> new ArtworkNotFoundException(cardId));
  }

  private SenderRecord findOrCreateSender(SenderIdentity identity, Instant now) {
    final String email = normalizeEmail(identity.email());
    final SenderRecord candidate =
        new SenderRecord(UUID.randomUUID(), identity.name().trim(), email, now);
    if (senderRepository.insertIfAbsent(candidate)) {
      logger.info("ecard sender registered senderId={}", candidate.senderId());
      return candidate;
    }
    return senderRepository
        .findByEmail(email)
        .orElseThrow(() -> new IllegalStateException("sender vanished after upsert"));
  }

  private String storeArtwork(MultipartFile customArt) {
    try (InputStream in = customArt.getInputStream()) {
      return artworkStore.save(in, customArt.getOriginalFilename());
    } catch (IOException ex) {
      throw new InvalidCardRequestException("custom artwork upload could not be read", ex);
    }
  }

  private void discardArtwork(String artPath) {
    try {
      artworkStore.delete(artPath);
    } catch (RuntimeException cleanupFailure) {
      logger.warn("ecard artwork cleanup failed path={}", artPath, cleanupFailure);
    }
  }

  static String normalizeEmail(String email) {
    return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
