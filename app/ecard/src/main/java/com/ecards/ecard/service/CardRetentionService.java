/*
 * Where: eCard service layer
 * What: Purges expired cards, their view records (by cascade) and uploaded artwork
 * Why: Cards are only kept for their retention window
 */
package com.ecards.ecard.service;

import com.ecards.ecard.artwork.ArtworkStore;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.repository.CardRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class CardRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(CardRetentionService.class);

  private final CardRepository cardRepository;
  private final ArtworkStore artworkStore;
  private final CardMetrics metrics;
  private final WorkerShutdownSignal shutdownSignal;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public RetentionSweepResult runRetentionSweep() {
    if (shutdownSignal.isStopping()) {
      logger.info("card retention sweep skipped because shutdown is in progress");
      return RetentionSweepResult.empty();
    }
    final Instant now = Instant.now(clock);
    final List<CardRecord> expired = cardRepository.findExpired(now);
    if (expired.isEmpty()) {
      logger.debug("card retention sweep found nothing to purge now={}", now);
      return RetentionSweepResult.empty();
    }

    final Map<UUID, CardRecord> candidates = new LinkedHashMap<>();
    expired.forEach(card -> candidates.put(card.cardId(), card));
    // Expiry is checked again by the delete; a view committed since the select keeps its card.
    final List<UUID> candidateIds = List.copyOf(candidates.keySet());
    final List<UUID> deletedIds =
        transactionTemplate()
            .execute(status -> cardRepository.deleteExpiredByIds(candidateIds, now));
    final List<UUID> deleted = deletedIds == null ? List.of() : deletedIds;

    int artworkFailures = 0;
    for (UUID cardId : deleted) {
      final CardRecord card = candidates.get(cardId);
      if (card != null && !deleteArtworkQuietly(card)) {
        artworkFailures++;
      }
    }

    metrics.recordPurged(deleted.size());
    if (deleted.size() < expired.size()) {
      logger.info(
          "card retention sweep kept cards no longer expired count={}",
          expired.size() - deleted.size());
    }
    logger.info(
        "card retention sweep deleted cards={} selected={} artworkFailures={} now={}",
        deleted.size(),
        expired.size(),
        artworkFailures,
        now);
    return new RetentionSweepResult(expired.size(), deleted.size(), artworkFailures);
  }

  /** Returns false when the artwork exists but could not be removed. The row is gone either way. */
  boolean deleteArtworkQuietly(CardRecord card) {
    if (!card.hasCustomArt()) {
      return true;
    }
    try {
      artworkStore.delete(card.customArtPath());
      return true;
    } catch (RuntimeException ex) {
      metrics.recordArtworkFailure();
      logger.warn(
          "card artwork delete failed cardId={} path={}", card.cardId(), card.customArtPath(), ex);
      return false;
    }
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
