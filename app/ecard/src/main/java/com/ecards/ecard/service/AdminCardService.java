/*
 * Where: eCard service layer
 * What: Operator views over all cards and view records, plus resend and delete
 * Why: Support staff need to inspect and correct cards regardless of owner
 */
package com.ecards.ecard.service;

import com.ecards.ecard.artwork.ArtworkStore;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.CardWithSender;
import com.ecards.ecard.model.ResendResult;
import com.ecards.ecard.model.ViewRecord;
import com.ecards.ecard.repository.CardRepository;
import com.ecards.ecard.repository.ViewRecordRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AdminCardService {

  private static final Logger logger = LoggerFactory.getLogger(AdminCardService.class);

  static final int MAX_TAKE = 1000;

  private final CardRepository cardRepository;
  private final ViewRecordRepository viewRecordRepository;
  private final ArtworkStore artworkStore;
  private final CardService cardService;

  public List<CardWithSender> listRecentCards(int take) {
    return cardRepository.findRecentWithSender(clampTake(take));
  }

  public List<ViewRecord> listRecentViewRecords(int take) {
    return viewRecordRepository.findRecent(clampTake(take));
  }

  public ResendResult resendCard(UUID cardId) {
    final ResendResult result = cardService.resend(cardService.getCard(cardId));
    logger.info("ecard resent by admin cardId={}", cardId);
    return result;
  }

  /**
   * Removes the card and its view records. The artwork file is removed first on a best-effort
   * basis; a failure there is logged and does not keep the card.
   */
  @Transactional
  public void deleteCard(UUID cardId) {
    final CardRecord card =
        cardRepository.findById(cardId).orElseThrow(() -> new CardNotFoundException(cardId));
    if (card.hasCustomArt()) {
      try {
        artworkStore.delete(card.customArtPath());
      } catch (RuntimeException ex) {
        logger.warn(
            "ecard artwork delete failed cardId={} path={}", cardId, card.customArtPath(), ex);
      }
    }
    viewRecordRepository.deleteByCardIds(List.of(cardId));
    cardRepository.deleteByIds(List.of(cardId));
    logger.info("ecard deleted by admin cardId={}", cardId);
  }

  static int clampTake(int take) {
    if (take < 1) {
      return 1;
    }
    return Math.min(take, MAX_TAKE);
  }
}
