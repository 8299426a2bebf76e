/*
 * Where: eCard API
 * What: Card creation, sender views, public recipient view and artwork download
 * Why: Thin HTTP layer over CardService and CardViewService
 */
package com.ecards.ecard.api;

import com.ecards.ecard.api.request.CreateCardRequest;
import com.ecards.ecard.api.response.CardResponse;
import com.ecards.ecard.api.response.CardViewResponse;
import com.ecards.ecard.api.response.ConfigResponse;
import com.ecards.ecard.api.response.ResendResponse;
import com.ecards.ecard.artwork.StoredArtwork;
import com.ecards.ecard.config.CardNotificationProperties;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.CardWithSender;
import com.ecards.ecard.model.SenderIdentity;
import com.ecards.ecard.model.ViewContext;
import com.ecards.ecard.service.CardService;
import com.ecards.ecard.service.CardViewService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1/ecards")
@RequiredArgsConstructor
public class CardController {

  private final CardService cardService;
  private final CardViewService cardViewService;
  private final SenderIdentityResolver identityResolver;
  private final CardNotificationProperties notificationProperties;

  @GetMapping("/config")
  public ConfigResponse config() {
    return new ConfigResponse(notificationProperties.appName());
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<CardResponse> create(
      Authentication authentication,
      @RequestPart("card") @Valid CreateCardRequest request,
      @RequestPart(value = "custom_art", required = false) MultipartFile customArt) {
    final SenderIdentity identity = identityResolver.resolve(authentication);
    final CardRecord card = cardService.createCard(identity, request.toCommand(), customArt);
    return ResponseEntity.created(URI.create("/v1/ecards/" + card.cardId()))
        .body(CardResponse.from(card));
  }

  @GetMapping("/mine")
  public List<CardResponse> mine(Authentication authentication) {
    final SenderIdentity identity = identityResolver.resolve(authentication);
    return cardService.listCardsForSender(identity.email()).stream()
        .map(CardResponse::from)
        .toList();
  }

  @GetMapping("/{cardId}")
  public CardResponse get(@PathVariable("cardId") UUID cardId) {
    return CardResponse.from(cardService.getCard(cardId));
  }

  @GetMapping("/{cardId}/view")
  public CardViewResponse view(@PathVariable("cardId") UUID cardId, HttpServletRequest request) {
    final ViewContext context =
        new ViewContext(ClientRequests.clientIp(request), ClientRequests.userAgent(request));
    final CardRecord viewed = cardViewService.recordView(cardId, context);
    final CardWithSender item = cardService.getCard(cardId);
    return new CardViewResponse(
        viewed.cardId(),
        notificationProperties.appName(),
        viewed.recipientName(),
        viewed.message(),
        item.sender().name(),
        item.sender().email(),
        viewed.premadeArtId(),
        viewed.hasCustomArt() ? "/v1/ecards/" + viewed.cardId() + "/art" : null,
        viewed.viewCount(),
        viewed.expiryDate());
  }

  @GetMapping("/{cardId}/art")
  public ResponseEntity<Resource> art(@PathVariable("cardId") UUID cardId) {
    final StoredArtwork artwork = cardService.openArtwork(cardId);
    return ResponseEntity.ok().contentType(artwork.contentType()).body(artwork.resource());
  }

  @PostMapping("/{cardId}/resend")
  public ResendResponse resend(
      Authentication authentication, @PathVariable("cardId") UUID cardId) {
    final SenderIdentity identity = identityResolver.resolve(authentication);
    return ResendResponse.from(cardService.resendCard(cardId, identity.email()));
  }
}
