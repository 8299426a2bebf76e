/*
 * Where: eCard admin API
 * What: Operator endpoints for cards, view records and the template catalogue
 * Why: Restricted to the admin role by the security filter chain
 */
package com.ecards.ecard.api;

import com.ecards.ecard.api.request.TemplateRequest;
import com.ecards.ecard.api.response.CardResponse;
import com.ecards.ecard.api.response.ResendResponse;
import com.ecards.ecard.api.response.TemplateResponse;
import com.ecards.ecard.api.response.ViewRecordResponse;
import com.ecards.ecard.model.PremadeTemplateRecord;
import com.ecards.ecard.service.AdminCardService;
import com.ecards.ecard.service.PremadeTemplateService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class AdminController {

  private final AdminCardService adminCardService;
  private final PremadeTemplateService templateService;

  @GetMapping("/ecards")
  public List<CardResponse> cards(@RequestParam(name = "take", defaultValue = "100") int take) {
    return adminCardService.listRecentCards(take).stream().map(CardResponse::from).toList();
  }

  @GetMapping("/view-records")
  public List<ViewRecordResponse> viewRecords(
      @RequestParam(name = "take", defaultValue = "200") int take) {
    return adminCardService.listRecentViewRecords(take).stream()
        .map(ViewRecordResponse::from)
        .toList();
  }

  @PostMapping("/ecards/{cardId}/resend")
  public ResendResponse resend(@PathVariable("cardId") UUID cardId) {
    return ResendResponse.from(adminCardService.resendCard(cardId));
  }

  @DeleteMapping("/ecards/{cardId}")
  public ResponseEntity<Void> delete(@PathVariable("cardId") UUID cardId) {
    adminCardService.deleteCard(cardId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/templates")
  public List<TemplateResponse> templates() {
    return templateService.listActive().stream().map(TemplateResponse::from).toList();
  }

  @PostMapping("/templates")
  public ResponseEntity<TemplateResponse> createTemplate(
      @RequestBody @Valid TemplateRequest request) {
    final PremadeTemplateRecord created = templateService.create(request.toRecord());
    return ResponseEntity.created(URI.create("/v1/templates/" + created.templateId()))
        .body(TemplateResponse.from(created));
  }

  @PutMapping("/templates/{templateId}")
  public ResponseEntity<Void> updateTemplate(
      @PathVariable("templateId") String templateId, @RequestBody @Valid TemplateRequest request) {
    templateService.update(templateId, request.toRecord());
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/templates/{templateId}")
  public ResponseEntity<Void> deleteTemplate(@PathVariable("templateId") String templateId) {
    templateService.deactivate(templateId);
    return ResponseEntity.noContent().build();
  }
}
