package com.ecards.ecard.service;

import com.ecards.ecard.model.PremadeTemplateRecord;
import com.ecards.ecard.repository.PremadeTemplateRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

// Premade artwork catalogue. Deleting only deactivates, so cards that reference a template keep it.
@Service
@RequiredArgsConstructor
public class PremadeTemplateService {

  private static final Logger logger = LoggerFactory.getLogger(PremadeTemplateService.class);

  private final PremadeTemplateRepository templateRepository;

  public List<PremadeTemplateRecord> listActive() {
    return templateRepository.findActive();
  }

  public PremadeTemplateRecord getActive(String templateId) {
    return templateRepository
        .findActiveById(templateId)
        .orElseThrow(() -> new TemplateNotFoundException(templateId));
  }

  public PremadeTemplateRecord create(PremadeTemplateRecord template) {
    final String templateId =
        template.templateId() == null || template.templateId().isBlank()
            ? UUID.randomUUID().toString()
            : template.templateId().trim();
    final PremadeTemplateRecord created =
        new PremadeTemplateRecord(
            templateId,
            template.name(),
            template.category(),
            template.iconEmoji(),
            template.description(),
            template.imagePath(),
            template.active(),
            template.sortOrder());
    templateRepository.insert(created);
    logger.info("premade template created templateId={}", templateId);
    return created;
  }

  public void update(String templateId, PremadeTemplateRecord template) {
    final PremadeTemplateRecord updated =
        new PremadeTemplateRecord(
            templateId,
            template.name(),
            template.category(),
            template.iconEmoji(),
            template.description(),
            template.imagePath(),
            template.active(),
            template.sortOrder());
    if (templateRepository.update(updated) == 0) {
      throw new TemplateNotFoundException(templateId);
    }
    logger.info("premade template updated templateId={}", templateId);
  }

  public void deactivate(String templateId) {
    if (templateRepository.deactivate(templateId) == 0) {
      throw new TemplateNotFoundException(templateId);
    }
    logger.info("premade template deactivated templateId={}", templateId);
  }
}
