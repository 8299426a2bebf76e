package com.ecards.ecard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ecards.ecard.model.PremadeTemplateRecord;
import com.ecards.ecard.repository.PremadeTemplateRepository;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PremadeTemplateServiceTest {

  @Mock private PremadeTemplateRepository templateRepository;

  @InjectMocks private PremadeTemplateService service;

  @Test
  void createGeneratesIdWhenBlank() {
    final PremadeTemplateRecord created = service.create(template(" "));

    assertThat(created.templateId()).isNotBlank().hasSize(36);
    verify(templateRepository).insert(created);
  }

  @Test
  void createKeepsGivenIdTrimmed() {
    final PremadeTemplateRecord created = service.create(template(" balloons "));

    assertThat(created.templateId()).isEqualTo("balloons");
  }

  @Test
  void updateUsesPathId() {
    when(templateRepository.update(any(PremadeTemplateRecord.class))).thenReturn(1);

    service.update("balloons", template("ignored"));

    final ArgumentCaptor<PremadeTemplateRecord> captor =
        ArgumentCaptor.forClass(PremadeTemplateRecord.class);
    verify(templateRepository).update(captor.capture());
    assertThat(captor.getValue().templateId()).isEqualTo("balloons");
    assertThat(captor.getValue().name()).isEqualTo("Balloons");
  }

  @Test
  void updateOfUnknownTemplateIsNotFound() {
    when(templateRepository.update(any(PremadeTemplateRecord.class))).thenReturn(0);

    assertThatThrownBy(() -> service.update("nope", template("nope")))
        .isInstanceOf(TemplateNotFoundException.class);
  }

  @Test
  void deactivateOfUnknownTemplateIsNotFound() {
    when(templateRepository.deactivate("nope")).thenReturn(0);

    assertThatThrownBy(() -> service.deactivate("nope"))
        .isInstanceOf(TemplateNotFoundException.class);
  }

  @Test
  void inactiveTemplateIsNotServed() {
    when(templateRepository.findActiveById("retired")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getActive("retired"))
        .isInstanceOf(TemplateNotFoundException.class);
  }

  private static PremadeTemplateRecord template(String templateId) {
    return new PremadeTemplateRecord(
        templateId, "Balloons", "birthday", "B", "Colourful balloons", null, true, 10);
  }
}
