package com.ecards.ecard.api;

import com.ecards.ecard.api.response.TemplateResponse;
import com.ecards.ecard.service.PremadeTemplateService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/templates")
@RequiredArgsConstructor
public class TemplateController {

  private final PremadeTemplateService templateService;

  @GetMapping
  public List<TemplateResponse> list() {
    return templateService.listActive().stream().map(TemplateResponse::from).toList();
  }

  @GetMapping("/{templateId}")
  public TemplateResponse get(@PathVariable("templateId") String templateId) {
    return TemplateResponse.from(templateService.getActive(templateId));
  }
}
