package com.ecards.ecard.service;

public class TemplateNotFoundException extends RuntimeException {
  public TemplateNotFoundException(String templateId) {
    super("template not found: " + templateId);
  }
}
