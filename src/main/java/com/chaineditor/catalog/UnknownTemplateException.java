package com.chaineditor.catalog;

public class UnknownTemplateException extends RuntimeException {

    private final String templateId;

    public UnknownTemplateException(String templateId) {
        super("Template not found: " + templateId);
        this.templateId = templateId;
    }

    public String getTemplateId() {
        return templateId;
    }
}
