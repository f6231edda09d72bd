package com.seveninterprise.stackforge.exceptions;

/**
 * Template solicitado não existe no diretório de templates
 */
public class TemplateNotFoundException extends ComposeException {

    public TemplateNotFoundException(String templateName) {
        super("Template não encontrado: " + templateName);
    }
}
