package com.seveninterprise.stackforge.controllers;

import com.seveninterprise.stackforge.dto.InstantiateTemplateRequest;
import com.seveninterprise.stackforge.model.Template;
import com.seveninterprise.stackforge.model.TemplateInstance;
import org.springframework.http.ResponseEntity;
import java.util.List;

/**
 * Interface for template controller operations
 * 
 * @author levi
 */
public interface ITemplateController {
    
    /**
     * Lists all available templates
     * @return ResponseEntity with list of templates
     */
    ResponseEntity<List<Template>> listTemplates();
    
    /**
     * Gets a specific template by name
     * @param name Template name
     * @return ResponseEntity with template or not found
     */
    ResponseEntity<Template> getTemplate(String name);

    /**
     * Creates a renamed instance of a template
     * @param name Template name
     * @param request Optional body with the suffix to use
     * @return ResponseEntity with the created instance
     */
    ResponseEntity<TemplateInstance> instantiateTemplate(String name, InstantiateTemplateRequest request);
}
