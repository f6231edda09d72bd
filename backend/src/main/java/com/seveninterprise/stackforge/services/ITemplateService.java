package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.model.Template;
import com.seveninterprise.stackforge.model.TemplateInstance;

import java.util.List;

/**
 * Interface for template operations
 *
 * @author levi
 */
public interface ITemplateService {

    /**
     * Lists all available templates
     * @return List of available templates
     */
    List<Template> listTemplates();

    /**
     * Gets a specific template by name
     * @param name Template name
     * @return Template instance or null if not found
     */
    Template getTemplateByName(String name);

    /**
     * Creates a new instance of a template: every service, volume, network,
     * config and secret of its docker-compose.yml gets the suffix, and the
     * result is written to {instances-dir}/{name}-{suffix}
     * @param name Template name
     * @param suffix Suffix to use, or null/blank for a random one
     * @return The created instance
     * @throws com.seveninterprise.stackforge.exceptions.TemplateNotFoundException if the template does not exist
     * @throws IllegalArgumentException if the suffix has characters other than letters, digits, "_", "." or "-"
     */
    TemplateInstance instantiateTemplate(String name, String suffix);
}
