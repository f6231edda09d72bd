package com.seveninterprise.stackforge.model;

import java.util.List;

/**
 * A renamed copy of a template, written to its own directory so it can be
 * deployed next to other instances of the same template
 */
public class TemplateInstance {

    private String templateName;
    private String instanceName;
    private String suffix;
    private String path;
    private List<String> services;

    public TemplateInstance() {}

    public TemplateInstance(String templateName, String instanceName, String suffix, String path, List<String> services) {
        this.templateName = templateName;
        this.instanceName = instanceName;
        this.suffix = suffix;
        this.path = path;
        this.services = services;
    }

    public String getTemplateName() {
        return templateName;
    }

    public void setTemplateName(String templateName) {
        this.templateName = templateName;
    }

    /**
     * {templateName}-{suffix}
     */
    public String getInstanceName() {
        return instanceName;
    }

    public void setInstanceName(String instanceName) {
        this.instanceName = instanceName;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getServices() {
        return services;
    }

    public void setServices(List<String> services) {
        this.services = services;
    }
}
