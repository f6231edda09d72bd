package com.seveninterprise.stackforge.dto;

import jakarta.validation.constraints.Pattern;

/**
 * Request body for creating a new instance of a template
 */
public class InstantiateTemplateRequest {

    @Pattern(regexp = "^[a-zA-Z0-9_.-]*$", message = "suffix must contain only letters, digits, '.', '_' or '-'")
    private String suffix;

    public InstantiateTemplateRequest() {}

    public InstantiateTemplateRequest(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }
}
