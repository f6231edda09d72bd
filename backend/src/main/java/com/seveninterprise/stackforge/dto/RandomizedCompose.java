package com.seveninterprise.stackforge.dto;

import java.util.List;

/**
 * Resultado da renomeação de um arquivo docker-compose.yml
 */
public class RandomizedCompose {

    private String composeFile;
    private String suffix;
    private List<String> services;
    private String envContent;

    public RandomizedCompose() {}

    public RandomizedCompose(String composeFile, String suffix, List<String> services) {
        this.composeFile = composeFile;
        this.suffix = suffix;
        this.services = services;
    }

    public String getComposeFile() {
        return composeFile;
    }

    public void setComposeFile(String composeFile) {
        this.composeFile = composeFile;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Nomes dos serviços após a renomeação, na ordem do arquivo
     */
    public List<String> getServices() {
        return services;
    }

    public void setServices(List<String> services) {
        this.services = services;
    }

    public String getEnvContent() {
        return envContent;
    }

    public void setEnvContent(String envContent) {
        this.envContent = envContent;
    }
}
