package com.seveninterprise.stackforge.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Requisição de renomeação de um arquivo docker-compose.yml
 *
 * suffix é opcional: quando vazio um sufixo aleatório é gerado.
 * env é opcional: conteúdo do .env que receberá a variável com o sufixo.
 */
public class RenameComposeRequest {

    @NotBlank(message = "composeFile é obrigatório")
    private String composeFile;

    @Pattern(regexp = "^[a-zA-Z0-9_.-]*$", message = "suffix deve conter apenas letras, números, '.', '_' ou '-'")
    private String suffix;

    private String env;

    public RenameComposeRequest() {}

    public RenameComposeRequest(String composeFile, String suffix) {
        this.composeFile = composeFile;
        this.suffix = suffix;
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

    public String getEnv() {
        return env;
    }

    public void setEnv(String env) {
        this.env = env;
    }
}
