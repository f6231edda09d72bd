package com.seveninterprise.stackforge.dto;

/**
 * DTO padronizado para respostas de erro da API
 * Garante que todas as respostas de erro sejam JSON válido
 */
public class ErrorResponse {
    private String message;
    private String error;
    private Integer status;
    
    public ErrorResponse() {}
    
    public ErrorResponse(String message, String error, Integer status) {
        this.message = message;
        this.error = error;
        this.status = status;
    }
    
    public String getMessage() {
        return message;
    }
    
    public void setMessage(String message) {
        this.message = message;
    }
    
    public String getError() {
        return error;
    }
    
    public void setError(String error) {
        this.error = error;
    }
    
    public Integer getStatus() {
        return status;
    }
    
    public void setStatus(Integer status) {
        this.status = status;
    }
}
