package com.seveninterprise.stackforge.compose;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Gera o sufixo usado em uma renomeação: 8 caracteres hexadecimais
 * minúsculos a partir de 4 bytes aleatórios.
 */
@Component
public class SuffixTokenGenerator {

    private static final int TOKEN_BYTES = 4;

    private final SecureRandom random = new SecureRandom();

    public String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);

        StringBuilder token = new StringBuilder(TOKEN_BYTES * 2);
        for (byte b : bytes) {
            token.append(String.format("%02x", b & 0xff));
        }
        return token.toString();
    }
}
