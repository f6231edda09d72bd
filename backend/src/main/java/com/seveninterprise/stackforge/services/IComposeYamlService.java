package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.model.compose.ComposeDocument;

/**
 * Interface para leitura e escrita de arquivos docker-compose.yml
 */
public interface IComposeYamlService {

    /**
     * Converte o conteúdo YAML em documento estruturado
     *
     * @param composeContent Conteúdo do arquivo docker-compose.yml
     * @return Documento estruturado
     * @throws com.seveninterprise.stackforge.exceptions.ComposeException se o YAML for inválido
     */
    ComposeDocument parse(String composeContent);

    /**
     * Serializa o documento de volta para YAML
     *
     * @param document Documento estruturado
     * @return Conteúdo YAML
     */
    String write(ComposeDocument document);
}
