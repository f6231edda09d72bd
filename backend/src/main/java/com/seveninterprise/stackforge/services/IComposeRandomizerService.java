package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.dto.RandomizedCompose;

/**
 * Interface para gerar cópias de um docker-compose.yml que podem ser
 * implantadas várias vezes sem colisão de nomes no Docker
 */
public interface IComposeRandomizerService {

    /**
     * Renomeia serviços, volumes, redes, configs e secrets do arquivo
     *
     * Nenhuma rede compartilhada é adicionada aos serviços.
     *
     * @param composeFile Conteúdo do arquivo docker-compose.yml
     * @param suffix Sufixo desejado; se vazio, um sufixo aleatório é gerado
     * @return Arquivo renomeado, sufixo usado e nomes dos serviços
     */
    RandomizedCompose randomizeComposeFile(String composeFile, String suffix);

    /**
     * Renomeia apenas uma família de recursos
     *
     * @param composeFile Conteúdo do arquivo docker-compose.yml
     * @param scope services, volumes, networks, configs ou secrets
     * @param suffix Sufixo desejado; se vazio, um sufixo aleatório é gerado
     * @return Arquivo renomeado, sufixo usado e nomes dos serviços
     * @throws IllegalArgumentException se o escopo for desconhecido
     */
    RandomizedCompose renameComposeFile(String composeFile, String scope, String suffix);

    /**
     * Adiciona ao conteúdo do .env a variável com o sufixo (ex: COMPOSE_PREFIX=af045046),
     * substituindo uma definição anterior da mesma variável
     *
     * @param env Conteúdo atual do .env (pode ser null)
     * @param suffix Sufixo usado na renomeação
     * @return Novo conteúdo do .env
     */
    String buildEnvContent(String env, String suffix);
}
