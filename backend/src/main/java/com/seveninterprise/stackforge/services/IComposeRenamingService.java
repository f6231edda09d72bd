package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.model.compose.ComposeDocument;
import com.seveninterprise.stackforge.model.compose.ResourceKind;

/**
 * Interface para renomeação de documentos compose
 *
 * Responsabilidades:
 * - Anexar um sufixo a serviços, volumes, redes, configs e secrets
 * - Manter todas as referências entre eles consistentes
 * - Nunca alterar o documento recebido (sempre retorna um novo)
 */
public interface IComposeRenamingService {

    /**
     * Gera um novo sufixo aleatório (8 caracteres hexadecimais)
     *
     * @return Sufixo gerado (ex: af045046)
     */
    String newSuffix();

    /**
     * Renomeia todos os recursos do documento com o mesmo sufixo
     *
     * Ordem aplicada:
     * - Nomes de serviços e referências entre serviços
     * - Referências a volumes, redes, configs e secrets nos serviços
     * - Seções volumes, networks, configs e secrets da raiz
     *
     * @param document Documento original
     * @param suffix Sufixo a anexar (ex: testhash gera web-testhash)
     * @return Novo documento renomeado
     */
    ComposeDocument renameAll(ComposeDocument document, String suffix);

    /**
     * Renomeia todos os recursos usando um sufixo gerado
     *
     * @param document Documento original
     * @return Novo documento renomeado
     */
    ComposeDocument renameAll(ComposeDocument document);

    /**
     * Renomeia apenas um tipo de recurso: a seção da raiz e as referências nos serviços.
     * Nomes de serviços e os demais tipos não mudam.
     *
     * @param document Documento original
     * @param kind Tipo de recurso (volumes, networks, configs ou secrets)
     * @param suffix Sufixo a anexar
     * @return Novo documento renomeado
     */
    ComposeDocument renameOneKind(ComposeDocument document, ResourceKind kind, String suffix);

    /**
     * Renomeia apenas os serviços e as referências entre eles
     * (depends_on, container_name, links, volumes_from, extends)
     *
     * @param document Documento original
     * @param suffix Sufixo a anexar
     * @return Novo documento renomeado
     */
    ComposeDocument renameServiceNames(ComposeDocument document, String suffix);
}
