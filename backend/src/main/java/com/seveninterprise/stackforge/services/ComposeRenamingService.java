package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.compose.RootSectionRenamer;
import com.seveninterprise.stackforge.compose.ServiceNameRenamer;
import com.seveninterprise.stackforge.compose.ServiceReferenceRewriter;
import com.seveninterprise.stackforge.compose.SuffixTokenGenerator;
import com.seveninterprise.stackforge.model.compose.ComposeDocument;
import com.seveninterprise.stackforge.model.compose.ResourceKind;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Serviço de renomeação de documentos compose
 *
 * Compõe os renomeadores da raiz, de serviços e os reescritores de
 * referências usando sempre o mesmo sufixo, para que toda referência
 * continue apontando para o recurso renomeado.
 */
@Service
public class ComposeRenamingService implements IComposeRenamingService {

    private static final Logger logger = LoggerFactory.getLogger(ComposeRenamingService.class);

    private final SuffixTokenGenerator tokenGenerator;
    private final RootSectionRenamer rootSectionRenamer;
    private final ServiceNameRenamer serviceNameRenamer;
    private final Map<ResourceKind, ServiceReferenceRewriter> rewriters = new EnumMap<>(ResourceKind.class);
    private final Set<String> preservedNetworks;

    public ComposeRenamingService(SuffixTokenGenerator tokenGenerator,
                                  RootSectionRenamer rootSectionRenamer,
                                  ServiceNameRenamer serviceNameRenamer,
                                  List<ServiceReferenceRewriter> rewriters,
                                  @Value("${stackforge.compose.preserved-networks:}") String preservedNetworks) {
        this.tokenGenerator = tokenGenerator;
        this.rootSectionRenamer = rootSectionRenamer;
        this.serviceNameRenamer = serviceNameRenamer;
        for (ServiceReferenceRewriter rewriter : rewriters) {
            this.rewriters.put(rewriter.getKind(), rewriter);
        }
        for (ResourceKind kind : ResourceKind.values()) {
            if (!this.rewriters.containsKey(kind)) {
                throw new IllegalStateException("Nenhum reescritor registrado para " + kind.getKey());
            }
        }
        this.preservedNetworks = parseNames(preservedNetworks);
    }

    @Override
    public String newSuffix() {
        return tokenGenerator.newToken();
    }

    @Override
    public ComposeDocument renameAll(ComposeDocument document, String suffix) {
        requireSuffix(suffix);
        ComposeDocument result = document.copy();

        Map<String, ServiceDefinition> services = serviceNameRenamer.renameServices(result.getServices(), suffix);
        for (ResourceKind kind : ResourceKind.values()) {
            services = rewriters.get(kind).rewrite(services, suffix, preservedNames(kind));
        }
        if (services != null) {
            result.setServices(services);
        }

        for (ResourceKind kind : ResourceKind.values()) {
            renameSection(result, kind, suffix);
        }

        logger.info("Documento compose renomeado com sufixo {} ({} serviços)", suffix,
            services != null ? services.size() : 0);
        return result;
    }

    @Override
    public ComposeDocument renameAll(ComposeDocument document) {
        return renameAll(document, newSuffix());
    }

    @Override
    public ComposeDocument renameOneKind(ComposeDocument document, ResourceKind kind, String suffix) {
        requireSuffix(suffix);
        if (kind == null) {
            throw new IllegalArgumentException("Tipo de recurso é obrigatório");
        }
        ComposeDocument result = document.copy();

        Map<String, ServiceDefinition> services = rewriters.get(kind).rewrite(result.getServices(), suffix, preservedNames(kind));
        if (services != null) {
            result.setServices(services);
        }
        renameSection(result, kind, suffix);

        logger.info("Seção {} renomeada com sufixo {}", kind.getKey(), suffix);
        return result;
    }

    @Override
    public ComposeDocument renameServiceNames(ComposeDocument document, String suffix) {
        requireSuffix(suffix);
        ComposeDocument result = document.copy();

        Map<String, ServiceDefinition> services = serviceNameRenamer.renameServices(result.getServices(), suffix);
        if (services != null) {
            result.setServices(services);
        }

        logger.info("Serviços renomeados com sufixo {}", suffix);
        return result;
    }

    private void renameSection(ComposeDocument document, ResourceKind kind, String suffix) {
        Map<String, Object> section = document.getSection(kind);
        if (section == null) {
            return;
        }
        document.setSection(kind, rootSectionRenamer.renameRoot(section, suffix, preservedNames(kind)));
        logger.debug("Seção {}: {} definições renomeadas", kind.getKey(), section.size());
    }

    private Set<String> preservedNames(ResourceKind kind) {
        return kind == ResourceKind.NETWORK ? preservedNetworks : Collections.emptySet();
    }

    private static void requireSuffix(String suffix) {
        if (suffix == null || suffix.trim().isEmpty()) {
            throw new IllegalArgumentException("Sufixo não pode ser vazio");
        }
    }

    private static Set<String> parseNames(String names) {
        if (names == null || names.trim().isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> parsed = new LinkedHashSet<>();
        Arrays.stream(names.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .forEach(parsed::add);
        return Collections.unmodifiableSet(parsed);
    }
}
