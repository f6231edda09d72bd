package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.dto.RandomizedCompose;
import com.seveninterprise.stackforge.model.compose.ComposeDocument;
import com.seveninterprise.stackforge.model.compose.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Serviço que aplica a renomeação sobre o conteúdo de arquivos docker-compose.yml
 *
 * Funcionalidades:
 * - Renomeação completa (randomize) com sufixo informado ou aleatório
 * - Renomeação de uma única família de recursos
 * - Injeção do sufixo no .env da implantação
 */
@Service
public class ComposeRandomizerService implements IComposeRandomizerService {

    private static final Logger logger = LoggerFactory.getLogger(ComposeRandomizerService.class);

    public static final String SCOPE_SERVICES = "services";

    private final IComposeYamlService yamlService;
    private final IComposeRenamingService renamingService;
    private final String suffixVariable;

    public ComposeRandomizerService(IComposeYamlService yamlService,
                                    IComposeRenamingService renamingService,
                                    @Value("${stackforge.compose.env-variable:COMPOSE_PREFIX}") String suffixVariable) {
        this.yamlService = yamlService;
        this.renamingService = renamingService;
        this.suffixVariable = suffixVariable;
    }

    @Override
    public RandomizedCompose randomizeComposeFile(String composeFile, String suffix) {
        String effectiveSuffix = resolveSuffix(suffix);
        ComposeDocument document = yamlService.parse(composeFile);

        ComposeDocument renamed = renamingService.renameAll(document, effectiveSuffix);

        logger.info("Arquivo compose randomizado com sufixo {}", effectiveSuffix);
        return toResult(renamed, effectiveSuffix);
    }

    @Override
    public RandomizedCompose renameComposeFile(String composeFile, String scope, String suffix) {
        ResourceKind kind = ResourceKind.fromKey(scope);
        if (kind == null && !SCOPE_SERVICES.equals(scope)) {
            throw new IllegalArgumentException("Escopo de renomeação desconhecido: " + scope);
        }

        String effectiveSuffix = resolveSuffix(suffix);
        ComposeDocument document = yamlService.parse(composeFile);

        ComposeDocument renamed = kind == null
            ? renamingService.renameServiceNames(document, effectiveSuffix)
            : renamingService.renameOneKind(document, kind, effectiveSuffix);

        return toResult(renamed, effectiveSuffix);
    }

    @Override
    public String buildEnvContent(String env, String suffix) {
        List<String> lines = new ArrayList<>();
        if (env != null) {
            for (String line : env.split("\\r?\\n")) {
                if (line.trim().isEmpty() || line.trim().startsWith(suffixVariable + "=")) {
                    continue;
                }
                lines.add(line);
            }
        }
        lines.add(suffixVariable + "=" + suffix);
        return String.join("\n", lines);
    }

    private String resolveSuffix(String suffix) {
        if (suffix == null || suffix.trim().isEmpty()) {
            return renamingService.newSuffix();
        }
        return suffix.trim();
    }

    private RandomizedCompose toResult(ComposeDocument renamed, String suffix) {
        List<String> services = renamed.getServices() != null
            ? new ArrayList<>(renamed.getServices().keySet())
            : new ArrayList<>();
        return new RandomizedCompose(yamlService.write(renamed), suffix, services);
    }
}
