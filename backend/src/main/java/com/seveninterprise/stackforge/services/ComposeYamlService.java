package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.compose.ComposeDocumentMapper;
import com.seveninterprise.stackforge.exceptions.ComposeException;
import com.seveninterprise.stackforge.model.compose.ComposeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serviço para leitura e escrita de arquivos docker-compose.yml com SnakeYAML
 *
 * Leitura e escrita seguem o core schema do YAML 1.2 (ver ComposeYamlResolver),
 * para que campos que não são referências saiam exatamente com o mesmo valor.
 * Instâncias de Yaml não são thread-safe, então cada chamada cria a sua.
 */
@Service
public class ComposeYamlService implements IComposeYamlService {

    private static final Logger logger = LoggerFactory.getLogger(ComposeYamlService.class);

    private static final int LINE_WIDTH = 1000;

    private final ComposeDocumentMapper mapper;

    public ComposeYamlService(ComposeDocumentMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ComposeDocument parse(String composeContent) {
        if (composeContent == null || composeContent.trim().isEmpty()) {
            throw new ComposeException("Arquivo docker-compose.yml vazio");
        }

        Object loaded;
        try {
            loaded = createYaml().load(composeContent);
        } catch (YAMLException e) {
            logger.warn("YAML inválido: {}", e.getMessage());
            throw new ComposeException("Erro ao ler arquivo docker-compose.yml: " + e.getMessage(), e);
        }

        if (!(loaded instanceof Map)) {
            throw new ComposeException("Arquivo docker-compose.yml deve conter um mapeamento na raiz");
        }

        Map<String, Object> root = new LinkedHashMap<>();
        ((Map<?, ?>) loaded).forEach((key, value) -> root.put(String.valueOf(key), value));
        return mapper.fromMap(root);
    }

    @Override
    public String write(ComposeDocument document) {
        try {
            return createYaml().dump(mapper.toMap(document));
        } catch (YAMLException e) {
            throw new ComposeException("Erro ao gerar arquivo docker-compose.yml: " + e.getMessage(), e);
        }
    }

    private static Yaml createYaml() {
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setIndent(2);
        dumperOptions.setWidth(LINE_WIDTH);
        dumperOptions.setPrettyFlow(true);

        LoaderOptions loaderOptions = new LoaderOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions), dumperOptions, loaderOptions,
            new ComposeYamlResolver());
    }
}
