package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.dto.RandomizedCompose;
import com.seveninterprise.stackforge.exceptions.ComposeException;
import com.seveninterprise.stackforge.exceptions.TemplateNotFoundException;
import com.seveninterprise.stackforge.model.Template;
import com.seveninterprise.stackforge.model.TemplateInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Service implementation for template operations
 *
 * @author levi
 */
@Service
public class TemplateService implements ITemplateService {

    private static final Logger logger = LoggerFactory.getLogger(TemplateService.class);

    static final String COMPOSE_FILE_NAME = "docker-compose.yml";
    static final String ENV_FILE_NAME = ".env";

    private static final Pattern SUFFIX_PATTERN = Pattern.compile("^[a-zA-Z0-9_.-]+$");

    private final IComposeRandomizerService randomizerService;
    private final Path templatesPath;
    private final Path instancesPath;

    public TemplateService(IComposeRandomizerService randomizerService,
                           @Value("${stackforge.directory.template:data/templates}") String templatesPath,
                           @Value("${stackforge.directory.instances:data/instances}") String instancesPath) {
        this.randomizerService = randomizerService;
        this.templatesPath = Paths.get(templatesPath);
        this.instancesPath = Paths.get(instancesPath);
    }

    @Override
    public List<Template> listTemplates() {
        List<Template> templates = new ArrayList<>();

        if (!Files.exists(templatesPath)) {
            return templates;
        }

        try (Stream<Path> paths = Files.list(templatesPath)) {
            paths.filter(Files::isDirectory)
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .forEach(templatePath -> {
                    String templateName = templatePath.getFileName().toString();
                    Template template = createTemplateFromDirectory(templatePath, templateName);
                    if (template != null) {
                        templates.add(template);
                    }
                });
        } catch (IOException e) {
            throw new ComposeException("Error reading templates directory", e);
        }

        return templates;
    }

    @Override
    public Template getTemplateByName(String name) {
        if (!isValidTemplateName(name)) {
            return null;
        }

        Path templatePath = templatesPath.resolve(name);

        if (!Files.exists(templatePath) || !Files.isDirectory(templatePath)) {
            return null;
        }

        return createTemplateFromDirectory(templatePath, name);
    }

    @Override
    public TemplateInstance instantiateTemplate(String name, String suffix) {
        if (suffix != null && !suffix.trim().isEmpty()) {
            requireValidSuffix(suffix.trim());
        }

        Template template = getTemplateByName(name);
        if (template == null) {
            throw new TemplateNotFoundException(name);
        }

        Path templatePath = Paths.get(template.getPath());
        String composeContent = readFile(templatePath.resolve(COMPOSE_FILE_NAME));
        RandomizedCompose randomized = randomizerService.randomizeComposeFile(composeContent, suffix);

        requireValidSuffix(randomized.getSuffix());
        String instanceName = name + "-" + randomized.getSuffix();
        Path instancePath = instancesPath.resolve(instanceName);
        if (Files.exists(instancePath)) {
            throw new ComposeException("Instance already exists: " + instanceName);
        }

        String env = template.isEnvFile() ? readFile(templatePath.resolve(ENV_FILE_NAME)) : null;

        try {
            Files.createDirectories(instancePath);
            Files.write(instancePath.resolve(COMPOSE_FILE_NAME),
                randomized.getComposeFile().getBytes(StandardCharsets.UTF_8));
            Files.write(instancePath.resolve(ENV_FILE_NAME),
                randomizerService.buildEnvContent(env, randomized.getSuffix()).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ComposeException("Error writing instance " + instanceName + ": " + e.getMessage(), e);
        }

        logger.info("Template {} instantiated as {} ({} services)", name, instanceName, randomized.getServices().size());
        return new TemplateInstance(name, instanceName, randomized.getSuffix(), instancePath.toString(), randomized.getServices());
    }

    private Template createTemplateFromDirectory(Path templatePath, String templateName) {
        if (!Files.isRegularFile(templatePath.resolve(COMPOSE_FILE_NAME))) {
            return null;
        }

        // Try to extract version from directory name or use default
        String version = extractVersionFromTemplateName(templateName);

        // Create description based on template name
        String description = generateDescription(templateName);

        boolean envFile = Files.isRegularFile(templatePath.resolve(ENV_FILE_NAME));
        return new Template(templateName, description, version, templatePath.toString(), envFile);
    }

    private String readFile(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ComposeException("Error reading " + path + ": " + e.getMessage(), e);
        }
    }

    // o sufixo vira parte do nome do diretório da instância
    private void requireValidSuffix(String suffix) {
        if (suffix == null || !SUFFIX_PATTERN.matcher(suffix).matches()) {
            throw new IllegalArgumentException("Invalid suffix: " + suffix);
        }
    }

    private boolean isValidTemplateName(String name) {
        return name != null
            && !name.trim().isEmpty()
            && !name.contains("..")
            && !name.contains("/")
            && !name.contains("\\");
    }

    private String extractVersionFromTemplateName(String templateName) {
        String[] parts = templateName.split("-");
        if (parts.length > 1) {
            String lastPart = parts[parts.length - 1];
            if (lastPart.matches("\\d+\\.\\d+\\.\\d+")) {
                return lastPart;
            }
        }
        return "1.0.0"; // Default version
    }

    private String generateDescription(String templateName) {
        return templateName.replace('-', ' ').replace('_', ' ');
    }
}
