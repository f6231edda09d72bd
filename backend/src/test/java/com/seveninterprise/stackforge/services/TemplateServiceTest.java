package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.dto.RandomizedCompose;
import com.seveninterprise.stackforge.exceptions.ComposeException;
import com.seveninterprise.stackforge.exceptions.TemplateNotFoundException;
import com.seveninterprise.stackforge.model.Template;
import com.seveninterprise.stackforge.model.TemplateInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TemplateService
 * 
 * @author levi
 */
@ExtendWith(MockitoExtension.class)
class TemplateServiceTest {

    private static final String COMPOSE = "services:\n  app:\n    image: php:8.2-apache\n";
    private static final String RENAMED = "services:\n  app-af045046:\n    image: php:8.2-apache\n";

    @Mock
    private IComposeRandomizerService randomizerService;

    @TempDir
    Path tempDir;

    private Path templatesDir;
    private Path instancesDir;
    private TemplateService templateService;

    @BeforeEach
    void setUp() throws IOException {
        templatesDir = Files.createDirectories(tempDir.resolve("templates"));
        instancesDir = tempDir.resolve("instances");
        templateService = new TemplateService(randomizerService, templatesDir.toString(), instancesDir.toString());

        createTemplate("webserver-php", COMPOSE);
        createTemplate("redis-7.2.4", "services:\n  redis:\n    image: redis:7\n");
        Files.createDirectories(templatesDir.resolve("without-compose"));
    }

    private Path createTemplate(String name, String compose) throws IOException {
        Path dir = Files.createDirectories(templatesDir.resolve(name));
        Files.write(dir.resolve("docker-compose.yml"), compose.getBytes(StandardCharsets.UTF_8));
        return dir;
    }

    @Test
    void listTemplates_ReturnsOnlyDirectoriesWithComposeFile() {
        // When
        List<Template> templates = templateService.listTemplates();

        // Then
        assertEquals(2, templates.size());
        assertEquals("redis-7.2.4", templates.get(0).getName());
        assertEquals("webserver-php", templates.get(1).getName());
    }

    @Test
    void listTemplates_WhenDirectoryDoesNotExist_ReturnsEmptyList() {
        // Given
        TemplateService service = new TemplateService(randomizerService,
            tempDir.resolve("missing").toString(), instancesDir.toString());

        // When & Then
        assertTrue(service.listTemplates().isEmpty());
    }

    @Test
    void getTemplateByName_WhenTemplateExists_ReturnsTemplate() {
        // When
        Template template = templateService.getTemplateByName("webserver-php");

        // Then
        assertNotNull(template);
        assertEquals("webserver-php", template.getName());
        assertEquals("webserver php", template.getDescription());
        assertEquals("1.0.0", template.getVersion());
        assertEquals(templatesDir.resolve("webserver-php").toString(), template.getPath());
        assertFalse(template.isEnvFile());
    }

    @Test
    void getTemplateByName_DetectsEnvFile() throws IOException {
        // Given
        Files.write(templatesDir.resolve("redis-7.2.4").resolve(".env"), "TZ=UTC\n".getBytes(StandardCharsets.UTF_8));

        // When
        Template template = templateService.getTemplateByName("redis-7.2.4");

        // Then
        assertTrue(template.isEnvFile());
    }

    @Test
    void getTemplateByName_ExtractsVersionFromName() {
        // When
        Template template = templateService.getTemplateByName("redis-7.2.4");

        // Then
        assertNotNull(template);
        assertEquals("7.2.4", template.getVersion());
    }

    @Test
    void getTemplateByName_WhenTemplateDoesNotExist_ReturnsNull() {
        assertNull(templateService.getTemplateByName("nonexistent-template"));
        assertNull(templateService.getTemplateByName("without-compose"));
    }

    @Test
    void getTemplateByName_WithPathTraversal_ReturnsNull() {
        assertNull(templateService.getTemplateByName("../templates/webserver-php"));
        assertNull(templateService.getTemplateByName(".."));
        assertNull(templateService.getTemplateByName(null));
    }

    @Test
    void instantiateTemplate_WritesRenamedComposeAndEnv() throws IOException {
        // Given
        Files.write(templatesDir.resolve("webserver-php").resolve(".env"),
            "PHP_MEMORY=256M\n".getBytes(StandardCharsets.UTF_8));
        when(randomizerService.randomizeComposeFile(COMPOSE, "af045046"))
            .thenReturn(new RandomizedCompose(RENAMED, "af045046", Arrays.asList("app-af045046")));
        when(randomizerService.buildEnvContent("PHP_MEMORY=256M\n", "af045046"))
            .thenReturn("PHP_MEMORY=256M\nCOMPOSE_PREFIX=af045046");

        // When
        TemplateInstance instance = templateService.instantiateTemplate("webserver-php", "af045046");

        // Then
        Path instanceDir = instancesDir.resolve("webserver-php-af045046");
        assertEquals("webserver-php", instance.getTemplateName());
        assertEquals("webserver-php-af045046", instance.getInstanceName());
        assertEquals("af045046", instance.getSuffix());
        assertEquals(instanceDir.toString(), instance.getPath());
        assertEquals(Arrays.asList("app-af045046"), instance.getServices());
        assertEquals(RENAMED, new String(Files.readAllBytes(instanceDir.resolve("docker-compose.yml")), StandardCharsets.UTF_8));
        assertEquals("PHP_MEMORY=256M\nCOMPOSE_PREFIX=af045046",
            new String(Files.readAllBytes(instanceDir.resolve(".env")), StandardCharsets.UTF_8));
    }

    @Test
    void instantiateTemplate_WithoutTemplateEnv_BuildsEnvFromSuffixOnly() throws IOException {
        // Given
        when(randomizerService.randomizeComposeFile(COMPOSE, null))
            .thenReturn(new RandomizedCompose(RENAMED, "af045046", Arrays.asList("app-af045046")));
        when(randomizerService.buildEnvContent(null, "af045046")).thenReturn("COMPOSE_PREFIX=af045046");

        // When
        TemplateInstance instance = templateService.instantiateTemplate("webserver-php", null);

        // Then
        assertEquals("af045046", instance.getSuffix());
        assertTrue(Files.exists(instancesDir.resolve("webserver-php-af045046").resolve(".env")));
    }

    @Test
    void instantiateTemplate_WhenTemplateDoesNotExist_ThrowsTemplateNotFoundException() {
        // When & Then
        assertThrows(TemplateNotFoundException.class,
            () -> templateService.instantiateTemplate("nonexistent-template", "x"));
        verify(randomizerService, never()).randomizeComposeFile(any(), any());
    }

    @Test
    void instantiateTemplate_WhenInstanceAlreadyExists_ThrowsComposeException() throws IOException {
        // Given
        Files.createDirectories(instancesDir.resolve("webserver-php-af045046"));
        when(randomizerService.randomizeComposeFile(COMPOSE, "af045046"))
            .thenReturn(new RandomizedCompose(RENAMED, "af045046", Arrays.asList("app-af045046")));

        // When & Then
        ComposeException exception = assertThrows(ComposeException.class,
            () -> templateService.instantiateTemplate("webserver-php", "af045046"));
        assertFalse(exception instanceof TemplateNotFoundException);
    }

    @Test
    void instantiateTemplate_WithSuffixEscapingInstancesDirectory_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> templateService.instantiateTemplate("webserver-php", "../../outside"));
        assertThrows(IllegalArgumentException.class,
            () -> templateService.instantiateTemplate("webserver-php", "a/b"));
        assertThrows(IllegalArgumentException.class,
            () -> templateService.instantiateTemplate("webserver-php", "a\\b"));

        verify(randomizerService, never()).randomizeComposeFile(any(), any());
        assertFalse(Files.exists(instancesDir));
        assertFalse(Files.exists(tempDir.resolve("outside")));
    }

    @Test
    void instantiateTemplate_WhenRandomizerReturnsUnsafeSuffix_WritesNothing() {
        // Given
        when(randomizerService.randomizeComposeFile(COMPOSE, null))
            .thenReturn(new RandomizedCompose(RENAMED, "../x", Arrays.asList("app-../x")));

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> templateService.instantiateTemplate("webserver-php", null));
        assertFalse(Files.exists(instancesDir));
    }
}
