package com.seveninterprise.stackforge.services;

import com.seveninterprise.stackforge.compose.ComposeDocumentMapper;
import com.seveninterprise.stackforge.compose.ComposeFixtures;
import com.seveninterprise.stackforge.compose.RootSectionRenamer;
import com.seveninterprise.stackforge.compose.ServiceConfigRewriter;
import com.seveninterprise.stackforge.compose.ServiceNameRenamer;
import com.seveninterprise.stackforge.compose.ServiceNetworkRewriter;
import com.seveninterprise.stackforge.compose.ServiceSecretRewriter;
import com.seveninterprise.stackforge.compose.ServiceVolumeRewriter;
import com.seveninterprise.stackforge.compose.SuffixTokenGenerator;
import com.seveninterprise.stackforge.dto.RandomizedCompose;
import com.seveninterprise.stackforge.model.compose.ComposeDocument;
import com.seveninterprise.stackforge.model.compose.ResourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ComposeRandomizerService
 */
@ExtendWith(MockitoExtension.class)
class ComposeRandomizerServiceTest {

    @Mock
    private IComposeRenamingService renamingService;

    private ComposeRandomizerService randomizerService;

    private static final String COMPOSE = "services:\n  web:\n    image: nginx\n  db:\n    image: postgres\n";

    private static final String RENAMED = "services:\n  web-af045046:\n    image: nginx\n  db-af045046:\n    image: postgres\n";

    @BeforeEach
    void setUp() {
        randomizerService = new ComposeRandomizerService(
            new ComposeYamlService(new ComposeDocumentMapper()), renamingService, "COMPOSE_PREFIX");
    }

    @Test
    void randomizeComposeFile_WithSuffix_RenamesAllWithThatSuffix() {
        // Given
        when(renamingService.renameAll(any(ComposeDocument.class), eq("af045046")))
            .thenReturn(ComposeFixtures.document(RENAMED));

        // When
        RandomizedCompose result = randomizerService.randomizeComposeFile(COMPOSE, " af045046 ");

        // Then
        assertEquals("af045046", result.getSuffix());
        assertEquals(Arrays.asList("web-af045046", "db-af045046"), result.getServices());
        assertEquals(ComposeFixtures.load(RENAMED), ComposeFixtures.load(result.getComposeFile()));
        verify(renamingService, never()).newSuffix();
    }

    @Test
    void randomizeComposeFile_WithoutSuffix_GeneratesOne() {
        // Given
        when(renamingService.newSuffix()).thenReturn("af045046");
        when(renamingService.renameAll(any(ComposeDocument.class), eq("af045046")))
            .thenReturn(ComposeFixtures.document(RENAMED));

        // When
        RandomizedCompose result = randomizerService.randomizeComposeFile(COMPOSE, null);

        // Then
        assertEquals("af045046", result.getSuffix());
        verify(renamingService).newSuffix();
    }

    @Test
    void renameComposeFile_WithResourceScope_DelegatesToRenameOneKind() {
        // Given
        when(renamingService.renameOneKind(any(ComposeDocument.class), eq(ResourceKind.NETWORK), eq("n1")))
            .thenReturn(ComposeFixtures.document(COMPOSE));

        // When
        RandomizedCompose result = randomizerService.renameComposeFile(COMPOSE, "networks", "n1");

        // Then
        assertEquals("n1", result.getSuffix());
        verify(renamingService).renameOneKind(any(ComposeDocument.class), eq(ResourceKind.NETWORK), eq("n1"));
    }

    @Test
    void renameComposeFile_WithServicesScope_DelegatesToRenameServiceNames() {
        // Given
        when(renamingService.renameServiceNames(any(ComposeDocument.class), eq("af045046")))
            .thenReturn(ComposeFixtures.document(RENAMED));

        // When
        RandomizedCompose result = randomizerService.renameComposeFile(COMPOSE, "services", "af045046");

        // Then
        assertEquals(Arrays.asList("web-af045046", "db-af045046"), result.getServices());
    }

    @Test
    void renameComposeFile_WithUnknownScope_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class,
            () -> randomizerService.renameComposeFile(COMPOSE, "ports", "x"));
    }

    @Test
    void buildEnvContent_AppendsSuffixVariable() {
        // When
        String env = randomizerService.buildEnvContent("DB_USER=app\n\nDB_PASS=secret\n", "af045046");

        // Then
        assertEquals("DB_USER=app\nDB_PASS=secret\nCOMPOSE_PREFIX=af045046", env);
    }

    @Test
    void buildEnvContent_ReplacesPreviousSuffixVariable() {
        // When
        String env = randomizerService.buildEnvContent("COMPOSE_PREFIX=old\r\nTZ=UTC", "new1");

        // Then
        assertEquals("TZ=UTC\nCOMPOSE_PREFIX=new1", env);
    }

    @Test
    void buildEnvContent_WithoutEnv_ReturnsOnlySuffixVariable() {
        assertEquals("COMPOSE_PREFIX=af045046", randomizerService.buildEnvContent(null, "af045046"));
    }

    @Test
    void randomizeComposeFile_WithRealRenamer_RenamesWholeStack() {
        // Given
        ComposeRandomizerService service = createWithRealRenamer();
        String compose = ""
            + "services:\n"
            + "  backrest:\n"
            + "    image: garethgeorge/backrest:v1.1.0\n"
            + "    volumes:\n"
            + "      - backrest/data:/data\n"
            + "      - /:/userdata:ro\n"
            + "volumes:\n"
            + "  backrest:\n";

        // When
        RandomizedCompose result = service.randomizeComposeFile(compose, "testhash");

        // Then
        Map<String, Object> expected = ComposeFixtures.load(""
            + "services:\n"
            + "  backrest-testhash:\n"
            + "    image: garethgeorge/backrest:v1.1.0\n"
            + "    volumes:\n"
            + "      - backrest-testhash/data:/data\n"
            + "      - /:/userdata:ro\n"
            + "volumes:\n"
            + "  backrest-testhash:\n");
        assertEquals(expected, ComposeFixtures.load(result.getComposeFile()));
        assertEquals(Arrays.asList("backrest-testhash"), result.getServices());
    }

    @Test
    void randomizeComposeFile_WithRealRenamer_KeepsScalarTextAndRenamesNumericService() {
        // Given
        ComposeRandomizerService service = createWithRealRenamer();
        String compose = ""
            + "services:\n"
            + "  git:\n"
            + "    image: gitea/gitea:1.21\n"
            + "    ports:\n"
            + "      - 22:22\n"
            + "    environment:\n"
            + "      FEATURE: yes\n"
            + "      BUILD_DATE: 2024-01-01\n"
            + "    volumes:\n"
            + "      - no:/data\n"
            + "  8080:\n"
            + "    image: proxy\n"
            + "    depends_on:\n"
            + "      - git\n"
            + "volumes:\n"
            + "  no:\n";

        // When
        RandomizedCompose result = service.randomizeComposeFile(compose, "testhash");

        // Then
        String written = result.getComposeFile();
        assertTrue(written.contains("- 22:22\n"), written);
        assertTrue(written.contains("FEATURE: yes\n"), written);
        assertTrue(written.contains("BUILD_DATE: 2024-01-01\n"), written);
        Map<String, Object> expected = ComposeFixtures.load(""
            + "services:\n"
            + "  git-testhash:\n"
            + "    image: gitea/gitea:1.21\n"
            + "    ports:\n"
            + "      - 22:22\n"
            + "    environment:\n"
            + "      FEATURE: yes\n"
            + "      BUILD_DATE: 2024-01-01\n"
            + "    volumes:\n"
            + "      - no-testhash:/data\n"
            + "  8080-testhash:\n"
            + "    image: proxy\n"
            + "    depends_on:\n"
            + "      - git-testhash\n"
            + "volumes:\n"
            + "  no-testhash:\n");
        assertEquals(expected, ComposeFixtures.load(written));
        assertEquals(Arrays.asList("git-testhash", "8080-testhash"), result.getServices());
    }

    private ComposeRandomizerService createWithRealRenamer() {
        ComposeRenamingService realRenamer = new ComposeRenamingService(
            new SuffixTokenGenerator(),
            new RootSectionRenamer(),
            new ServiceNameRenamer(),
            Arrays.asList(
                new ServiceVolumeRewriter(),
                new ServiceNetworkRewriter(),
                new ServiceConfigRewriter(),
                new ServiceSecretRewriter()),
            "");
        return new ComposeRandomizerService(
            new ComposeYamlService(new ComposeDocumentMapper()), realRenamer, "COMPOSE_PREFIX");
    }
}
