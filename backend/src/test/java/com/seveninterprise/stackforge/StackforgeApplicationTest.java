package com.seveninterprise.stackforge;

import com.seveninterprise.stackforge.compose.ComposeFixtures;
import com.seveninterprise.stackforge.dto.RandomizedCompose;
import com.seveninterprise.stackforge.services.IComposeRandomizerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sobe o contexto completo e renomeia um arquivo usando os beans reais
 */
@SpringBootTest
@TestPropertySource(properties = {
    "stackforge.compose.preserved-networks=shared-proxy",
    "stackforge.compose.env-variable=STACK_SUFFIX"
})
class StackforgeApplicationTest {

    @Autowired
    private IComposeRandomizerService randomizerService;

    @Test
    void randomizeComposeFile_UsesConfiguredPreservedNetworksAndEnvVariable() {
        // Given
        String compose = ""
            + "services:\n"
            + "  web:\n"
            + "    image: nginx\n"
            + "    networks: [shared-proxy, internal]\n"
            + "networks:\n"
            + "  shared-proxy:\n"
            + "    external: true\n"
            + "  internal:\n";

        // When
        RandomizedCompose result = randomizerService.randomizeComposeFile(compose, "ctx1");

        // Then
        assertEquals(ComposeFixtures.load(""
            + "services:\n"
            + "  web-ctx1:\n"
            + "    image: nginx\n"
            + "    networks: [shared-proxy, internal-ctx1]\n"
            + "networks:\n"
            + "  shared-proxy:\n"
            + "    external: true\n"
            + "  internal-ctx1:\n"), ComposeFixtures.load(result.getComposeFile()));
        assertEquals("STACK_SUFFIX=ctx1", randomizerService.buildEnvContent(null, result.getSuffix()));
    }
}
