package com.seveninterprise.stackforge.compose;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RootSectionRenamerTest {

    private final RootSectionRenamer renamer = new RootSectionRenamer();

    @Test
    void renameRoot_AppendsSuffixToEveryKeyAndKeepsDefinitions() {
        // Given
        Map<String, Object> driverOpts = new LinkedHashMap<>();
        driverOpts.put("driver", "local");
        Map<String, Object> volumes = new LinkedHashMap<>();
        volumes.put("db-data", driverOpts);
        volumes.put("cache", null);

        // When
        Map<String, Object> renamed = renamer.renameRoot(volumes, "testhash");

        // Then
        assertThat(renamed).containsOnlyKeys("db-data-testhash", "cache-testhash");
        assertEquals(driverOpts, renamed.get("db-data-testhash"));
        assertNull(renamed.get("cache-testhash"));
        assertTrue(renamed.containsKey("cache-testhash"));
    }

    @Test
    void renameRoot_PreservesKeyOrder() {
        // Given
        Map<String, Object> networks = new LinkedHashMap<>();
        networks.put("frontend", null);
        networks.put("backend", null);
        networks.put("admin", null);

        // When
        Map<String, Object> renamed = renamer.renameRoot(networks, "x1");

        // Then
        assertThat(renamed.keySet()).containsExactly("frontend-x1", "backend-x1", "admin-x1");
    }

    @Test
    void renameRoot_WhenSectionIsAbsent_ReturnsNull() {
        assertNull(renamer.renameRoot(null, "testhash"));
    }

    @Test
    void renameRoot_WhenSectionIsEmpty_ReturnsEmptyMap() {
        // When
        Map<String, Object> renamed = renamer.renameRoot(new LinkedHashMap<>(), "testhash");

        // Then
        assertNotNull(renamed);
        assertTrue(renamed.isEmpty());
    }

    @Test
    void renameRoot_DoesNotShareMutableDefinitionsWithInput() {
        // Given
        List<Object> labels = new ArrayList<>();
        labels.add("tier=db");
        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("labels", labels);
        Map<String, Object> volumes = new LinkedHashMap<>();
        volumes.put("data", definition);

        // When
        Map<String, Object> renamed = renamer.renameRoot(volumes, "testhash");
        labels.add("changed");

        // Then
        @SuppressWarnings("unchecked")
        Map<String, Object> copied = (Map<String, Object>) renamed.get("data-testhash");
        assertEquals(Collections.singletonList("tier=db"), copied.get("labels"));
        assertThat(volumes).containsOnlyKeys("data");
    }

    @Test
    void renameRoot_KeepsPreservedNamesUnchanged() {
        // Given
        Map<String, Object> external = new LinkedHashMap<>();
        external.put("external", true);
        Map<String, Object> networks = new LinkedHashMap<>();
        networks.put("dokploy-network", external);
        networks.put("internal", null);

        // When
        Map<String, Object> renamed = renamer.renameRoot(networks, "testhash", Collections.singleton("dokploy-network"));

        // Then
        assertThat(renamed.keySet()).containsExactly("dokploy-network", "internal-testhash");
        assertEquals(external, renamed.get("dokploy-network"));
    }
}
