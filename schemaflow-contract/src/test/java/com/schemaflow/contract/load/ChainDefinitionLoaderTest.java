package com.schemaflow.contract.load;

import com.schemaflow.contract.ChainDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChainDefinitionLoaderTest {

    private static final String MINIMAL_DEFAULT_JSON = """
            {"name":"default-chain","initialInput":{"a":"float"},"links":[{"name":"copy","contract":{"transformRequires":{"a":"float"},"producedOrModified":{"b":"float"}}}]}
            """;

    @TempDir
    Path tempDir;

    private Path chainDir;

    @BeforeEach
    void setUp() throws Exception {
        chainDir = Files.createDirectories(tempDir.resolve("chains"));
    }

    @Test
    void load_fallsBackToDefaultJson() throws Exception {
        Files.writeString(chainDir.resolve("default.json"), MINIMAL_DEFAULT_JSON);
        ChainDefinitionLoader loader = new ChainDefinitionLoader(chainDir);

        Optional<ChainDefinition> chain = loader.load("missing-chain");

        assertTrue(chain.isPresent());
        assertEquals("default-chain", chain.get().getName());
    }

    @Test
    void load_prefersNamedFileOverDefault() throws Exception {
        Files.writeString(chainDir.resolve("default.json"), MINIMAL_DEFAULT_JSON);
        Files.writeString(chainDir.resolve("housing.json"), MINIMAL_DEFAULT_JSON.replace("default-chain", "housing-chain"));
        ChainDefinitionLoader loader = new ChainDefinitionLoader(chainDir);

        ChainDefinition chain = loader.loadOrThrow("housing");

        assertEquals("housing-chain", chain.getName());
        assertEquals(1, chain.getLinks().size());
    }

    @Test
    void load_emptyWhenNoFiles() {
        ChainDefinitionLoader loader = new ChainDefinitionLoader(chainDir);

        assertFalse(loader.load("housing").isPresent());
        assertThrows(IllegalStateException.class, () -> loader.loadOrThrow("housing"));
    }
}
