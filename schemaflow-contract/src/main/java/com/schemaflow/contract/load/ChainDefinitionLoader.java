package com.schemaflow.contract.load;

import com.schemaflow.contract.ChainDefinition;
import com.schemaflow.contract.ContractConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads chain definitions from a directory: {@code <chainName>.json}, falling back to {@value #DEFAULT_CHAIN_FILE}
 * when no file exists for the chain. Parse failures are not retried: a malformed chain file is an error
 * ({@link com.schemaflow.types.MalformedContractException} or {@link UncheckedIOException}).
 */
public final class ChainDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(ChainDefinitionLoader.class);

    static final String DEFAULT_CHAIN_FILE = "default.json";
    private static final String JSON_SUFFIX = ".json";

    private final Path chainDir;

    /**
     * @param chainDir directory holding chain files; must not be null
     */
    public ChainDefinitionLoader(Path chainDir) {
        if (chainDir == null) {
            throw new IllegalArgumentException("chainDir must not be null");
        }
        this.chainDir = chainDir;
    }

    /**
     * Loads {@code chainName.json}, else {@code default.json}.
     *
     * @return the definition, or empty when neither file exists
     */
    public Optional<ChainDefinition> load(String chainName) {
        if (chainName != null && !chainName.isBlank()) {
            Optional<ChainDefinition> named = loadFile(chainDir.resolve(chainName.trim() + JSON_SUFFIX));
            if (named.isPresent()) {
                return named;
            }
            log.debug("No chain file for chain={} in {}; trying {}", chainName, chainDir, DEFAULT_CHAIN_FILE);
        }
        return loadFile(chainDir.resolve(DEFAULT_CHAIN_FILE));
    }

    /** Like {@link #load(String)} but fails when no file is found. */
    public ChainDefinition loadOrThrow(String chainName) {
        return load(chainName).orElseThrow(() -> new IllegalStateException(
                "No chain definition found for chain=" + chainName + " in " + chainDir
                        + " (neither " + chainName + JSON_SUFFIX + " nor " + DEFAULT_CHAIN_FILE + ")"));
    }

    private Optional<ChainDefinition> loadFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read chain file " + file, e);
        }
        ChainDefinition definition = ContractConfig.chainFromJson(json);
        log.info("Chain definition loaded from {} ({} links)", file, definition.getLinks().size());
        return Optional.of(definition);
    }
}
