package io.binana.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.binana.domain.allocation.AllocationSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the target allocation from a JSON file, or the built-in one.
 */
public final class AllocationLoader {
    private static final Logger log = LoggerFactory.getLogger(AllocationLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param file Allocation file, or null for {@link AllocationConfig#defaults()}
     * @throws IOException if the file cannot be read or parsed
     */
    public AllocationSpec load(Path file) throws IOException {
        if (file == null) {
            log.info("[AllocationLoader] No allocation file configured, using built-in allocation");
            return AllocationConfig.defaults().toSpec();
        }
        if (!Files.exists(file)) {
            throw new IOException("Allocation file not found: " + file);
        }
        AllocationConfig config = objectMapper.readValue(file.toFile(), AllocationConfig.class);
        AllocationSpec spec = config.toSpec();
        log.info("[AllocationLoader] Loaded {} symbols from {}", spec.listSymbols().size(), file);
        return spec;
    }
}
