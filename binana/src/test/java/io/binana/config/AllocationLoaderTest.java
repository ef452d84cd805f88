package io.binana.config;

import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.allocation.InvalidAllocationException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AllocationLoaderTest {

    private final AllocationLoader loader = new AllocationLoader();

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(AllocationLoaderTest.class.getResource("/allocation/" + name).toURI());
    }

    @Test
    void testLoadsFileInDeclarationOrder() throws Exception {
        AllocationSpec spec = loader.load(resource("two-categories.json"));

        assertEquals(List.of("ETH", "BTC", "LINK"), spec.listSymbols());
        assertEquals("Mid Cap", spec.categories().get(1).name());
        assertEquals(0.35, spec.weightOf("BTC"), 1e-12);
    }

    @Test
    void testBadWeightSumRejected() {
        assertThrows(InvalidAllocationException.class, () -> loader.load(resource("bad-sum.json")));
    }

    @Test
    void testMissingFileIsIoError() {
        assertThrows(IOException.class, () -> loader.load(Path.of("does-not-exist.json")));
    }

    @Test
    void testBuiltInAllocationIsValid() throws Exception {
        AllocationSpec spec = loader.load(null);

        assertEquals(List.of("ETH", "BTC", "ADA", "SOL", "LINK", "MATIC", "UNI", "DOT", "BNB"), spec.listSymbols());
        assertEquals(0.0, spec.weightOf("BNB"), 0.0);
        assertEquals(3, spec.categories().size());
    }
}
