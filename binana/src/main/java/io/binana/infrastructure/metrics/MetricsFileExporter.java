package io.binana.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the registry in Prometheus text format to a file, for the node_exporter
 * textfile collector. A run is a short-lived process, so there is no endpoint to scrape.
 *
 * Example output:
 * <pre>
 * # HELP binana_orders_total Total number of orders by outcome
 * # TYPE binana_orders_total counter
 * binana_orders_total{symbol="BTC",outcome="success",} 1.0
 * binana_orders_total{symbol="DOT",outcome="rejected",} 1.0
 * </pre>
 */
public class MetricsFileExporter {
    private static final Logger log = LoggerFactory.getLogger(MetricsFileExporter.class);

    private final CollectorRegistry registry;

    public MetricsFileExporter(CollectorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Render the registry in text format 0.0.4.
     */
    public String render() throws IOException {
        Writer writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        return writer.toString();
    }

    /**
     * Write atomically: render to a sibling temp file, then move it over the target.
     *
     * @param target Destination file (usually *.prom)
     * @throws IOException if the file cannot be written
     */
    public void write(Path target) throws IOException {
        String output = render();
        Path absolute = target.toAbsolutePath();
        Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        Files.writeString(tmp, output, StandardCharsets.UTF_8);
        Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        log.info("[MetricsFileExporter] Wrote metrics to {} ({} bytes)", absolute, output.length());
    }
}
