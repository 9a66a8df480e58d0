package ai.exporter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Command-line configuration.
 */
public record ExportOptions(
        Path snapshotRoot,
        Path outDir,
        boolean markdown,
        boolean watch,
        Duration interval
) {

    public static final String DEFAULT_OUT_DIR = ".blueprint-docs";
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    public ExportOptions {
        Objects.requireNonNull(snapshotRoot, "snapshotRoot");
        Objects.requireNonNull(outDir, "outDir");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }
}
