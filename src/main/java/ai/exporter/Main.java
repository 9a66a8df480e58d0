package ai.exporter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import ai.exporter.io.DocumentWriter;
import ai.exporter.repo.FileAssetRepository;
import ai.exporter.watch.ChangeMonitor;
import ai.exporter.watch.DirectoryChangeSource;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        final ExportOptions options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            printUsage();
            return 2;
        }
        if (options == null) {
            printUsage();
            return 0;
        }

        try {
            if (!Files.isDirectory(options.snapshotRoot())) {
                System.err.println("ERROR: snapshot directory not found: " + options.snapshotRoot());
                return 2;
            }
            Files.createDirectories(options.outDir());

            final FileAssetRepository repository = new FileAssetRepository(options.snapshotRoot(), options.outDir());
            final DocumentWriter writer = new DocumentWriter(options.outDir(), options.markdown());
            final BlueprintExporter exporter = new BlueprintExporter(repository, writer);

            final int count = exporter.exportAll();
            System.out.println("Blueprint docs written to: " + options.outDir());
            System.out.println("Exported: " + count + " blueprints");

            if (options.watch()) {
                watch(options, repository, exporter);
            }
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: export failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    /** Parses arguments; returns null when help was requested. */
    static ExportOptions parse(String[] args) {
        Path snapshotRoot = null;
        Path outDir = null;
        boolean markdown = true;
        boolean watch = false;
        Duration interval = ExportOptions.DEFAULT_INTERVAL;

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                return null;
            }
            if (arg.startsWith("--outDir=")) {
                outDir = Paths.get(arg.substring("--outDir=".length()));
                continue;
            }
            if (arg.startsWith("--markdown=")) {
                markdown = Boolean.parseBoolean(arg.substring("--markdown=".length()));
                continue;
            }
            if ("--watch".equals(arg)) {
                watch = true;
                continue;
            }
            if (arg.startsWith("--interval=")) {
                final String raw = arg.substring("--interval=".length()).trim();
                try {
                    interval = Duration.ofMillis(Math.round(Double.parseDouble(raw) * 1000));
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("bad interval: " + raw);
                }
                continue;
            }
            if (arg.startsWith("--")) {
                throw new IllegalArgumentException("unknown argument: " + arg);
            }
            if (snapshotRoot == null) {
                snapshotRoot = Paths.get(arg);
                continue;
            }
            throw new IllegalArgumentException("unexpected argument: " + arg);
        }

        if (snapshotRoot == null) {
            snapshotRoot = Paths.get(".");
        }
        snapshotRoot = snapshotRoot.toAbsolutePath().normalize();

        if (outDir == null) {
            outDir = snapshotRoot.resolve(ExportOptions.DEFAULT_OUT_DIR);
        } else if (!outDir.isAbsolute()) {
            outDir = snapshotRoot.resolve(outDir).normalize();
        }
        return new ExportOptions(snapshotRoot, outDir, markdown, watch, interval);
    }

    private static void watch(ExportOptions options,
                              FileAssetRepository repository,
                              BlueprintExporter exporter) throws IOException, InterruptedException {
        final CountDownLatch shutdown = new CountDownLatch(1);
        try (DirectoryChangeSource source = new DirectoryChangeSource(repository)) {
            final ChangeMonitor monitor = new ChangeMonitor(source, repository);
            monitor.start(exporter::exportChanged);
            source.start(options.interval());
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                monitor.stop();
                shutdown.countDown();
            }, "blueprint-exporter-shutdown"));

            System.out.println("Watching " + options.snapshotRoot() + " (Ctrl+C to stop)");
            shutdown.await();
        }
    }

    private static void printUsage() {
        System.out.println("Usage: blueprint-exporter [snapshotDir] [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>         Output directory (default: <snapshotDir>/" + ExportOptions.DEFAULT_OUT_DIR + ")");
        System.out.println("  --markdown=<bool>       Also write Markdown and index.md (default: true)");
        System.out.println("  --watch                 Keep running and re-export changed blueprints");
        System.out.println("  --interval=<seconds>    Watch polling interval (default: 5)");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
