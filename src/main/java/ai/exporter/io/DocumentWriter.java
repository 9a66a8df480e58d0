package ai.exporter.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.exporter.document.AssetDocument;

/**
 * Writes export documents below an output root, mirroring the asset path:
 * /Game/Characters/BP_Player -> &lt;outDir&gt;/Characters/BP_Player.json (+ .md).
 */
public final class DocumentWriter {

    public static final String INDEX_FILE = "index.md";
    private static final String CONTENT_ROOT = "/Game/";

    private final Path outDir;
    private final boolean markdown;
    private final ObjectMapper jsonMapper;

    public DocumentWriter(Path outDir, boolean markdown) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.markdown = markdown;
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path outDir() {
        return outDir;
    }

    public boolean markdown() {
        return markdown;
    }

    public String toJson(AssetDocument doc) throws JsonProcessingException {
        return jsonMapper.writeValueAsString(doc);
    }

    /** Writes the JSON document (and Markdown when enabled); returns the JSON file. */
    public Path write(AssetDocument doc, String exportedAt) throws IOException {
        Objects.requireNonNull(doc, "doc");
        final Path json = outputPath(doc.path(), ".json");
        writeText(json, toJson(doc));
        if (markdown) {
            writeText(outputPath(doc.path(), ".md"), MarkdownGenerator.generate(doc, exportedAt));
        }
        return json;
    }

    /** Writes a pre-rendered JSON string to an explicit file. */
    public void writeJson(Path file, String json) throws IOException {
        writeText(file, json);
    }

    public Path outputPath(String assetPath, String extension) {
        String relative = assetPath.startsWith(CONTENT_ROOT)
                ? assetPath.substring(CONTENT_ROOT.length())
                : assetPath;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        final String[] parts = relative.split("/");
        Path p = outDir;
        for (int i = 0; i < parts.length - 1; i++) {
            if (!parts[i].isEmpty()) {
                p = p.resolve(parts[i]);
            }
        }
        String fileName = parts[parts.length - 1];
        // object paths carry ".ObjectName"; keep the package name
        final int dot = fileName.indexOf('.');
        if (dot > 0) {
            fileName = fileName.substring(0, dot);
        }
        return p.resolve(fileName + extension);
    }

    /** Lists every exported Markdown file, grouped by its first directory. */
    public Path writeIndex(String generatedAt) throws IOException {
        Files.createDirectories(outDir);
        final List<String> files = new ArrayList<>();
        Files.walkFileTree(outDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final String name = file.getFileName().toString();
                if (name.endsWith(".md") && !INDEX_FILE.equals(name)) {
                    files.add(outDir.relativize(file).toString().replace('\\', '/'));
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);

        final StringBuilder sb = new StringBuilder();
        sb.append("# Blueprint Index\n\n");
        sb.append("**Total Blueprints:** ").append(files.size()).append("\n");
        sb.append("**Last Updated:** ").append(generatedAt).append("\n\n");
        sb.append("## All Blueprints\n\n");

        String currentCategory = null;
        for (String rel : files) {
            final String[] parts = rel.split("/");
            if (parts.length > 1 && !parts[0].equals(currentCategory)) {
                currentCategory = parts[0];
                sb.append("\n### ").append(currentCategory).append("\n\n");
            }
            final String name = parts[parts.length - 1].replace(".md", "");
            sb.append("- [").append(name).append("](").append(rel).append(")\n");
        }

        final Path index = outDir.resolve(INDEX_FILE);
        writeText(index, sb.toString());
        return index;
    }

    private void writeText(Path file, String content) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // overwrite each time (simple + deterministic)
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            bw.write(content);
        }
    }
}
