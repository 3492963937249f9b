package ai.hclindex.parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.hclindex.model.Document;
import ai.hclindex.model.RawBlock;
import ai.hclindex.scan.BlockScanner;
import ai.hclindex.scan.ConfigFileFinder;

/**
 * Entry point for configuration parsing: text, single files ({@code .tf}, {@code .tf.json}) and directories.
 * <p>
 * Files are independent of each other; a directory result is the per-kind concatenation of its files
 * in sorted path order.
 */
public final class ConfigParser {

    private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

    private final BlockScanner scanner;
    private final BlockParser blockParser;
    private final JsonConfigParser jsonParser;

    public ConfigParser() {
        this(false);
    }

    /**
     * @param strict throw {@link ai.hclindex.model.HclParseException} on unterminated blocks
     *               instead of reporting a diagnostic
     */
    public ConfigParser(boolean strict) {
        this.scanner = new BlockScanner(strict);
        this.blockParser = new BlockParser();
        this.jsonParser = new JsonConfigParser();
    }

    public FileParseResult parseText(String content, String source) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");

        final BlockScanner.ScanResult scan = scanner.scan(content, source);
        final Document document = Document.empty();
        for (RawBlock block : scan.blocks()) {
            blockParser.parseInto(block, document);
        }
        return new FileParseResult(source, document, scan.diagnostics());
    }

    public FileParseResult parseFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }

        if (ConfigFileFinder.isJsonConfig(file)) {
            log.info("Parsing JSON configuration {}", file);
            return new FileParseResult(file.toString(), jsonParser.parseFile(file), List.of());
        }

        log.info("Parsing configuration {}", file);
        final String content = Files.readString(file, StandardCharsets.UTF_8);
        return parseText(content, file.toString());
    }

    public DirectoryParseResult parseDirectory(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Invalid directory path: " + dir);
        }

        final List<Path> files = new ConfigFileFinder(dir).findAll();
        log.info("Found {} configuration file(s) under {}", files.size(), dir);

        final List<FileParseResult> results = new ArrayList<>(files.size());
        final List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            final FileParseResult result = parseFile(file);
            results.add(result);
            documents.add(result.document());
        }
        return new DirectoryParseResult(combine(documents), results);
    }

    public Document combine(List<Document> documents) {
        return Document.combine(documents);
    }
}
