package ai.hclindex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

import ai.hclindex.artifacts.TfPlanParser;
import ai.hclindex.artifacts.TfStateParser;
import ai.hclindex.artifacts.TfVarsParser;
import ai.hclindex.graph.DependencyGraph;
import ai.hclindex.graph.GraphBuilder;
import ai.hclindex.io.DocumentWriter;
import ai.hclindex.model.Document;
import ai.hclindex.model.HclParseException;
import ai.hclindex.parse.ConfigParser;
import ai.hclindex.parse.DirectoryParseResult;
import ai.hclindex.parse.FileParseResult;

public final class Main {

    static final int OK = 0;
    static final int PARSE_FAILURE = 1;
    static final int USAGE_OR_IO = 2;

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path input = null;
        Path outDir = null;
        DocumentWriter.Format format = DocumentWriter.Format.JSON;
        boolean graph = false;
        boolean prune = true;
        boolean strict = false;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return OK;
                }
                if (arg.startsWith("--format=")) {
                    format = DocumentWriter.Format.parse(arg.substring("--format=".length()).trim());
                    continue;
                }
                if ("--graph".equals(arg)) {
                    graph = true;
                    continue;
                }
                if ("--no-prune".equals(arg)) {
                    prune = false;
                    continue;
                }
                if ("--strict".equals(arg)) {
                    strict = true;
                    continue;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return USAGE_OR_IO;
                }
                if (input == null) {
                    input = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return USAGE_OR_IO;
            }
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            printUsage();
            return USAGE_OR_IO;
        }

        if (input == null) {
            System.err.println("ERROR: missing <path>");
            printUsage();
            return USAGE_OR_IO;
        }
        input = input.toAbsolutePath().normalize();

        final DocumentWriter writer = new DocumentWriter(format, prune);
        final ConfigParser parser = new ConfigParser(strict);

        try {
            if (Files.isDirectory(input)) {
                final DirectoryParseResult result = parser.parseDirectory(input);
                if (outDir != null) {
                    return writeOutDir(writer, outDir, result.files(), result.combined());
                }
                System.out.println(writer.render(graph ? DocumentWriter.export(result.combined()) : result));
                reportDiagnostics(result.files());
                return OK;
            }

            if (!Files.isRegularFile(input)) {
                System.err.println("ERROR: no such file or directory: " + input);
                return USAGE_OR_IO;
            }

            final String name = input.getFileName().toString();
            if (name.contains(".tfvars")) {
                System.out.println(writer.render(new TfVarsParser().parseFile(input)));
                return OK;
            }
            if (name.endsWith(".tfstate")) {
                System.out.println(writer.render(new TfStateParser().parseFile(input)));
                return OK;
            }
            if (name.endsWith("plan.json")) {
                System.out.println(writer.render(new TfPlanParser().parseFile(input)));
                return OK;
            }

            final FileParseResult result = parser.parseFile(input);
            if (outDir != null) {
                return writeOutDir(writer, outDir, List.of(result), result.document());
            }
            System.out.println(writer.render(graph ? DocumentWriter.export(result.document()) : result.document()));
            reportDiagnostics(List.of(result));
            return OK;
        } catch (HclParseException ex) {
            System.err.println("ERROR: parse failure: " + safeMsg(ex.getMessage()));
            return PARSE_FAILURE;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return USAGE_OR_IO;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            return USAGE_OR_IO;
        }
    }

    private static int writeOutDir(DocumentWriter writer, Path outDir, List<FileParseResult> files, Document document)
            throws IOException {
        final Path target = outDir.toAbsolutePath().normalize();
        final DependencyGraph graph = new GraphBuilder().build(document);
        writer.writeAll(target, files, document, graph, Instant.now().toString());

        System.out.println("Index written to: " + target);
        System.out.println("Schema: " + DocumentWriter.SCHEMA_VERSION);
        System.out.println("Files: " + files.size()
                + ", blocks: " + document.blockCount()
                + ", nodes: " + graph.nodes().size()
                + ", edges: " + graph.edges().size());
        reportDiagnostics(files);
        return OK;
    }

    private static void reportDiagnostics(List<FileParseResult> files) {
        for (FileParseResult file : files) {
            file.diagnostics().forEach(d -> System.err.println("WARN: " + d.format()));
        }
    }

    private static void printUsage() {
        System.out.println("Usage: hcl-indexer <path> [options]");
        System.out.println("  <path> is a configuration directory, a .tf/.tf.json file,");
        System.out.println("  a .tfvars(.json) file, a .tfstate file or a *plan.json file");
        System.out.println("Options:");
        System.out.println("  --format=<json|yaml>    Output format (default: json)");
        System.out.println("  --graph                 Emit {version, document, graph} instead of the document");
        System.out.println("  --no-prune              Keep nulls and empty collections");
        System.out.println("  --strict                Fail on unterminated blocks instead of warning");
        System.out.println("  --outDir=<path>         Write document, graph and index.json to a directory");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
