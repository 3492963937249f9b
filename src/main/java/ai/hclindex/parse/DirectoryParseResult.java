package ai.hclindex.parse;

import java.util.ArrayList;
import java.util.List;

import ai.hclindex.model.Diagnostic;
import ai.hclindex.model.Document;

/**
 * Combined document of a directory plus the per-file results it was built from, in file order.
 */
public record DirectoryParseResult(Document combined, List<FileParseResult> files) {

    public DirectoryParseResult {
        files = List.copyOf(files);
    }

    public List<Diagnostic> allDiagnostics() {
        final List<Diagnostic> out = new ArrayList<>();
        for (FileParseResult file : files) {
            out.addAll(file.diagnostics());
        }
        return out;
    }
}
