package ai.hclindex.parse;

import java.util.List;

import ai.hclindex.model.Diagnostic;
import ai.hclindex.model.Document;

public record FileParseResult(String path, Document document, List<Diagnostic> diagnostics) {

    public FileParseResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
