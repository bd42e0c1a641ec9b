package com.prpilot.orchestrator.generator;

import com.prpilot.orchestrator.error.GenerationException;
import com.prpilot.orchestrator.error.PrFlowException;
import com.prpilot.orchestrator.gateway.RepositoryGateway;
import com.prpilot.orchestrator.model.ChangeOperation;
import com.prpilot.orchestrator.model.RepositoryAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * {@link ChangeGenerator} that asks Claude for whole-file rewrites.
 *
 * The prompt carries the repository summary, README excerpt, file listing and
 * the current content of any file the request mentions by name. The reply is
 * parsed with {@link FileBlockParser}; paths that already exist in the
 * repository become MODIFY (or DELETE) entries whose original content is read
 * back through the gateway, everything else becomes CREATE.
 */
public class ClaudeChangeGenerator implements ChangeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClaudeChangeGenerator.class);

    private static final int MAX_LISTED_FILES     = 300;
    private static final int MAX_INLINED_FILES    = 5;
    private static final int MAX_INLINED_CHARS    = 20_000;

    private final ClaudeClient      claude;
    private final RepositoryGateway gateway;
    private final String            model;

    public ClaudeChangeGenerator(ClaudeClient claude, RepositoryGateway gateway, String model) {
        this.claude  = claude;
        this.gateway = gateway;
        this.model   = model;
    }

    @Override
    public List<ProposedChange> generate(GenerationRequest request) {
        RepositoryAnalysis analysis = request.analysis();
        String prompt = buildPrompt(request);

        String reply;
        try {
            reply = claude.complete(model, SYSTEM_PROMPT, List.of(new ClaudeClient.Message("user", prompt)));
        } catch (ClaudeClient.ClaudeApiException e) {
            throw new GenerationException("Code generation call failed: " + e.getMessage(), e);
        }

        List<FileBlockParser.FileBlock> blocks = FileBlockParser.parse(reply);
        if (blocks.isEmpty()) {
            throw new GenerationException("Code generator returned no file blocks");
        }
        String summary = FileBlockParser.extractSummary(reply).orElse(null);

        List<ProposedChange> changes = new ArrayList<>();
        for (FileBlockParser.FileBlock block : blocks) {
            boolean exists = analysis.containsFile(block.path());
            String original = exists ? readOriginal(request, block.path()) : null;
            ChangeOperation op = block.delete() ? ChangeOperation.DELETE
                    : exists ? ChangeOperation.MODIFY
                    : ChangeOperation.CREATE;
            changes.add(new ProposedChange(block.path(), op, original,
                    block.delete() ? null : block.content(),
                    summary != null ? summary : defaultSummary(op, block.path())));
        }
        log.info("Generated {} change(s) for request {}", changes.size(), request.requestId());
        return changes;
    }

    // ------------------------------------------------------------------
    // Prompt
    // ------------------------------------------------------------------

    private static final String SYSTEM_PROMPT = """
            You are a senior software engineer preparing a pull request.
            Implement the requested change completely and nothing else.

            Output format, strictly:
            - One fenced block per file to create or replace, opened with ```file=relative/path
              and containing the ENTIRE new file content (no diffs, no placeholders).
            - To remove a file, emit an empty block opened with ```delete=relative/path
            - Optionally, one line "Summary: <imperative one-line summary>" before the blocks.
            - No other prose.
            Paths are relative to the repository root and must not leave it.
            """;

    String buildPrompt(GenerationRequest request) {
        RepositoryAnalysis a = request.analysis();
        StringBuilder sb = new StringBuilder();
        sb.append("REPOSITORY: ").append(a.repository()).append('\n');
        if (a.description() != null) sb.append("DESCRIPTION: ").append(a.description()).append('\n');
        if (a.primaryLanguage() != null) sb.append("PRIMARY LANGUAGE: ").append(a.primaryLanguage()).append('\n');
        if (!a.frameworks().isEmpty()) sb.append("FRAMEWORKS: ").append(String.join(", ", a.frameworks())).append('\n');

        if (a.readmeExcerpt() != null) {
            sb.append("\nREADME (excerpt):\n").append(a.readmeExcerpt()).append('\n');
        }

        sb.append("\nFILES:\n");
        a.files().stream().limit(MAX_LISTED_FILES).forEach(f -> sb.append("  ").append(f).append('\n'));
        if (a.files().size() > MAX_LISTED_FILES) {
            sb.append("  ... ").append(a.files().size() - MAX_LISTED_FILES).append(" more\n");
        }

        for (String path : mentionedFiles(request)) {
            String content = readOriginal(request, path);
            if (content.length() > MAX_INLINED_CHARS) {
                content = content.substring(0, MAX_INLINED_CHARS) + "\n... (truncated)";
            }
            sb.append("\nCURRENT CONTENT OF ").append(path).append(":\n```\n").append(content).append("\n```\n");
        }

        sb.append("\nREQUEST:\n").append(request.freeTextRequest()).append('\n');
        return sb.toString();
    }

    /** Existing files whose path or file name appears in the request text. */
    List<String> mentionedFiles(GenerationRequest request) {
        String text = request.freeTextRequest().toLowerCase(Locale.ROOT);
        return request.analysis().files().stream()
                .filter(path -> {
                    String lower = path.toLowerCase(Locale.ROOT);
                    String name = lower.substring(lower.lastIndexOf('/') + 1);
                    return text.contains(lower) || (name.contains(".") && text.contains(name));
                })
                .limit(MAX_INLINED_FILES)
                .collect(Collectors.toList());
    }

    private String readOriginal(GenerationRequest request, String path) {
        try {
            return gateway.getFileContent(request.analysis().repository(), path, request.baseBranch());
        } catch (PrFlowException e) {
            throw new GenerationException("Could not read existing file '" + path + "': " + e.getMessage(), e);
        }
    }

    private static String defaultSummary(ChangeOperation op, String path) {
        return switch (op) {
            case CREATE -> "Add " + path;
            case MODIFY -> "Update " + path;
            case DELETE -> "Remove " + path;
        };
    }
}
