package com.prpilot.orchestrator.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts whole-file blocks from a model response.
 *
 * Recognised shapes:
 * <pre>
 *   ```file=src/app.py        full content of src/app.py
 *   ...
 *   ```
 *
 *   path: src/app.py          header line directly above an ordinary fence
 *   ```python
 *   ...
 *   ```
 *
 *   ```delete=src/old.py      remove the file (body ignored)
 *   ```
 * </pre>
 * Fences without a path are ignored. A later block for the same path wins.
 */
public final class FileBlockParser {

    public record FileBlock(String path, String content, boolean delete) {}

    private static final Pattern FENCE = Pattern.compile(
            "```([^\\n`]*)\\n(.*?)\\n?```", Pattern.DOTALL);
    private static final Pattern FILE_ATTR   = Pattern.compile("(?:^|\\s)file=(\\S+)");
    private static final Pattern DELETE_ATTR = Pattern.compile("(?:^|\\s)delete=(\\S+)");
    private static final Pattern HEADER_LINE = Pattern.compile(
            "^\\s*(?:path|file)\\s*:\\s*`?([^\\s`]+)`?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUMMARY_LINE = Pattern.compile(
            "(?m)^\\s*summary\\s*:\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    private FileBlockParser() {}

    public static List<FileBlock> parse(String response) {
        List<FileBlock> blocks = new ArrayList<>();
        if (response == null || response.isBlank()) {
            return blocks;
        }
        Matcher m = FENCE.matcher(response);
        while (m.find()) {
            String info = m.group(1).strip();
            String body = m.group(2);

            Matcher del = DELETE_ATTR.matcher(info);
            if (del.find()) {
                put(blocks, new FileBlock(cleanPath(del.group(1)), null, true));
                continue;
            }
            Matcher file = FILE_ATTR.matcher(info);
            Optional<String> path = file.find()
                    ? Optional.of(file.group(1))
                    : headerAbove(response, m.start());
            path.ifPresent(p -> put(blocks, new FileBlock(cleanPath(p), withTrailingNewline(body), false)));
        }
        return blocks;
    }

    /** Text of the first "Summary: ..." line outside the fences, if any. */
    public static Optional<String> extractSummary(String response) {
        if (response == null) return Optional.empty();
        String outside = FENCE.matcher(response).replaceAll("");
        Matcher m = SUMMARY_LINE.matcher(outside);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    private static Optional<String> headerAbove(String response, int fenceStart) {
        int end = fenceStart;
        while (end > 0 && response.charAt(end - 1) == '\n') end--;
        int start = response.lastIndexOf('\n', end - 1) + 1;
        if (start >= end) return Optional.empty();
        Matcher h = HEADER_LINE.matcher(response.substring(start, end));
        return h.matches() ? Optional.of(h.group(1)) : Optional.empty();
    }

    private static void put(List<FileBlock> blocks, FileBlock block) {
        blocks.removeIf(b -> b.path().equals(block.path()));
        blocks.add(block);
    }

    private static String cleanPath(String p) {
        String s = p.strip();
        return s.startsWith("./") ? s.substring(2) : s;
    }

    private static String withTrailingNewline(String body) {
        return body.isEmpty() || body.endsWith("\n") ? body : body + "\n";
    }
}
