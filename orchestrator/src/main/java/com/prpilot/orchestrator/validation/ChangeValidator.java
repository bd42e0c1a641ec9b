package com.prpilot.orchestrator.validation;

import com.prpilot.orchestrator.model.ChangeEntry;
import com.prpilot.orchestrator.model.ChangeOperation;
import com.prpilot.orchestrator.model.ValidationStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Policy gate between the code generator and the remote.
 *
 * Every entry gets its own verdict. Any INVALID entry, or a change set larger
 * than the file ceiling, makes the aggregate INVALID and the request fails
 * closed. WARNING entries proceed and are surfaced in the PR body.
 *
 * INVALID:
 *   - blank, absolute, backslash or drive-letter paths
 *   - any ".." segment, or a path normalising outside the repository root
 *   - sensitive locations (.git/, .ssh/, .aws/, .docker/, .env*, private keys)
 *   - content above the size ceiling
 *   - operation/content mismatches (create without content, modify or delete
 *     without the original, modify without proposed content)
 *   - the same path twice in one change set
 *
 * WARNING:
 *   - modify that leaves the content unchanged
 *   - executable or script extensions
 *   - suspicious content (destructive shell, eval/exec, hard-coded secrets)
 *   - summaries longer than 1000 characters
 *   - create that also carries original content (ignored)
 */
@Component
public class ChangeValidator {

    private static final int MAX_PATH_LENGTH    = 260;
    private static final int MAX_SUMMARY_LENGTH = 1000;

    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:");

    private static final Set<String> SENSITIVE_DIRS = Set.of(".git", ".ssh", ".aws", ".docker", ".gnupg");

    private static final Set<String> SENSITIVE_FILES = Set.of(
            "id_rsa", "id_dsa", "id_ecdsa", "id_ed25519",
            "authorized_keys", "known_hosts", "passwd", "shadow", "sudoers");

    private static final Set<String> EXECUTABLE_EXTENSIONS = Set.of(
            ".exe", ".bat", ".cmd", ".com", ".scr", ".pif", ".vbs", ".jar", ".app",
            ".deb", ".rpm", ".dmg", ".pkg", ".msi", ".ps1", ".sh");

    private static final List<Pattern> SUSPICIOUS_CONTENT = List.of(
            Pattern.compile("rm\\s+-rf\\s+/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sudo\\s+rm", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\beval\\s*\\("),
            Pattern.compile("\\bexec\\s*\\("),
            Pattern.compile("shell_exec"),
            Pattern.compile("(password|api.?key|secret|token)\\s*=\\s*[\"'][^\"']{4,}[\"']",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----"));

    private final long maxFileBytes;
    private final int  maxFiles;

    public ChangeValidator(@Value("${prflow.validation.max-file-bytes:1048576}") long maxFileBytes,
                           @Value("${prflow.validation.max-files:20}") int maxFiles) {
        this.maxFileBytes = maxFileBytes;
        this.maxFiles     = maxFiles;
    }

    public ValidationReport validate(List<ChangeEntry> changeSet) {
        List<ChangeEntry> validated  = new ArrayList<>(changeSet.size());
        List<String>      violations = new ArrayList<>();
        List<String>      warnings   = new ArrayList<>();
        ValidationStatus  verdict    = ValidationStatus.VALID;
        Set<String>       seenPaths  = new HashSet<>();

        if (changeSet.isEmpty()) {
            violations.add("change set is empty");
            verdict = ValidationStatus.INVALID;
        }
        if (changeSet.size() > maxFiles) {
            violations.add("change set touches %d files (limit: %d)".formatted(changeSet.size(), maxFiles));
            verdict = ValidationStatus.INVALID;
        }

        for (ChangeEntry entry : changeSet) {
            List<String> invalid = new ArrayList<>();
            List<String> warn    = new ArrayList<>();

            checkPath(entry.path(), invalid);
            if (entry.path() != null && !seenPaths.add(normalise(entry.path()))) {
                invalid.add("path appears more than once in the change set");
            }
            checkOperation(entry, invalid, warn);
            checkContent(entry, invalid, warn);
            if (entry.summary() != null && entry.summary().length() > MAX_SUMMARY_LENGTH) {
                warn.add("summary longer than " + MAX_SUMMARY_LENGTH + " characters");
            }

            ValidationStatus status = !invalid.isEmpty() ? ValidationStatus.INVALID
                    : !warn.isEmpty() ? ValidationStatus.WARNING
                    : ValidationStatus.VALID;
            List<String> messages = new ArrayList<>(invalid);
            messages.addAll(warn);
            validated.add(entry.withVerdict(status, messages));

            String label = Objects.requireNonNullElse(entry.path(), "<no path>");
            invalid.forEach(m -> violations.add(label + ": " + m));
            warn.forEach(m -> warnings.add(label + ": " + m));
            verdict = verdict.worst(status);
        }

        return new ValidationReport(validated, verdict, violations, warnings);
    }

    // ------------------------------------------------------------------
    // Checks
    // ------------------------------------------------------------------

    private void checkPath(String path, List<String> invalid) {
        if (path == null || path.isBlank()) {
            invalid.add("path is blank");
            return;
        }
        if (path.length() > MAX_PATH_LENGTH) {
            invalid.add("path longer than " + MAX_PATH_LENGTH + " characters");
        }
        if (path.startsWith("/") || path.startsWith("~")) {
            invalid.add("path must be relative to the repository root");
        }
        if (path.contains("\\") || DRIVE_LETTER.matcher(path).find()) {
            invalid.add("path must use '/' separators and no drive letter");
        }
        for (int i = 0; i < path.length(); i++) {
            if (Character.isISOControl(path.charAt(i))) {
                invalid.add("path contains control characters");
                break;
            }
        }

        String[] segments = path.split("/");
        boolean dotDot = false;
        Deque<String> stack = new ArrayDeque<>();
        boolean escapes = false;
        for (String segment : segments) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                dotDot = true;
                if (stack.isEmpty()) escapes = true; else stack.removeLast();
                continue;
            }
            stack.addLast(segment);
        }
        if (dotDot) {
            invalid.add(escapes ? "path escapes the repository root" : "path contains a '..' segment");
        }
        if (!dotDot && (stack.isEmpty() || path.endsWith("/"))) {
            invalid.add("path does not name a file");
        }

        for (String segment : segments) {
            String lower = segment.toLowerCase(Locale.ROOT);
            if (SENSITIVE_DIRS.contains(lower)) {
                invalid.add("path touches sensitive location '" + segment + "'");
                break;
            }
        }
        String fileName = segments.length == 0 ? "" : segments[segments.length - 1].toLowerCase(Locale.ROOT);
        if (fileName.equals(".env") || fileName.startsWith(".env.")) {
            invalid.add("environment files must not be written");
        } else if (SENSITIVE_FILES.contains(fileName) || fileName.endsWith(".pem") || fileName.endsWith(".key")) {
            invalid.add("credential or system file '" + fileName + "' must not be written");
        }
    }

    private void checkOperation(ChangeEntry entry, List<String> invalid, List<String> warn) {
        ChangeOperation op = entry.operation();
        if (op == null) {
            invalid.add("operation is missing");
            return;
        }
        switch (op) {
            case CREATE -> {
                if (entry.proposedContent() == null) invalid.add("create requires proposed content");
                if (entry.originalContent() != null) warn.add("create carries original content, which is ignored");
            }
            case MODIFY -> {
                if (entry.originalContent() == null) invalid.add("modify requires the original content");
                if (entry.proposedContent() == null) invalid.add("modify requires proposed content");
                if (entry.originalContent() != null && entry.originalContent().equals(entry.proposedContent())) {
                    warn.add("modify leaves the content unchanged");
                }
            }
            case DELETE -> {
                if (entry.originalContent() == null) invalid.add("delete requires the original content");
            }
        }
    }

    private void checkContent(ChangeEntry entry, List<String> invalid, List<String> warn) {
        String content = entry.proposedContent();
        if (content != null && content.getBytes(StandardCharsets.UTF_8).length > maxFileBytes) {
            invalid.add("content exceeds %d bytes".formatted(maxFileBytes));
        }

        String path = entry.path() == null ? "" : entry.path().toLowerCase(Locale.ROOT);
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        if (dot > slash && EXECUTABLE_EXTENSIONS.contains(path.substring(dot))) {
            warn.add("executable or script file type '" + path.substring(dot) + "'");
        }

        if (content != null && entry.operation() != ChangeOperation.DELETE) {
            for (Pattern p : SUSPICIOUS_CONTENT) {
                if (p.matcher(content).find()) {
                    warn.add("suspicious content matching " + p.pattern());
                }
            }
        }
    }

    private static String normalise(String path) {
        String p = path.replaceAll("/+", "/");
        if (p.startsWith("./")) p = p.substring(2);
        return p;
    }
}
