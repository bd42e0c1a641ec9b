package com.prpilot.orchestrator.naming;

import com.prpilot.orchestrator.error.NameGenerationExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Derives collision-resistant branch names from free text and checks names
 * against Git's ref-name rules.
 *
 * Generated names look like {@code auto/add-hello-py-printing-hello-world-3f9a1c}.
 * Every name handed out is reserved for the lifetime of the process, so two
 * concurrent runs can never be given the same name even before either branch
 * exists on the remote.
 */
@Component
public class BranchNamer {

    private static final Logger log = LoggerFactory.getLogger(BranchNamer.class);

    public static final int MAX_BRANCH_LENGTH = 200;

    private static final String  FALLBACK_SLUG   = "change";
    private static final int     SUFFIX_BYTES    = 3;   // 6 hex chars
    private static final Pattern NON_ALNUM       = Pattern.compile("[^a-z0-9]+");
    private static final Pattern FORBIDDEN_CHARS = Pattern.compile("[~^:?*\\[\\\\]");

    private final String prefix;
    private final int    maxSlugLength;
    private final int    maxAttempts;

    private final SecureRandom random   = new SecureRandom();
    private final Set<String>  reserved = ConcurrentHashMap.newKeySet();

    public BranchNamer(@Value("${prflow.naming.prefix:auto}") String prefix,
                       @Value("${prflow.naming.max-slug-length:40}") int maxSlugLength,
                       @Value("${prflow.naming.max-attempts:5}") int maxAttempts) {
        this.prefix        = prefix;
        this.maxSlugLength = maxSlugLength;
        this.maxAttempts   = maxAttempts;
    }

    // ------------------------------------------------------------------
    // Generation
    // ------------------------------------------------------------------

    /**
     * Returns a reserved, valid branch name derived from {@code baseName}.
     *
     * @param existsCheck asks the remote whether a name is already taken
     * @throws NameGenerationExhaustedException if every attempt collided
     */
    public String generateUniqueBranchName(String baseName, Predicate<String> existsCheck) {
        String stem = prefix.isEmpty() ? slugify(baseName) : prefix + "/" + slugify(baseName);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = stem + "-" + randomSuffix();
            if (!reserved.add(candidate)) {
                log.debug("Branch name {} already reserved in this process (attempt {})", candidate, attempt);
                continue;
            }
            if (existsCheck.test(candidate)) {
                log.debug("Branch name {} exists on the remote (attempt {})", candidate, attempt);
                continue;   // stays reserved: it is taken either way
            }
            return candidate;
        }
        throw new NameGenerationExhaustedException(baseName, maxAttempts);
    }

    /** Reserves a caller-fixed name; false if this process already handed it out. */
    public boolean reserve(String branchName) {
        return reserved.add(branchName);
    }

    /** Drops a reservation for a name that never reached the remote. */
    public void release(String branchName) {
        reserved.remove(branchName);
    }

    /**
     * Lower-cases, collapses every non-alphanumeric run to one hyphen, trims
     * hyphens and bounds the length. Empty input yields "change".
     */
    public String slugify(String text) {
        if (text == null) return FALLBACK_SLUG;
        String slug = NON_ALNUM.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = trimHyphens(slug);
        if (slug.length() > maxSlugLength) {
            slug = trimHyphens(slug.substring(0, maxSlugLength));
        }
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    public BranchNameCheck validateBranchName(String name) {
        if (name == null || name.isBlank())          return BranchNameCheck.fail(BranchRule.BLANK);
        if (name.length() > MAX_BRANCH_LENGTH)       return BranchNameCheck.fail(BranchRule.TOO_LONG);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                return BranchNameCheck.fail(BranchRule.WHITESPACE_OR_CONTROL);
            }
        }
        if (FORBIDDEN_CHARS.matcher(name).find())    return BranchNameCheck.fail(BranchRule.FORBIDDEN_CHARACTER);
        if (name.contains(".."))                     return BranchNameCheck.fail(BranchRule.DOUBLE_DOT);
        if (name.contains("@{"))                     return BranchNameCheck.fail(BranchRule.REFLOG_SYNTAX);
        if (name.equals("@"))                        return BranchNameCheck.fail(BranchRule.AT_SIGN_ONLY);
        if (name.startsWith("/") || name.endsWith("/")) return BranchNameCheck.fail(BranchRule.SLASH_BOUNDARY);
        if (name.contains("//"))                     return BranchNameCheck.fail(BranchRule.DOUBLE_SLASH);
        if (name.endsWith("."))                      return BranchNameCheck.fail(BranchRule.DOT_BOUNDARY);
        if (name.startsWith("-"))                    return BranchNameCheck.fail(BranchRule.LEADING_DASH);
        // git applies these two per path component, not just to the whole name
        for (String component : name.split("/")) {
            if (component.startsWith("."))           return BranchNameCheck.fail(BranchRule.DOT_BOUNDARY);
            if (component.endsWith(".lock"))         return BranchNameCheck.fail(BranchRule.LOCK_SUFFIX);
        }
        return BranchNameCheck.OK;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String randomSuffix() {
        byte[] bytes = new byte[SUFFIX_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String trimHyphens(String s) {
        int start = 0, end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        return s.substring(start, end);
    }
}
