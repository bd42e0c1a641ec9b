package com.prpilot.orchestrator.model;

import com.prpilot.orchestrator.error.ValidationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies a remote repository as host/owner/name.
 *
 * Accepted input shapes:
 * <pre>
 *   github.com/owner/name
 *   https://github.com/owner/name(.git)
 *   git@github.com:owner/name.git
 *   owner/name                      (host defaults to the configured web host)
 * </pre>
 */
public record RepositoryLocator(String host, String owner, String name) {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern HOST    = Pattern.compile("[A-Za-z0-9.-]+(:\\d+)?");
    private static final Pattern SSH     = Pattern.compile("^git@([^:]+):(.+)$");

    public static RepositoryLocator parse(String raw, String defaultHost) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("repositoryLocator is required");
        }
        String s = raw.trim();

        Matcher ssh = SSH.matcher(s);
        if (ssh.matches()) {
            s = ssh.group(1) + "/" + ssh.group(2);
        } else if (s.startsWith("https://")) {
            s = s.substring("https://".length());
        } else if (s.startsWith("http://")) {
            s = s.substring("http://".length());
        }
        if (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        if (s.endsWith(".git")) s = s.substring(0, s.length() - 4);

        String[] parts = s.split("/", -1);
        String host, owner, name;
        if (parts.length == 3) {
            host = parts[0]; owner = parts[1]; name = parts[2];
        } else if (parts.length == 2 && !parts[0].contains(".")) {
            host = defaultHost; owner = parts[0]; name = parts[1];
        } else {
            throw invalid(raw);
        }

        if (!HOST.matcher(host).matches()
                || !SEGMENT.matcher(owner).matches()
                || !SEGMENT.matcher(name).matches()
                || owner.startsWith(".") || name.equals(".") || name.equals("..")) {
            throw invalid(raw);
        }
        return new RepositoryLocator(host.toLowerCase(), owner, name);
    }

    public String fullName() {
        return owner + "/" + name;
    }

    @Override
    public String toString() {
        return host + "/" + owner + "/" + name;
    }

    private static ValidationException invalid(String raw) {
        return new ValidationException(
                "repositoryLocator '" + raw + "' must have the shape host/owner/name");
    }
}
