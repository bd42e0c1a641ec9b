package com.prpilot.orchestrator.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prpilot.orchestrator.error.AuthenticationException;
import com.prpilot.orchestrator.error.ErrorCode;
import com.prpilot.orchestrator.error.NameCollisionException;
import com.prpilot.orchestrator.error.NotFoundException;
import com.prpilot.orchestrator.error.PartialCommitException;
import com.prpilot.orchestrator.error.PrFlowException;
import com.prpilot.orchestrator.error.RateLimitException;
import com.prpilot.orchestrator.error.TransientNetworkException;
import com.prpilot.orchestrator.error.ValidationException;
import com.prpilot.orchestrator.model.RepositoryLocator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link RepositoryGateway} backed by the GitHub REST API v3.
 *
 * Every HTTP exchange goes through {@link #call}, which applies the shared
 * {@link RetryPolicy}, classifies non-2xx responses into the error taxonomy
 * and records {@code prflow.gateway.calls{operation, outcome}}. Callers that
 * need to interpret a specific failure status themselves (for example 422 on
 * branch creation) pass it as "accepted" and inspect the response.
 *
 * Commits are built in one of two ways:
 * <pre>
 *   tree      Git Data API: one tree, one commit, then a fast-forward of the
 *             branch ref. Nothing is visible until the ref moves.
 *   per-file  Contents API: one commit per file. A failure part way through
 *             raises PartialCommitException naming the files that landed.
 * </pre>
 */
public class GitHubGateway implements RepositoryGateway {

    private static final Logger log = LoggerFactory.getLogger(GitHubGateway.class);

    public enum CommitMode { TREE, PER_FILE }

    private static final String API_VERSION        = "2022-11-28";
    private static final String ACCEPT             = "application/vnd.github+json";
    private static final String FILE_MODE          = "100644";
    private static final int    README_EXCERPT_MAX = 2000;

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final RetryPolicy   retryPolicy;
    private final MeterRegistry meterRegistry;
    private final Clock         clock;
    private final String        apiUrl;
    private final String        webHost;
    private final String        token;
    private final Duration      requestTimeout;
    private final CommitMode    commitMode;

    public GitHubGateway(HttpClient http, ObjectMapper json, RetryPolicy retryPolicy,
                         MeterRegistry meterRegistry, Clock clock,
                         String apiUrl, String webHost, String token,
                         Duration requestTimeout, CommitMode commitMode) {
        this.http           = http;
        this.json           = json;
        this.retryPolicy    = retryPolicy;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
        this.apiUrl         = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.webHost        = webHost;
        this.token          = token;
        this.requestTimeout = requestTimeout;
        this.commitMode     = commitMode;
    }

    // ------------------------------------------------------------------
    // Repository introspection
    // ------------------------------------------------------------------

    @Override
    public RepositorySummary getRepositorySummary(RepositoryLocator repo) {
        JsonNode meta = call("get_repository", "GET", repoUrl(repo, ""), null).body();

        Map<String, Long> languages = new LinkedHashMap<>();
        JsonNode langs = call("get_languages", "GET", repoUrl(repo, "/languages"), null).body();
        Iterator<Map.Entry<String, JsonNode>> it = langs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            languages.put(e.getKey(), e.getValue().asLong());
        }

        String readme = null;
        ApiResponse readmeResp = call("get_readme", "GET", repoUrl(repo, "/readme"), null, Set.of(404));
        if (readmeResp.status() == 200) {
            readme = decodeContent(readmeResp.body());
            if (readme.length() > README_EXCERPT_MAX) {
                readme = readme.substring(0, README_EXCERPT_MAX);
            }
        }

        return new RepositorySummary(
                meta.path("full_name").asText(repo.fullName()),
                textOrNull(meta, "description"),
                meta.path("default_branch").asText("main"),
                textOrNull(meta, "html_url"),
                meta.path("private").asBoolean(false),
                textOrNull(meta, "language"),
                languages,
                readme);
    }

    @Override
    public List<String> listFiles(RepositoryLocator repo, String ref) {
        JsonNode tree = call("list_files", "GET",
                repoUrl(repo, "/git/trees/" + encodePath(ref) + "?recursive=1"), null).body();
        if (tree.path("truncated").asBoolean(false)) {
            log.warn("File listing for {} at {} was truncated by GitHub", repo, ref);
        }
        List<String> files = new ArrayList<>();
        for (JsonNode entry : tree.path("tree")) {
            if ("blob".equals(entry.path("type").asText())) {
                files.add(entry.path("path").asText());
            }
        }
        return files;
    }

    @Override
    public String getFileContent(RepositoryLocator repo, String path, String ref) {
        JsonNode body = call("get_file", "GET", contentsUrl(repo, path) + refQuery(ref), null).body();
        if (body.isArray() || !"file".equals(body.path("type").asText("file"))) {
            throw new ValidationException("'" + path + "' is not a regular file");
        }
        return decodeContent(body);
    }

    // ------------------------------------------------------------------
    // Branches
    // ------------------------------------------------------------------

    @Override
    public boolean branchExists(RepositoryLocator repo, String branch) {
        ApiResponse resp = call("branch_exists", "GET",
                repoUrl(repo, "/git/ref/heads/" + encodePath(branch)), null, Set.of(404));
        return resp.status() == 200;
    }

    @Override
    public BranchRef createBranch(RepositoryLocator repo, String branch, String baseBranch) {
        String baseSha = headSha(repo, baseBranch);

        ObjectNode body = json.createObjectNode();
        body.put("ref", "refs/heads/" + branch);
        body.put("sha", baseSha);
        ApiResponse resp = call("create_branch", "POST", repoUrl(repo, "/git/refs"), body, Set.of(422));
        if (resp.status() == 422) {
            if (errorText(resp.body()).toLowerCase(Locale.ROOT).contains("reference already exists")) {
                // A retried POST whose first attempt landed sees its own ref here.
                if (baseSha.equals(existingHeadSha(repo, branch).orElse(null))) {
                    log.info("Branch {} on {} already points at {}; reusing it", branch, repo, shortSha(baseSha));
                    return new BranchRef(branch, baseSha);
                }
                throw new NameCollisionException(branch, false);
            }
            throw new ValidationException("GitHub rejected branch '" + branch + "': " + errorText(resp.body()));
        }
        log.info("Created branch {} on {} from {} ({})", branch, repo, baseBranch, shortSha(baseSha));
        return new BranchRef(branch, baseSha);
    }

    // ------------------------------------------------------------------
    // Commits
    // ------------------------------------------------------------------

    @Override
    public CommitResult commitFiles(RepositoryLocator repo, String branch, List<FileChange> files, String message) {
        if (files.isEmpty()) {
            throw new ValidationException("Nothing to commit");
        }
        return commitMode == CommitMode.TREE
                ? commitAsTree(repo, branch, files, message)
                : commitFileByFile(repo, branch, files, message);
    }

    private CommitResult commitAsTree(RepositoryLocator repo, String branch, List<FileChange> files, String message) {
        String headSha = headSha(repo, branch);
        String baseTree = call("get_commit", "GET", repoUrl(repo, "/git/commits/" + headSha), null)
                .body().path("tree").path("sha").asText();

        ObjectNode treeBody = json.createObjectNode();
        treeBody.put("base_tree", baseTree);
        ArrayNode entries = treeBody.putArray("tree");
        for (FileChange f : files) {
            ObjectNode e = entries.addObject();
            e.put("path", f.path());
            e.put("mode", FILE_MODE);
            e.put("type", "blob");
            if (f.isDeletion()) {
                e.putNull("sha");
            } else {
                e.put("content", f.content());
            }
        }
        String treeSha = call("create_tree", "POST", repoUrl(repo, "/git/trees"), treeBody)
                .body().path("sha").asText();

        ObjectNode commitBody = json.createObjectNode();
        commitBody.put("message", message);
        commitBody.put("tree", treeSha);
        commitBody.putArray("parents").add(headSha);
        String commitSha = call("create_commit", "POST", repoUrl(repo, "/git/commits"), commitBody)
                .body().path("sha").asText();

        ObjectNode refBody = json.createObjectNode();
        refBody.put("sha", commitSha);
        refBody.put("force", false);
        call("update_ref", "PATCH", repoUrl(repo, "/git/refs/heads/" + encodePath(branch)), refBody);

        List<String> paths = files.stream().map(FileChange::path).toList();
        log.info("Committed {} file(s) to {} on {} as {}", paths.size(), branch, repo, shortSha(commitSha));
        return new CommitResult(branch, commitSha, paths);
    }

    private CommitResult commitFileByFile(RepositoryLocator repo, String branch,
                                          List<FileChange> files, String message) {
        List<String> committed = new ArrayList<>();
        String lastSha = null;
        for (FileChange f : files) {
            try {
                CommitResult r = f.isDeletion()
                        ? deleteFile(repo, branch, f.path(), message)
                        : updateFile(repo, branch, f.path(), f.content(), message);
                lastSha = r.commitSha();
                committed.add(f.path());
            } catch (PrFlowException e) {
                if (committed.isEmpty()) {
                    throw e;
                }
                log.error("Commit sequence on {} failed at {} after {} of {} file(s)",
                        branch, f.path(), committed.size(), files.size(), e);
                throw new PartialCommitException(branch, committed, f.path(), e);
            }
        }
        return new CommitResult(branch, lastSha, committed);
    }

    @Override
    public CommitResult updateFile(RepositoryLocator repo, String branch, String path,
                                   String content, String message) {
        Optional<String> existingSha = blobSha(repo, branch, path);

        ObjectNode body = json.createObjectNode();
        body.put("message", message);
        body.put("content", Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8)));
        body.put("branch", branch);
        existingSha.ifPresent(sha -> body.put("sha", sha));

        String commitSha = call("put_file", "PUT", contentsUrl(repo, path), body)
                .body().path("commit").path("sha").asText();
        return new CommitResult(branch, commitSha, List.of(path));
    }

    @Override
    public CommitResult deleteFile(RepositoryLocator repo, String branch, String path, String message) {
        String sha = blobSha(repo, branch, path)
                .orElseThrow(() -> new NotFoundException("'" + path + "' does not exist on " + branch));

        ObjectNode body = json.createObjectNode();
        body.put("message", message);
        body.put("sha", sha);
        body.put("branch", branch);

        String commitSha = call("delete_file", "DELETE", contentsUrl(repo, path), body)
                .body().path("commit").path("sha").asText();
        return new CommitResult(branch, commitSha, List.of(path));
    }

    // ------------------------------------------------------------------
    // Pull requests
    // ------------------------------------------------------------------

    @Override
    public PullRequestInfo createPullRequest(RepositoryLocator repo, PullRequestSpec request) {
        ObjectNode body = json.createObjectNode();
        body.put("title", request.title());
        body.put("body", request.body());
        body.put("head", request.head());
        body.put("base", request.base());
        body.put("maintainer_can_modify", true);

        ApiResponse resp = call("create_pull_request", "POST", repoUrl(repo, "/pulls"), body, Set.of(422));
        if (resp.status() == 422) {
            String error = errorText(resp.body());
            if (error.toLowerCase(Locale.ROOT).contains("a pull request already exists")) {
                return findOpenPullRequest(repo, request)
                        .orElseThrow(() -> new ValidationException(
                                "GitHub reports an existing PR for " + request.head() + " but none is open"));
            }
            throw new ValidationException("GitHub rejected the pull request: " + error);
        }
        JsonNode pr = resp.body();
        log.info("Opened PR #{} on {}: {}", pr.path("number").asInt(), repo, pr.path("html_url").asText());
        return new PullRequestInfo(pr.path("number").asInt(), pr.path("html_url").asText(),
                request.head(), request.base(), false);
    }

    private Optional<PullRequestInfo> findOpenPullRequest(RepositoryLocator repo, PullRequestSpec request) {
        String query = "?state=open&head=" + encodeQuery(repo.owner() + ":" + request.head())
                + "&base=" + encodeQuery(request.base());
        JsonNode list = call("find_pull_request", "GET", repoUrl(repo, "/pulls" + query), null).body();
        if (!list.isArray() || list.isEmpty()) {
            return Optional.empty();
        }
        JsonNode pr = list.get(0);
        log.info("Reusing open PR #{} for {}", pr.path("number").asInt(), request.head());
        return Optional.of(new PullRequestInfo(pr.path("number").asInt(), pr.path("html_url").asText(),
                request.head(), request.base(), true));
    }

    @Override
    public void addLabels(RepositoryLocator repo, int pullRequestNumber, List<String> labels) {
        if (labels.isEmpty()) {
            return;
        }
        ObjectNode body = json.createObjectNode();
        ArrayNode arr = body.putArray("labels");
        labels.forEach(arr::add);
        call("add_labels", "POST", repoUrl(repo, "/issues/" + pullRequestNumber + "/labels"), body);
    }

    // ------------------------------------------------------------------
    // Transport
    // ------------------------------------------------------------------

    record ApiResponse(int status, JsonNode body) {}

    private ApiResponse call(String operation, String method, String url, JsonNode body) {
        return call(operation, method, url, body, Set.of());
    }

    private ApiResponse call(String operation, String method, String url, JsonNode body, Set<Integer> accepted) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return retryPolicy.execute(operation, () -> sendOnce(operation, method, url, body, accepted));
        } catch (PrFlowException e) {
            outcome = e.getCode().code();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("prflow.gateway.calls", "operation", operation, "outcome", outcome));
        }
    }

    private ApiResponse sendOnce(String operation, String method, String url, JsonNode body, Set<Integer> accepted) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", ACCEPT)
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("User-Agent", "prpilot");
        if (token != null && !token.isBlank()) {
            req.header("Authorization", "Bearer " + token);
        }
        if (body == null) {
            req.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            req.header("Content-Type", "application/json");
            req.method(method, HttpRequest.BodyPublishers.ofString(toJson(body)));
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientNetworkException(operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PrFlowException(ErrorCode.INTERNAL_ERROR, operation + " interrupted", false,
                    List.of("Resubmit the request"), Map.of(), e);
        }

        int status = resp.statusCode();
        JsonNode parsed = parse(resp.body());
        if ((status >= 200 && status < 300) || accepted.contains(status)) {
            return new ApiResponse(status, parsed);
        }
        throw classify(operation, status, resp.headers(), parsed);
    }

    /**
     * Maps a failed response onto the error taxonomy.
     * <pre>
     *   401                                  authentication
     *   403 + x-ratelimit-remaining: 0       primary rate limit
     *   403 mentioning "secondary rate limit" transient
     *   403 otherwise                        authentication (permissions)
     *   404                                  not found
     *   400 / 409 / 422                      validation
     *   429                                  primary rate limit
     *   5xx                                  transient
     * </pre>
     */
    PrFlowException classify(String operation, int status, HttpHeaders headers, JsonNode body) {
        String error = errorText(body);
        String message = operation + " failed with HTTP " + status + (error.isEmpty() ? "" : ": " + error);

        if (status == 401) {
            return new AuthenticationException(message, status);
        }
        if (status == 403) {
            if ("0".equals(headers.firstValue("x-ratelimit-remaining").orElse(null))) {
                return new RateLimitException(message, resetHint(headers));
            }
            if (error.toLowerCase(Locale.ROOT).contains("secondary rate limit")) {
                return new TransientNetworkException(message, status);
            }
            return new AuthenticationException(message, status);
        }
        if (status == 404) {
            return new NotFoundException(message);
        }
        if (status == 429) {
            return new RateLimitException(message, resetHint(headers));
        }
        if (status == 400 || status == 409 || status == 422) {
            return new ValidationException(message);
        }
        if (status >= 500) {
            return new TransientNetworkException(message, status);
        }
        return new PrFlowException(ErrorCode.REMOTE_ERROR, message, false,
                List.of("Check the GitHub API status and the request parameters"), Map.of("status", status));
    }

    /** Retry-After (seconds) wins over x-ratelimit-reset (epoch seconds). */
    private Duration resetHint(HttpHeaders headers) {
        Optional<String> retryAfter = headers.firstValue("retry-after");
        if (retryAfter.isPresent()) {
            try {
                return Duration.ofSeconds(Math.max(0, Long.parseLong(retryAfter.get().trim())));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric Retry-After '{}'", retryAfter.get());
            }
        }
        Optional<String> reset = headers.firstValue("x-ratelimit-reset");
        if (reset.isPresent()) {
            try {
                Instant at = Instant.ofEpochSecond(Long.parseLong(reset.get().trim()));
                Duration d = Duration.between(clock.instant(), at);
                return d.isNegative() ? Duration.ZERO : d;
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric x-ratelimit-reset '{}'", reset.get());
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String headSha(RepositoryLocator repo, String branch) {
        return call("get_ref", "GET", repoUrl(repo, "/git/ref/heads/" + encodePath(branch)), null)
                .body().path("object").path("sha").asText();
    }

    private Optional<String> existingHeadSha(RepositoryLocator repo, String branch) {
        ApiResponse resp = call("get_ref", "GET",
                repoUrl(repo, "/git/ref/heads/" + encodePath(branch)), null, Set.of(404));
        if (resp.status() == 404) {
            return Optional.empty();
        }
        return Optional.ofNullable(textOrNull(resp.body().path("object"), "sha"));
    }

    private Optional<String> blobSha(RepositoryLocator repo, String branch, String path) {
        ApiResponse resp = call("get_file_sha", "GET", contentsUrl(repo, path) + refQuery(branch), null, Set.of(404));
        if (resp.status() == 404) {
            return Optional.empty();
        }
        return Optional.ofNullable(textOrNull(resp.body(), "sha"));
    }

    String apiBase(RepositoryLocator repo) {
        return repo.host().equalsIgnoreCase(webHost) ? apiUrl : "https://" + repo.host() + "/api/v3";
    }

    private String repoUrl(RepositoryLocator repo, String suffix) {
        return apiBase(repo) + "/repos/" + encodeQuery(repo.owner()) + "/" + encodeQuery(repo.name()) + suffix;
    }

    private String contentsUrl(RepositoryLocator repo, String path) {
        return repoUrl(repo, "/contents/" + encodePath(path));
    }

    private static String refQuery(String ref) {
        return ref == null ? "" : "?ref=" + encodeQuery(ref);
    }

    /** Encodes each segment but keeps the slashes GitHub expects in paths and refs. */
    private static String encodePath(String path) {
        return Arrays.stream(path.split("/", -1))
                .map(GitHubGateway::encodeQuery)
                .collect(Collectors.joining("/"));
    }

    private static String encodeQuery(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private String decodeContent(JsonNode node) {
        String encoded = node.path("content").asText("");
        return new String(Base64.getMimeDecoder().decode(encoded), StandardCharsets.UTF_8);
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON response body from GitHub: {}", body.length() > 200 ? body.substring(0, 200) : body);
            return MissingNode.getInstance();
        }
    }

    private String toJson(JsonNode body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PrFlowException(ErrorCode.INTERNAL_ERROR, "JSON serialization failed", false,
                    List.of(), Map.of(), e);
        }
    }

    /** GitHub's "message" plus any per-field error messages. */
    private static String errorText(JsonNode body) {
        StringBuilder sb = new StringBuilder(body.path("message").asText(""));
        for (JsonNode err : body.path("errors")) {
            String m = err.isTextual() ? err.asText() : err.path("message").asText("");
            if (!m.isEmpty()) {
                if (sb.length() > 0) sb.append("; ");
                sb.append(m);
            }
        }
        return sb.toString();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isMissingNode() || v.isNull() ? null : v.asText();
    }

    private static String shortSha(String sha) {
        return sha == null || sha.length() < 7 ? sha : sha.substring(0, 7);
    }
}
