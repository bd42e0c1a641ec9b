package com.prpilot.orchestrator.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prpilot.orchestrator.error.AuthenticationException;
import com.prpilot.orchestrator.error.NameCollisionException;
import com.prpilot.orchestrator.error.NotFoundException;
import com.prpilot.orchestrator.error.PartialCommitException;
import com.prpilot.orchestrator.error.RateLimitException;
import com.prpilot.orchestrator.error.ValidationException;
import com.prpilot.orchestrator.model.RepositoryLocator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Runs the gateway against a scripted in-process HTTP server that answers
 * like the GitHub REST API.
 */
class GitHubGatewayTest {

    private static final RepositoryLocator REPO = new RepositoryLocator("github.com", "example", "demo");
    private static final String BASE = "/repos/example/demo";

    private final ObjectMapper         json    = new ObjectMapper();
    private final SimpleMeterRegistry  meters  = new SimpleMeterRegistry();
    private final List<Duration>       sleeps  = Collections.synchronizedList(new ArrayList<>());

    private ScriptedGitHub github;

    @BeforeEach
    void startServer() throws IOException {
        github = new ScriptedGitHub();
    }

    @AfterEach
    void stopServer() {
        github.stop();
    }

    private GitHubGateway gateway(GitHubGateway.CommitMode mode) {
        RetryPolicy retry = new RetryPolicy(4, Duration.ofMillis(10), Duration.ofMillis(50),
                Duration.ofSeconds(60), sleeps::add, meters);
        HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        return new GitHubGateway(http, json, retry, meters, Clock.systemUTC(),
                github.url(), "github.com", "test-token", Duration.ofSeconds(5), mode);
    }

    // ------------------------------------------------------------------
    // Rate limits and error classification
    // ------------------------------------------------------------------

    @Test
    void createPullRequest_rateLimitedTwice_succeedsOnThirdCall() {
        github.respond("POST", BASE + "/pulls", 429, "{\"message\":\"API rate limit exceeded\"}", "Retry-After", "0");
        github.respond("POST", BASE + "/pulls", 429, "{\"message\":\"API rate limit exceeded\"}", "Retry-After", "0");
        github.respond("POST", BASE + "/pulls", 201,
                "{\"number\":7,\"html_url\":\"https://github.com/example/demo/pull/7\"}");

        PullRequestInfo pr = gateway(GitHubGateway.CommitMode.TREE)
                .createPullRequest(REPO, new PullRequestSpec("Add hello", "body", "auto/hello-abc123", "main"));

        assertThat(pr.number()).isEqualTo(7);
        assertThat(pr.url()).isEqualTo("https://github.com/example/demo/pull/7");
        assertThat(pr.reusedExisting()).isFalse();
        assertThat(github.requests("POST", BASE + "/pulls")).hasSize(3);
        assertThat(sleeps).containsExactly(Duration.ZERO, Duration.ZERO);
    }

    @Test
    void rateLimitResetBeyondTheWaitBound_surfacesAsRetryableError() {
        github.respond("GET", BASE, 429, "{\"message\":\"slow down\"}", "Retry-After", "3600");

        RateLimitException e = catchThrowableOfType(
                () -> gateway(GitHubGateway.CommitMode.TREE).getRepositorySummary(REPO), RateLimitException.class);

        assertThat(e.isRetryable()).isTrue();
        assertThat(e.getResetAfter()).contains(Duration.ofHours(1));
        assertThat(github.requests("GET", BASE)).hasSize(1);
    }

    @Test
    void badCredentials_areNotRetried() {
        github.respond("GET", BASE, 401, "{\"message\":\"Bad credentials\"}");

        assertThatThrownBy(() -> gateway(GitHubGateway.CommitMode.TREE).getRepositorySummary(REPO))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("Bad credentials");
        assertThat(github.requests("GET", BASE)).hasSize(1);
    }

    @Test
    void missingRepository_isNotFound() {
        github.respond("GET", BASE, 404, "{\"message\":\"Not Found\"}");

        assertThatThrownBy(() -> gateway(GitHubGateway.CommitMode.TREE).getRepositorySummary(REPO))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void serverErrors_areRetriedThenSucceed() {
        github.respond("GET", BASE + "/git/ref/heads/feature", 502, "");
        github.respond("GET", BASE + "/git/ref/heads/feature", 200, "{\"object\":{\"sha\":\"abc\"}}");

        assertThat(gateway(GitHubGateway.CommitMode.TREE).branchExists(REPO, "feature")).isTrue();
        assertThat(github.requests("GET", BASE + "/git/ref/heads/feature")).hasSize(2);
    }

    @Test
    void everyRequestCarriesAuthAndApiVersionHeaders() {
        github.respond("GET", BASE + "/git/ref/heads/nope", 404, "{\"message\":\"Not Found\"}");

        assertThat(gateway(GitHubGateway.CommitMode.TREE).branchExists(REPO, "nope")).isFalse();

        Recorded req = github.requests("GET", BASE + "/git/ref/heads/nope").get(0);
        assertThat(req.headers().get("authorization")).isEqualTo("Bearer test-token");
        assertThat(req.headers().get("x-github-api-version")).isEqualTo("2022-11-28");
    }

    // ------------------------------------------------------------------
    // Repository introspection
    // ------------------------------------------------------------------

    @Test
    void repositorySummary_combinesMetadataLanguagesAndReadme() {
        github.respond("GET", BASE, 200, """
                {"full_name":"example/demo","description":"Demo","default_branch":"develop",
                 "html_url":"https://github.com/example/demo","private":false,"language":"Python"}""");
        github.respond("GET", BASE + "/languages", 200, "{\"Python\":1200,\"Shell\":40}");
        github.respond("GET", BASE + "/readme", 200,
                "{\"content\":\"" + Base64.getEncoder().encodeToString("# Demo\n".getBytes(StandardCharsets.UTF_8)) + "\"}");

        RepositorySummary summary = gateway(GitHubGateway.CommitMode.TREE).getRepositorySummary(REPO);

        assertThat(summary.defaultBranch()).isEqualTo("develop");
        assertThat(summary.languages()).containsEntry("Python", 1200L).containsKey("Shell");
        assertThat(summary.readmeExcerpt()).isEqualTo("# Demo\n");
    }

    @Test
    void listFiles_keepsBlobsOnly() {
        github.respond("GET", BASE + "/git/trees/main", 200, """
                {"tree":[{"path":"src","type":"tree"},{"path":"src/app.py","type":"blob"},
                         {"path":"README.md","type":"blob"}],"truncated":false}""");

        assertThat(gateway(GitHubGateway.CommitMode.TREE).listFiles(REPO, "main"))
                .containsExactly("src/app.py", "README.md");
        assertThat(github.requests("GET", BASE + "/git/trees/main").get(0).query()).isEqualTo("recursive=1");
    }

    // ------------------------------------------------------------------
    // Branches
    // ------------------------------------------------------------------

    @Test
    void createBranch_existingReference_isANameCollision() {
        github.respond("GET", BASE + "/git/ref/heads/main", 200, "{\"object\":{\"sha\":\"base123\"}}");
        github.respond("POST", BASE + "/git/refs", 422, "{\"message\":\"Reference already exists\"}");
        github.respond("GET", BASE + "/git/ref/heads/feature/x", 200, "{\"object\":{\"sha\":\"other456\"}}");

        NameCollisionException e = catchThrowableOfType(
                () -> gateway(GitHubGateway.CommitMode.TREE).createBranch(REPO, "feature/x", "main"),
                NameCollisionException.class);

        assertThat(e.getBranchName()).isEqualTo("feature/x");
        assertThat(e.isCallerFixed()).isFalse();
    }

    @Test
    void createBranch_lostResponseThenRetry_adoptsTheBranchItCreated() {
        github.respond("GET", BASE + "/git/ref/heads/main", 200, "{\"object\":{\"sha\":\"base123\"}}");
        github.respond("POST", BASE + "/git/refs", 502, "");
        github.respond("POST", BASE + "/git/refs", 422, "{\"message\":\"Reference already exists\"}");
        github.respond("GET", BASE + "/git/ref/heads/feature/x", 200, "{\"object\":{\"sha\":\"base123\"}}");

        BranchRef ref = gateway(GitHubGateway.CommitMode.TREE).createBranch(REPO, "feature/x", "main");

        assertThat(ref).isEqualTo(new BranchRef("feature/x", "base123"));
        assertThat(github.requests("POST", BASE + "/git/refs")).hasSize(2);
        assertThat(github.requests("GET", BASE + "/git/ref/heads/feature/x")).hasSize(1);
    }

    @Test
    void createBranch_pointsNewRefAtBaseHead() throws Exception {
        github.respond("GET", BASE + "/git/ref/heads/main", 200, "{\"object\":{\"sha\":\"base123\"}}");
        github.respond("POST", BASE + "/git/refs", 201, "{\"ref\":\"refs/heads/auto/x\"}");

        BranchRef ref = gateway(GitHubGateway.CommitMode.TREE).createBranch(REPO, "auto/x", "main");

        assertThat(ref).isEqualTo(new BranchRef("auto/x", "base123"));
        JsonNode body = json.readTree(github.requests("POST", BASE + "/git/refs").get(0).body());
        assertThat(body.path("ref").asText()).isEqualTo("refs/heads/auto/x");
        assertThat(body.path("sha").asText()).isEqualTo("base123");
    }

    // ------------------------------------------------------------------
    // Commits
    // ------------------------------------------------------------------

    @Test
    void treeCommit_buildsOneTreeAndMovesTheRef() throws Exception {
        github.respond("GET", BASE + "/git/ref/heads/auto/x", 200, "{\"object\":{\"sha\":\"head1\"}}");
        github.respond("GET", BASE + "/git/commits/head1", 200, "{\"tree\":{\"sha\":\"tree0\"}}");
        github.respond("POST", BASE + "/git/trees", 201, "{\"sha\":\"tree1\"}");
        github.respond("POST", BASE + "/git/commits", 201, "{\"sha\":\"commit1\"}");
        github.respond("PATCH", BASE + "/git/refs/heads/auto/x", 200, "{}");

        CommitResult result = gateway(GitHubGateway.CommitMode.TREE).commitFiles(REPO, "auto/x",
                List.of(new FileChange("hello.py", "print('hi')\n"), new FileChange("old.txt", null)), "Add hello");

        assertThat(result.commitSha()).isEqualTo("commit1");
        assertThat(result.committedPaths()).containsExactly("hello.py", "old.txt");

        JsonNode tree = json.readTree(github.requests("POST", BASE + "/git/trees").get(0).body());
        assertThat(tree.path("base_tree").asText()).isEqualTo("tree0");
        assertThat(tree.path("tree").get(0).path("content").asText()).isEqualTo("print('hi')\n");
        assertThat(tree.path("tree").get(1).get("sha").isNull()).isTrue();

        JsonNode ref = json.readTree(github.requests("PATCH", BASE + "/git/refs/heads/auto/x").get(0).body());
        assertThat(ref.path("sha").asText()).isEqualTo("commit1");
    }

    @Test
    void perFileCommit_failureAfterFirstFile_reportsExactlyTheCommittedFiles() {
        github.respond("GET", BASE + "/contents/a.txt", 404, "{\"message\":\"Not Found\"}");
        github.respond("PUT", BASE + "/contents/a.txt", 201, "{\"commit\":{\"sha\":\"c1\"}}");
        github.respond("GET", BASE + "/contents/b.txt", 404, "{\"message\":\"Not Found\"}");
        github.respond("PUT", BASE + "/contents/b.txt", 422, "{\"message\":\"Invalid request\"}");

        PartialCommitException e = catchThrowableOfType(
                () -> gateway(GitHubGateway.CommitMode.PER_FILE).commitFiles(REPO, "auto/x",
                        List.of(new FileChange("a.txt", "A"), new FileChange("b.txt", "B"),
                                new FileChange("c.txt", "C")), "msg"),
                PartialCommitException.class);

        assertThat(e.getCommittedPaths()).containsExactly("a.txt");
        assertThat(e.getFailedPath()).isEqualTo("b.txt");
        assertThat(e.getDetails()).containsEntry("branchName", "auto/x");
        assertThat(github.requests("PUT", BASE + "/contents/c.txt")).isEmpty();
    }

    @Test
    void perFileCommit_failureOnFirstFile_rethrowsTheOriginalError() {
        github.respond("GET", BASE + "/contents/a.txt", 404, "{\"message\":\"Not Found\"}");
        github.respond("PUT", BASE + "/contents/a.txt", 422, "{\"message\":\"Invalid request\"}");

        assertThatThrownBy(() -> gateway(GitHubGateway.CommitMode.PER_FILE).commitFiles(REPO, "auto/x",
                List.of(new FileChange("a.txt", "A")), "msg"))
                .isInstanceOf(ValidationException.class);
    }

    // ------------------------------------------------------------------
    // Pull requests
    // ------------------------------------------------------------------

    @Test
    void createPullRequest_existingOpenPr_isReused() {
        github.respond("POST", BASE + "/pulls", 422, """
                {"message":"Validation Failed",
                 "errors":[{"message":"A pull request already exists for example:auto/x."}]}""");
        github.respond("GET", BASE + "/pulls", 200,
                "[{\"number\":3,\"html_url\":\"https://github.com/example/demo/pull/3\"}]");

        PullRequestInfo pr = gateway(GitHubGateway.CommitMode.TREE)
                .createPullRequest(REPO, new PullRequestSpec("t", "b", "auto/x", "main"));

        assertThat(pr.number()).isEqualTo(3);
        assertThat(pr.reusedExisting()).isTrue();
        assertThat(github.requests("GET", BASE + "/pulls").get(0).query())
                .contains("state=open", "head=example%3Aauto%2Fx", "base=main");
    }

    @Test
    void addLabels_postsToTheIssueEndpoint() throws Exception {
        github.respond("POST", BASE + "/issues/7/labels", 200, "[]");

        gateway(GitHubGateway.CommitMode.TREE).addLabels(REPO, 7, List.of("ai-generated", "automated"));

        JsonNode body = json.readTree(github.requests("POST", BASE + "/issues/7/labels").get(0).body());
        assertThat(body.path("labels")).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Scripted server
    // ------------------------------------------------------------------

    record Recorded(String method, String path, String query, Map<String, String> headers, String body) {}

    record Scripted(int status, String body, Map<String, String> headers) {}

    /**
     * Answers each "METHOD path" with its queued responses in order; the last
     * one queued is repeated once the queue runs dry.
     */
    static class ScriptedGitHub {

        private final HttpServer server;
        private final Map<String, Deque<Scripted>> script   = new HashMap<>();
        private final List<Recorded>               recorded = Collections.synchronizedList(new ArrayList<>());

        ScriptedGitHub() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/", this::handle);
            server.start();
        }

        String url() {
            return "http://127.0.0.1:" + server.getAddress().getPort();
        }

        void stop() {
            server.stop(0);
        }

        synchronized void respond(String method, String path, int status, String body, String... headerPairs) {
            Map<String, String> headers = new HashMap<>();
            for (int i = 0; i + 1 < headerPairs.length; i += 2) {
                headers.put(headerPairs[i], headerPairs[i + 1]);
            }
            script.computeIfAbsent(method + " " + path, k -> new ArrayDeque<>())
                    .addLast(new Scripted(status, body, headers));
        }

        List<Recorded> requests(String method, String path) {
            synchronized (recorded) {
                return recorded.stream().filter(r -> r.method().equals(method) && r.path().equals(path)).toList();
            }
        }

        private void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path   = exchange.getRequestURI().getRawPath().replace("%2F", "/");
            String body   = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            Map<String, String> headers = new HashMap<>();
            exchange.getRequestHeaders().forEach((k, v) -> headers.put(k.toLowerCase(), v.get(0)));
            recorded.add(new Recorded(method, path, exchange.getRequestURI().getRawQuery(), headers, body));

            Scripted reply = next(method + " " + path);
            reply.headers().forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }

        private synchronized Scripted next(String key) {
            Deque<Scripted> queue = script.get(key);
            if (queue == null || queue.isEmpty()) {
                return new Scripted(404, "{\"message\":\"Not Found\"}", Map.of());
            }
            return queue.size() > 1 ? queue.pollFirst() : queue.peekFirst();
        }
    }
}
