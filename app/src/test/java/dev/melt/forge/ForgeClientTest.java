package dev.melt.forge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import dev.melt.config.ServiceConfig;
import dev.melt.git.GitServiceException;
import dev.melt.model.ChangelogData;
import dev.melt.model.Commit;
import dev.melt.model.ForgeType;
import dev.melt.model.GitInput;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Exercises the API-first strategy against a local fake forge. */
class ForgeClientTest {

    private record Reply(int status, String body, Map<String, String> headers) {}

    private final Map<String, Reply> routes = new ConcurrentHashMap<>();
    private final AtomicInteger requests = new AtomicInteger();
    private HttpServer server;
    private String hostPort;
    private RecordingFallback fallback;
    private ForgeClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            requests.incrementAndGet();
            var uri = exchange.getRequestURI();
            var key = uri.getRawPath() + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());
            var reply = routes.getOrDefault(key, new Reply(404, "{\"message\":\"Not Found\"}", Map.of()));
            reply.headers().forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            var bytes = reply.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(reply.status(), bytes.length);
            try (var out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        hostPort = "127.0.0.1:" + server.getAddress().getPort();
        fallback = new RecordingFallback();
        var config = ServiceConfig.defaults().withForgeEndpoints("http://" + hostPort, "http");
        client = new ForgeClient(config, fallback);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private GitInput github(String rev) {
        return new GitInput("nixpkgs", "NixOS", "nixpkgs", ForgeType.GITHUB, null, "main", rev, 0, "github:NixOS/nixpkgs");
    }

    @Test
    void githubCompareReturnsAheadBy() throws Exception {
        routes.put("/repos/NixOS/nixpkgs/compare/abc...main", new Reply(200, "{\"ahead_by\": 7}", Map.of()));
        assertEquals(7, client.countAhead(github("abc")));
        assertEquals(0, fallback.countCalls.get());
    }

    @Test
    void githubRateLimitIsReportedWithoutCloning() {
        routes.put(
                "/repos/NixOS/nixpkgs/compare/abc...main",
                new Reply(403, "{\"message\":\"API rate limit exceeded\"}", Map.of("x-ratelimit-remaining", "0")));
        var e = assertThrows(GitServiceException.RateLimited.class, () -> client.countAhead(github("abc")));
        assertTrue(e.getMessage().contains("GITHUB_TOKEN"));
        assertEquals(0, fallback.countCalls.get());
    }

    @Test
    void githubForbiddenWithQuotaLeftFallsBackToMirror() throws Exception {
        routes.put(
                "/repos/NixOS/nixpkgs/compare/abc...main",
                new Reply(403, "{}", Map.of("x-ratelimit-remaining", "42")));
        assertEquals(RecordingFallback.COUNT, client.countAhead(github("abc")));
        assertEquals(1, fallback.countCalls.get());
    }

    @Test
    void githubServerErrorFallsBackToMirror() throws Exception {
        routes.put("/repos/NixOS/nixpkgs/commits?sha=main&per_page=100", new Reply(500, "oops", Map.of()));
        var data = client.changelog(github("abc"));
        assertEquals(1, fallback.changelogCalls.get());
        assertEquals(RecordingFallback.CHANGELOG, data);
    }

    @Test
    void githubChangelogSplitsAtLockedCommit() throws Exception {
        routes.put(
                "/repos/NixOS/nixpkgs/commits?sha=main&per_page=100",
                new Reply(
                        200,
                        """
                        [
                          {"sha": "ccc333", "commit": {"message": "third\\n\\nbody", "author": {"name": "Carol", "date": "2024-03-03T00:00:00Z"}}},
                          {"sha": "bbb222", "commit": {"message": "second", "author": {"name": "Bob", "date": "2024-02-02T00:00:00Z"}}},
                          {"sha": "aaa111", "commit": {"message": "first", "author": {"date": "2024-01-01T00:00:00Z"}}}
                        ]
                        """,
                        Map.of()));
        var data = client.changelog(github("bbb222"));
        assertEquals(OptionalInt.of(1), data.lockedIndex());
        assertEquals(1, data.commitsAhead());
        assertEquals("third", data.commits().get(0).message());
        assertTrue(data.commits().get(1).locked());
        assertEquals("Unknown", data.commits().get(2).author());
        assertEquals(Instant.parse("2024-03-03T00:00:00Z"), data.commits().get(0).date());
    }

    @Test
    void gitlabUsesEncodedProjectPathOnSelfHostedInstance() throws Exception {
        var input = new GitInput(
                "tool", "group/sub", "tool", ForgeType.GITLAB, hostPort, null, "r1", 0, "gitlab:group/sub/tool");
        routes.put(
                "/api/v4/projects/group%2Fsub%2Ftool/repository/compare?from=r1&to=HEAD",
                new Reply(200, "{\"commits\": [{\"id\": \"x\"}, {\"id\": \"y\"}]}", Map.of()));
        assertEquals(2, client.countAhead(input));

        routes.put(
                "/api/v4/projects/group%2Fsub%2Ftool/repository/commits?ref_name=HEAD&per_page=100",
                new Reply(
                        200,
                        """
                        [{"id": "y", "title": "newer", "author_name": "Dana", "created_at": "2024-05-01T10:00:00+02:00"},
                         {"id": "r1", "title": "locked", "author_name": "Eve", "created_at": "2024-04-01T10:00:00Z"}]
                        """,
                        Map.of()));
        var data = client.changelog(input);
        assertEquals(OptionalInt.of(1), data.lockedIndex());
        assertEquals("Dana", data.commits().get(0).author());
        assertEquals(0, fallback.countCalls.get() + fallback.changelogCalls.get());
    }

    @Test
    void sourcehutCountFallsBackWhenLockedRevisionIsNotOnFirstPage() throws Exception {
        var input = new GitInput("hare", "~sircmpwn", "hare", ForgeType.SOURCEHUT, hostPort, null, "old", 0, "x");
        routes.put(
                "/api/~sircmpwn/hare/log/HEAD",
                new Reply(
                        200,
                        "{\"results\": [{\"id\": \"new1\", \"message\": \"m\", \"author\": {\"name\": \"S\"},"
                                + " \"timestamp\": \"2024-01-01T00:00:00Z\"}]}",
                        Map.of()));
        assertEquals(RecordingFallback.COUNT, client.countAhead(input));
        assertEquals(1, fallback.countCalls.get());
    }

    @Test
    void sourcehutCountsEntriesBeforeLockedRevision() throws Exception {
        var input = new GitInput("hare", "sircmpwn", "hare", ForgeType.SOURCEHUT, hostPort, null, "old", 0, "x");
        routes.put(
                "/api/~sircmpwn/hare/log/HEAD",
                new Reply(
                        200,
                        "{\"results\": [{\"id\": \"new1\"}, {\"id\": \"new2\"}, {\"id\": \"old\"}]}",
                        Map.of()));
        assertEquals(2, client.countAhead(input));
    }

    @Test
    void codebergAndGenericGoStraightToMirror() throws Exception {
        var codeberg = new GitInput("c", "o", "r", ForgeType.CODEBERG, null, null, "a", 0, "x");
        var generic = new GitInput("g", "o", "r", ForgeType.GENERIC, null, null, "a", 0, "https://example.org/o/r");
        assertEquals(RecordingFallback.COUNT, client.countAhead(codeberg));
        assertEquals(RecordingFallback.CHANGELOG, client.changelog(generic));
        assertEquals(0, requests.get());
    }

    private static final class RecordingFallback implements ForgeClient.MirrorFallback {
        static final int COUNT = 99;
        static final ChangelogData CHANGELOG = new ChangelogData(
                List.of(new Commit("mirror", "from mirror", "M", Instant.EPOCH, true)), OptionalInt.of(0));

        final AtomicInteger countCalls = new AtomicInteger();
        final AtomicInteger changelogCalls = new AtomicInteger();

        @Override
        public int countAhead(GitInput input) {
            countCalls.incrementAndGet();
            return COUNT;
        }

        @Override
        public ChangelogData changelog(GitInput input) {
            changelogCalls.incrementAndGet();
            return CHANGELOG;
        }
    }
}
