package alpha.waypoint.core.mediumtest;

import alpha.waypoint.Router;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Request;
import org.junit.jupiter.api.Test;

import java.io.Serial;
import java.net.http.HttpRequest;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static alpha.waypoint.message.Responses.text;
import static alpha.waypoint.testutil.Assertions.assertResponse;
import static alpha.waypoint.testutil.TestRequests.builder;
import static alpha.waypoint.testutil.TestRequests.delete;
import static alpha.waypoint.testutil.TestRequests.get;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.concurrent.CompletableFuture.completedStage;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests concerning routers mounted in other routers.
 */
final class MountTest extends AbstractRouterTest
{
    private static Router<String, Map<String, Object>> child() {
        return Router.create();
    }

    private static Middleware<String, Map<String, Object>> echoPath() {
        return (ctx, chain) -> completedStage(text(
                ctx.request().target().getRawPath() + " " + ctx.params()));
    }

    @Test
    void path_is_rewritten() throws Exception {
        var api = child()
                .get("/users/:id", echoPath())
                .get("/",          echoPath());
        router().mount("/api", api);

        assertResponse(handle(get("/api/users/123")), 200, "/users/123 {id=123}");
        assertResponse(handle(get("/api")), 200, "/ {}");
        assertResponse(handle(get("/api/")), 200, "/ {}");
    }

    @Test
    void doubled_separator_after_prefix() throws Exception {
        router().mount("/api", child()
                .get("/users", (ctx, chain) -> completedStage(text(
                        "users " + ctx.request().target())))
                .get("/",      (ctx, chain) -> completedStage(text(
                        "root " + ctx.request().target()))));

        var originForm = Request.builder("GET", "/api//users").build();
        assertResponse(handle(originForm), 200, "users /users");
        assertResponse(handle(get("/api//users")), 200, "users http://localhost/users");
    }

    @Test
    void prefix_with_trailing_slash() throws Exception {
        router().mount("/api/", child().get("/users", echoPath()));
        assertResponse(handle(get("/api/users")), 200, "/users {}");
        logRecorder().assertContainsOnlyOnce(DEBUG, "Mounting router at \"/api/*\".");
    }

    @Test
    void prefix_without_leading_slash() throws Exception {
        router().mount("api", child().get("/users", echoPath()));
        assertResponse(handle(get("/api/users")), 200, "/users {}");
    }

    @Test
    void mount_at_root() throws Exception {
        router().mount("/", child().get("/users", echoPath()));
        assertResponse(handle(get("/users")), 200, "/users {}");
    }

    @Test
    void nested_mounts() throws Exception {
        var v1 = child().get("/users/:id", echoPath());
        var api = child().mount("/v1", v1);
        router().mount("/api", api);
        assertResponse(handle(get("/api/v1/users/7")), 200, "/users/7 {id=7}");
    }

    @Test
    void any_method_is_forwarded() throws Exception {
        router().mount("/api", child()
                .get(   "/x", (ctx, chain) -> completedStage(text("get")))
                .delete("/x", (ctx, chain) -> completedStage(text("delete"))));
        assertResponse(handle(get("/api/x")), 200, "get");
        assertResponse(handle(delete("/api/x")), 200, "delete");
    }

    @Test
    void parent_route_has_precedence() throws Exception {
        router().get("/api/health", (ctx, chain) -> completedStage(text("parent")))
                .mount("/api", child().get("/health", (ctx, chain) -> completedStage(text("child"))));
        assertResponse(handle(get("/api/health")), 200, "parent");
    }

    @Test
    void child_not_found() throws Exception {
        router().mount("/api", child().get("/users", echoPath()));
        assertResponse(handle(get("/api/nope")), 404, "Not Found");
    }

    @Test
    void query_is_preserved() throws Exception {
        router().mount("/api", child().get("/search", (ctx, chain) ->
                completedStage(text(ctx.queryParam("q")))));
        assertResponse(handle(get("/api/search?q=mount")), 200, "mount");
    }

    @Test
    void environment_store_headers_and_body_are_forwarded() throws Exception {
        var body = HttpRequest.BodyPublishers.ofString("payload");
        var seen = new AtomicReference<Request>();
        router().mount("/api", child().post("/echo", (ctx, chain) -> {
            seen.set(ctx.request());
            ctx.store().put("child", true);
            return completedStage(text(ctx.env() + " " +
                    ctx.request().headers().firstValue("X-Trace").orElse("none")));
        }));

        var req = builder("POST", "/api/echo")
                .header("X-Trace", "abc")
                .body(body)
                .build();
        assertResponse(handle(req), 200, "test-env abc");
        assertThat(seen.get().body()).isSameAs(body);
        assertThat(seen.get().method()).isEqualTo("POST");
        assertThat(store()).containsEntry("child", true);
    }

    @Test
    void middleware_of_parent_and_child() throws Exception {
        var trace = new CopyOnWriteArrayList<String>();
        var api = child()
                .use((ctx, chain) -> { trace.add("child"); return chain.proceed(); })
                .get("/x", (ctx, chain) -> { trace.add("handler"); return completedStage(text("x")); });
        router().use((ctx, chain) -> { trace.add("parent"); return chain.proceed(); })
                .get("/local", (ctx, chain) -> completedStage(text("local")))
                .mount("/api", api);

        assertResponse(handle(get("/api/x")), 200, "x");
        assertThat(trace).containsExactly("parent", "child", "handler");

        trace.clear();
        assertResponse(handle(get("/local")), 200, "local");
        assertThat(trace).containsExactly("parent");
    }

    @Test
    void child_handler_failure_propagates() throws Exception {
        router().mount("/api", child().get("/boom", (ctx, chain) -> {
            throw new OopsException();
        }));
        assertThat(handleFailure(get("/api/boom"))).isExactlyInstanceOf(OopsException.class);
    }

    @Test
    void child_shared_by_two_parents() throws Exception {
        var shared = child().get("/ping", (ctx, chain) -> completedStage(text("pong")));
        Router<String, Map<String, Object>> other = Router.create();
        other.mount("/b", shared);
        router().mount("/a", shared);

        assertResponse(handle(get("/a/ping")), 200, "pong");
        assertResponse(other.handle(get("/b/ping"), ENV, store())
                .toCompletableFuture().get(), 200, "pong");
    }

    private static final class OopsException extends RuntimeException {
        @Serial private static final long serialVersionUID = 1L;
    }
}
