package alpha.waypoint.core.mediumtest;

import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Response;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static alpha.waypoint.message.Responses.forbidden;
import static alpha.waypoint.message.Responses.text;
import static alpha.waypoint.testutil.Assertions.assertResponse;
import static alpha.waypoint.testutil.TestRequests.builder;
import static alpha.waypoint.testutil.TestRequests.get;
import static java.util.concurrent.CompletableFuture.completedStage;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests concerning global and route-level middleware.
 */
final class MiddlewareTest extends AbstractRouterTest
{
    private final List<String> trace = new CopyOnWriteArrayList<>();

    private Middleware<String, Map<String, Object>> tracing(String name) {
        return (ctx, chain) -> {
            trace.add(name + ">");
            return chain.proceed().thenApply(rsp -> {
                trace.add("<" + name);
                return rsp;
            });
        };
    }

    private Middleware<String, Map<String, Object>> handler(String body) {
        return (ctx, chain) -> {
            trace.add(body);
            return completedStage(text(body));
        };
    }

    @Test
    void onion_order() throws Exception {
        router().use(tracing("g1"))
                .use(tracing("g2"))
                .get("/", handler("h"), List.of(tracing("r1"), tracing("r2")));
        assertResponse(handle(get("/")), 200, "h");
        assertThat(trace).containsExactly(
                "g1>", "g2>", "r1>", "r2>", "h", "<r2", "<r1", "<g2", "<g1");
    }

    @Test
    void use_applies_only_to_routes_added_after() throws Exception {
        router().get("/a", handler("a"))
                .use(tracing("m"))
                .get("/b", handler("b"));
        handle(get("/a"));
        assertThat(trace).containsExactly("a");
        trace.clear();
        handle(get("/b"));
        assertThat(trace).containsExactly("m>", "b", "<m");
    }

    @Test
    void route_middleware_is_route_local() throws Exception {
        router().get("/a", handler("a"), List.of(tracing("m")))
                .get("/b", handler("b"));
        handle(get("/b"));
        assertThat(trace).containsExactly("b");
    }

    @Test
    void short_circuit() throws Exception {
        router().use((ctx, chain) ->
                    ctx.request().headers().firstValue("Authorization").isPresent() ?
                        chain.proceed() : completedStage(forbidden()))
                .get("/secret", handler("secret"), List.of(tracing("never")));

        assertResponse(handle(get("/secret")), 403, "");
        assertThat(trace).isEmpty();

        var authorized = builder("GET", "/secret")
                .header("Authorization", "Bearer token")
                .build();
        assertResponse(handle(authorized), 200, "secret");
        assertThat(trace).containsExactly("never>", "secret", "<never");
    }

    @Test
    void middleware_decorates_response() throws Exception {
        router().use((ctx, chain) -> chain.proceed().thenApply(rsp ->
                    rsp.toBuilder().header("X-Powered-By", "waypoint").build()))
                .get("/", handler("body"));
        var rsp = handle(get("/"));
        assertResponse(rsp, 200, "body");
        assertThat(rsp.headers().firstValue("X-Powered-By")).hasValue("waypoint");
    }

    @Test
    void middleware_not_returning_continuation() throws Exception {
        // Proceeds, but returns null; the handler's response still goes out
        router().use((ctx, chain) -> {
                    chain.proceed();
                    return null;
                })
                .get("/", handler("h"));
        assertResponse(handle(get("/")), 200, "h");
    }

    @Test
    void middleware_replaces_response() throws Exception {
        router().use((ctx, chain) -> chain.proceed().thenApply(ignored -> text("replaced")))
                .get("/", handler("h"));
        assertResponse(handle(get("/")), 200, "replaced");
        assertThat(trace).containsExactly("h");
    }

    @Test
    void asynchronous_middleware() throws Exception {
        router().use((ctx, chain) -> CompletableFuture
                        .supplyAsync(() -> "async")
                        .thenCompose(v -> {
                            ctx.store().put("from", v);
                            return chain.proceed();
                        }))
                .get("/", (ctx, chain) ->
                        completedStage(text((String) ctx.store().get("from"))));
        assertResponse(handle(get("/")), 200, "async");
    }

    @Test
    void store_shared_across_chain() throws Exception {
        router().use((ctx, chain) -> {
                    ctx.store().put("user", "alice");
                    return chain.proceed();
                })
                .get("/me", (ctx, chain) ->
                        completedStage(text("hi " + ctx.store().get("user"))));
        assertResponse(handle(get("/me")), 200, "hi alice");
    }

    @Test
    void handler_chain_is_no_op() throws Exception {
        router().get("/", (ctx, chain) -> chain.proceed().thenApply(rsp -> {
            assertThat(rsp).isNull();
            return (Response) null;
        }));
        assertResponse(handle(get("/")), 200, "");
    }
}
