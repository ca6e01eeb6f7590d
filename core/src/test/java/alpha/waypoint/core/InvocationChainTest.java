package alpha.waypoint.core;

import alpha.waypoint.handler.ChainProceededTwiceException;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import static alpha.waypoint.testutil.Stages.await;
import static alpha.waypoint.testutil.Stages.awaitFailure;
import static alpha.waypoint.testutil.TestRequests.get;
import static java.lang.System.Logger.Level.ERROR;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Small tests for {@link InvocationChain}.
 */
class InvocationChainTest
{
    private final List<String> trail = new ArrayList<>();
    private final DefaultContext<Void, Void> ctx = new DefaultContext<>(
            get("/"), Map.of(), Map.of(), null, null);
    private LogRecorder logs;
    
    @BeforeEach
    void startRecording() {
        logs = LogRecorder.startRecording();
    }
    
    @AfterEach
    void stopRecording() {
        logs.stopRecording();
    }
    
    @Test
    void executes_in_order() throws Exception {
        var rsp = Responses.text("handler");
        var s = execute(List.of(step("A"), step("B")), (c, ch) -> {
            trail.add("handler");
            return completedStage(rsp);
        });
        assertThat(await(s)).isSameAs(rsp);
        assertThat(trail).containsExactly("A", "B", "handler");
        logs.assertNoProblem();
    }
    
    @Test
    void no_middleware() throws Exception {
        var rsp = Responses.noContent();
        assertThat(await(execute(List.of(), (c, ch) -> completedStage(rsp))))
                .isSameAs(rsp);
    }
    
    @Test
    void handler_no_response() throws Exception {
        assertThat(await(execute(List.of(step("A")), (c, ch) -> null))).isNull();
        assertThat(await(execute(List.of(), (c, ch) -> completedStage(null)))).isNull();
    }
    
    @Test
    void handler_chain_is_no_op() throws Exception {
        var s = execute(List.of(), (c, ch) -> ch.proceed());
        assertThat(await(s)).isNull();
    }
    
    @Test
    void middleware_no_response_propagates_continuation() throws Exception {
        var rsp = Responses.text("handler");
        Middleware<Void, Void> ignoresResult = (c, ch) -> {
            ch.proceed();
            return null;
        };
        var s = execute(List.of(ignoresResult), (c, ch) -> completedStage(rsp));
        assertThat(await(s)).isSameAs(rsp);
    }
    
    @Test
    void middleware_maps_response() throws Exception {
        Middleware<Void, Void> addHeader = (c, ch) -> ch.proceed().thenApply(r ->
                r.toBuilder().header("X-Seen", "yes").build());
        var s = execute(List.of(addHeader), (c, ch) -> completedStage(Responses.ok()));
        assertThat(await(s).headers().firstValue("X-Seen")).hasValue("yes");
    }
    
    @Test
    void short_circuit() throws Exception {
        @SuppressWarnings("unchecked")
        Middleware<Void, Void> second  = mock(Middleware.class),
                               handler = mock(Middleware.class);
        Middleware<Void, Void> guard = (c, ch) -> completedStage(Responses.forbidden());
        
        var s = execute(List.of(guard, second), handler);
        
        assertThat(await(s).statusCode()).isEqualTo(403);
        verifyNoInteractions(second, handler);
    }
    
    @Test
    void proceed_twice() throws Exception {
        Middleware<Void, Void> twice = (c, ch) -> {
            ch.proceed();
            return ch.proceed();
        };
        var s = execute(List.of(twice), (c, ch) -> {
            trail.add("handler");
            return completedStage(Responses.ok());
        });
        assertThat(awaitFailure(s))
                .isExactlyInstanceOf(ChainProceededTwiceException.class)
                .hasMessage("Chain.proceed() was already called");
        assertThat(trail).containsExactly("handler");
        // Not a middleware failure
        logs.assertNoProblem();
    }
    
    @Test
    void proceed_twice_even_if_caught() throws Exception {
        Middleware<Void, Void> sneaky = (c, ch) -> {
            ch.proceed();
            try {
                ch.proceed();
            } catch (ChainProceededTwiceException e) {
                return completedStage(Responses.ok());
            }
            throw new AssertionError();
        };
        var s = execute(List.of(sneaky), (c, ch) -> null);
        assertThat(awaitFailure(s))
                .isExactlyInstanceOf(ChainProceededTwiceException.class);
    }
    
    @Test
    void middleware_throws() throws Exception {
        @SuppressWarnings("unchecked")
        Middleware<Void, Void> handler = mock(Middleware.class);
        Middleware<Void, Void> boom = (c, ch) -> {
            throw new IllegalStateException("boom");
        };
        
        var rsp = await(execute(List.of(boom), handler));
        
        assertThat(rsp).isSameAs(Responses.internalServerError());
        assertThat(rsp.bodyAsString()).isEqualTo("Internal Server Error");
        verifyNoInteractions(handler);
        logs.assertRemove(ERROR, "Middleware", IllegalStateException.class)
            .hasMessage("boom");
        logs.assertNoProblem();
    }
    
    @Test
    void middleware_fails_async() throws Exception {
        Middleware<Void, Void> boom = (c, ch) -> failedStage(new IOException("async"));
        var rsp = await(execute(List.of(boom), (c, ch) -> null));
        assertThat(rsp.statusCode()).isEqualTo(500);
        logs.assertRemove(ERROR, "Middleware", IOException.class)
            .hasMessage("async");
    }
    
    @Test
    void middleware_fails_after_proceeding() throws Exception {
        Middleware<Void, Void> outer = step("outer");
        Middleware<Void, Void> inner = (c, ch) -> ch.proceed().thenApply(r -> {
            throw new IllegalArgumentException("late");
        });
        var rsp = await(execute(List.of(outer, inner), (c, ch) -> completedStage(Responses.ok())));
        // Outer sees the 500 of inner
        assertThat(rsp.statusCode()).isEqualTo(500);
        logs.assertRemove(ERROR, "Middleware", IllegalArgumentException.class);
    }
    
    @Test
    void handler_throws() throws Exception {
        var s = execute(List.of(step("A")), (c, ch) -> {
            throw new IOException("handler");
        });
        assertThat(awaitFailure(s))
                .isExactlyInstanceOf(IOException.class)
                .hasMessage("handler");
        // Handler failures are not logged nor recovered by the chain
        logs.assertNoProblem();
    }
    
    @Test
    void handler_fails_async_through_awaiting_middleware() throws Exception {
        var seen = new ArrayList<Throwable>();
        Middleware<Void, Void> observer = (c, ch) -> ch.proceed().whenComplete((r, t) -> seen.add(t));
        var s = execute(List.of(observer, step("B")), (c, ch) -> failedStage(new IOException("handler")));
        assertThat(awaitFailure(s))
                .isExactlyInstanceOf(IOException.class);
        assertThat(seen).hasSize(1);
        logs.assertNoProblem();
    }
    
    @Test
    void middleware_may_recover_handler_failure() throws Exception {
        Middleware<Void, Void> recover = (c, ch) ->
                ch.proceed().exceptionally(t -> Responses.status(503));
        var s = execute(List.of(recover), (c, ch) -> {
            throw new IOException();
        });
        assertThat(await(s).statusCode()).isEqualTo(503);
    }
    
    private Middleware<Void, Void> step(String name) {
        return (c, ch) -> {
            trail.add(name);
            return ch.proceed();
        };
    }
    
    private CompletionStage<Response> execute(
            List<Middleware<Void, Void>> middleware, Middleware<Void, Void> handler) {
        return new InvocationChain<>(ctx, middleware, handler).execute();
    }
}
