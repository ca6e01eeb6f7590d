package alpha.waypoint.core;

import alpha.waypoint.Chain;
import alpha.waypoint.handler.ChainProceededTwiceException;
import alpha.waypoint.handler.Context;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.lang.System.Logger.Level.ERROR;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;
import static java.util.function.Function.identity;

/**
 * Executes the middleware of a route, leading up to the route's handler.<p>
 * 
 * The entry point is {@link #execute()}. A new chain must be created for each
 * request.<p>
 * 
 * The chain keeps a cursor of the highest step reached. Proceeding to a step
 * not beyond the cursor is a bug in the middleware that proceeded; the call
 * throws a {@link ChainProceededTwiceException} and the whole chain completes
 * exceptionally with it.<p>
 * 
 * A middleware that fails is logged and replaced by
 * {@link Responses#internalServerError()}. The failure of the handler is not
 * recovered; it propagates through the chain (middleware awaiting the
 * continuation observe it) and out of the chain.
 * 
 * @param <E> type of environment
 * @param <S> type of store
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class InvocationChain<E, S>
{
    private static final System.Logger LOG
            = System.getLogger(InvocationChain.class.getPackageName());
    
    private static final Chain NO_OP = () -> completedStage(null);
    
    private final Context<E, S> ctx;
    private final List<Middleware<E, S>> middleware;
    private final Middleware<E, S> handler;
    private final AtomicInteger reached;
    private final AtomicReference<Throwable> misuse, handlerFailure;
    
    InvocationChain(Context<E, S> ctx, Route<E, S> route) {
        this(ctx, route.middleware(), route.handler());
    }
    
    InvocationChain(Context<E, S> ctx, List<Middleware<E, S>> middleware, Middleware<E, S> handler) {
        assert ctx != null;
        assert middleware != null;
        assert handler != null;
        this.ctx            = ctx;
        this.middleware     = middleware;
        this.handler        = handler;
        this.reached        = new AtomicInteger(-1);
        this.misuse         = new AtomicReference<>();
        this.handlerFailure = new AtomicReference<>();
    }
    
    /**
     * Executes the chain.<p>
     * 
     * The returned stage completes with the response produced by the chain,
     * or {@code null} if no entity produced a response.<p>
     * 
     * The stage completes exceptionally with the failure of the handler, or a
     * {@link ChainProceededTwiceException} if a middleware proceeded twice.
     * 
     * @return the result (never {@code null})
     */
    CompletionStage<Response> execute() {
        var result = new CompletableFuture<Response>();
        proceed(0).whenComplete((rsp, thr) -> {
            Throwable m = misuse.get();
            if (m != null) {
                result.completeExceptionally(m);
            } else if (thr != null) {
                result.completeExceptionally(unwrap(thr));
            } else {
                result.complete(rsp);
            }
        });
        return result;
    }
    
    private CompletionStage<Response> proceed(int step) {
        final int prev = reached.getAndAccumulate(step, Math::max);
        if (step <= prev) {
            var e = new ChainProceededTwiceException(
                    Chain.class.getSimpleName() + ".proceed() was already called");
            misuse.compareAndSet(null, e);
            throw e;
        }
        return step < middleware.size() ?
                callMiddleware(step) : callHandler();
    }
    
    private CompletionStage<Response> callMiddleware(int step) {
        final var m = middleware.get(step);
        final var next = new AtomicReference<CompletionStage<Response>>();
        final Chain chain = () -> {
            // Recursive
            var s = proceed(step + 1);
            next.set(s);
            return s;
        };
        
        CompletionStage<Response> s;
        try {
            s = m.apply(ctx, chain);
        } catch (Throwable t) {
            return recover(m, t);
        }
        if (s == null) {
            s = completedStage(null);
        }
        
        return s.handle((rsp, thr) -> {
            if (thr != null) {
                return recover(m, thr);
            }
            if (rsp != null) {
                // Short-circuit, or whatever the middleware made of the result
                return completedStage(rsp);
            }
            // No response; propagate the result of the continuation, if any
            var n = next.get();
            return n != null ? n : InvocationChain.<Response>completedNull();
        }).thenCompose(identity());
    }
    
    private CompletionStage<Response> callHandler() {
        CompletionStage<Response> s;
        try {
            s = handler.apply(ctx, NO_OP);
        } catch (Throwable t) {
            handlerFailure.compareAndSet(null, t);
            return failedStage(t);
        }
        if (s == null) {
            return completedNull();
        }
        return s.whenComplete((rsp, thr) -> {
            if (thr != null) {
                handlerFailure.compareAndSet(null, unwrap(thr));
            }
        });
    }
    
    private CompletionStage<Response> recover(Middleware<E, S> m, Throwable thr) {
        final Throwable t = unwrap(thr);
        if (t == misuse.get() || t == handlerFailure.get()) {
            // Not ours to recover
            return failedStage(t);
        }
        LOG.log(ERROR, () -> "Middleware \"" + m + "\" failed, responding " +
                Responses.internalServerError().statusCode() + ".", t);
        return completedStage(Responses.internalServerError());
    }
    
    private static <T> CompletionStage<T> completedNull() {
        return completedStage(null);
    }
    
    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
