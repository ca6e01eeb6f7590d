package alpha.waypoint.handler;

import alpha.waypoint.Chain;
import alpha.waypoint.Router;
import alpha.waypoint.message.Response;

import java.util.concurrent.CompletionStage;

/**
 * An entity of the invocation chain.<p>
 * 
 * The same type is used for middleware and for the route's terminal handler.
 * A middleware may proceed the chain, and may return a response of its own.
 * For example:
 * 
 * <pre>
 *   Middleware&lt;Env, Store&gt; auth = (ctx, chain) -&gt; {
 *       if (ctx.request().headers().firstValue("Authorization").isEmpty()) {
 *           // Short-circuit
 *           return completedStage(Responses.forbidden());
 *       }
 *       return chain.proceed();
 *   };
 * </pre>
 * 
 * Returning {@code null}, or a stage that completes with {@code null}, means
 * the entity did not produce a response. For a middleware, the result of the
 * rest of the chain is then used.<p>
 * 
 * A handler is given a no-op chain.
 * 
 * @param <E> type of environment
 * @param <S> type of store
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Router
 */
@FunctionalInterface
public interface Middleware<E, S>
{
    /**
     * Applies this entity.<p>
     * 
     * A middleware that throws, or returns a stage that completes
     * exceptionally, causes the router to log the error and respond "500
     * Internal Server Error". A handler's failure propagates to the caller of
     * the router.
     * 
     * @param ctx request context
     * @param chain the rest of the invocation chain
     * 
     * @return the result (may be {@code null})
     * 
     * @throws Exception anything
     */
    CompletionStage<Response> apply(Context<E, S> ctx, Chain chain) throws Exception;
}
