package alpha.waypoint;

import alpha.waypoint.handler.ChainProceededTwiceException;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Response;

import java.util.concurrent.CompletionStage;

/**
 * An API for proceeding the invocation chain.<p>
 * 
 * The chain is made up of zero or more {@link Middleware} leading up to the
 * route's handler. The middleware can short-circuit the rest of the chain by
 * <i>not</i> calling {@link #proceed()} and return a response of its own.<p>
 * 
 * A middleware that does proceed will usually return the stage returned from
 * the chain, possibly mapped to a new response. A middleware may also return
 * {@code null}, or a stage completing with {@code null}, in which case the
 * result of the chain is used anyway.<p>
 * 
 * The chain given to a handler is a no-op; it returns a stage already
 * completed with {@code null}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Chain
{
    /**
     * Calls the next entity in the invocation chain.<p>
     * 
     * The returned stage completes with the response produced by the rest of
     * the chain, or {@code null} if no entity produced a response. If the
     * handler fails, the stage completes exceptionally.
     * 
     * @return the result of the rest of the chain (never {@code null})
     * 
     * @throws ChainProceededTwiceException
     *             if called more than once for the same step of the chain
     */
    CompletionStage<Response> proceed();
}
