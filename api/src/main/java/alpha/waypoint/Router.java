package alpha.waypoint;

import alpha.waypoint.handler.Context;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Request;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.route.RouteCollisionException;
import alpha.waypoint.route.RoutePatternInvalidException;

import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CompletionStage;

import static alpha.waypoint.HttpConstants.Method.ANY;
import static alpha.waypoint.HttpConstants.Method.DELETE;
import static alpha.waypoint.HttpConstants.Method.GET;
import static alpha.waypoint.HttpConstants.Method.HEAD;
import static alpha.waypoint.HttpConstants.Method.OPTIONS;
import static alpha.waypoint.HttpConstants.Method.PATCH;
import static alpha.waypoint.HttpConstants.Method.POST;
import static alpha.waypoint.HttpConstants.Method.PUT;

/**
 * Resolves a request to a handler and executes the handler's invocation
 * chain.<p>
 * 
 * A router is built once, then serves any number of requests:
 * 
 * <pre>
 *   Router&lt;Env, Store&gt; app = Router.create();
 *   app.use(logRequests)
 *      .get("/users/:id", (ctx, chain) -&gt;
 *          completedStage(Responses.text("User " + ctx.param("id"))))
 *      .mount("/admin", admin);
 *   
 *   CompletionStage&lt;Response&gt; rsp = app.handle(request, env, store);
 * </pre>
 * 
 * <h2>Route patterns</h2>
 * 
 * A pattern is made up of segments separated by '/'. A segment is either a
 * literal (matched exactly), a path parameter which starts with ':' and
 * matches any single segment, binding its value to the name that follows the
 * colon, or a wildcard '*' which must be the last segment and matches the rest
 * of the path, including nothing at all. The rest of the path is bound under
 * the name "*". The leading '/' of the pattern is optional.<p>
 * 
 * Literals take precedence over a path parameter which takes precedence over
 * a wildcard. The precedence applies at each node, there is no backtracking:
 * 
 * <pre>
 *   /users/admin     matches  /users/admin
 *   /users/:id       matches  /users/123
 *   /users/*         matches  /users, and /users/123/posts
 * </pre>
 * 
 * Path parameter values are not percent-decoded.
 * 
 * <h2>Middleware</h2>
 * 
 * The middleware of a route is a snapshot taken at the time of registration;
 * first all middleware given to {@link #use(Middleware)} up until that point,
 * then the middleware given to the registration method. Middleware added
 * later does not apply to routes already registered.<p>
 * 
 * A middleware that fails causes the router to log the error and respond
 * {@link Responses#internalServerError()}. A handler that fails causes the
 * stage returned from {@code handle} to complete exceptionally.
 * 
 * <h2>Thread-safety</h2>
 * 
 * Registration is not thread-safe and must not run concurrently with
 * {@code handle}. Once built, the router may serve requests concurrently.
 * 
 * @param <E> type of environment value, passed as-is to the invocation chain
 * @param <S> type of store value, shared by the invocation chain of one request
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Router<E, S>
{
    /**
     * Creates a new router using the default configuration.
     * 
     * @param <E> type of environment
     * @param <S> type of store
     * 
     * @return a new router
     */
    static <E, S> Router<E, S> create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates a new router.
     * 
     * @param config of router
     * @param <E> type of environment
     * @param <S> type of store
     * 
     * @return a new router
     * 
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    static <E, S> Router<E, S> create(Config config) {
        var loader = ServiceLoader.load(RouterFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config);
    }
    
    /**
     * Adds a global middleware.<p>
     * 
     * The middleware applies only to routes registered after this call.
     * 
     * @param middleware to add
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code middleware} is {@code null}
     */
    Router<E, S> use(Middleware<E, S> middleware);
    
    /**
     * Registers a route.<p>
     * 
     * Re-registering the same method and pattern replaces the previous route.
     * 
     * @param method of request (case-sensitive), or {@value HttpConstants.Method#ANY}
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route, executed after the global middleware
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument or element is {@code null}
     * @throws IllegalArgumentException
     *             if {@code method} is empty
     * @throws RoutePatternInvalidException
     *             if the pattern is invalid (as configured)
     * @throws RouteCollisionException
     *             if a path parameter is renamed, and the configuration rejects
     *             renames
     * 
     * @see Config
     */
    Router<E, S> add(String method, String pattern,
            Middleware<E, S> handler, List<? extends Middleware<E, S>> middleware);
    
    /**
     * Registers a GET route.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> get(String pattern, Middleware<E, S> handler) {
        return add(GET, pattern, handler, List.of());
    }
    
    /**
     * Registers a GET route with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> get(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(GET, pattern, handler, middleware);
    }
    
    /**
     * Registers a POST route.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> post(String pattern, Middleware<E, S> handler) {
        return add(POST, pattern, handler, List.of());
    }
    
    /**
     * Registers a POST route with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> post(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(POST, pattern, handler, middleware);
    }
    
    /**
     * Registers a PUT route.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> put(String pattern, Middleware<E, S> handler) {
        return add(PUT, pattern, handler, List.of());
    }
    
    /**
     * Registers a PUT route with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> put(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(PUT, pattern, handler, middleware);
    }
    
    /**
     * Registers a PATCH route.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> patch(String pattern, Middleware<E, S> handler) {
        return add(PATCH, pattern, handler, List.of());
    }
    
    /**
     * Registers a PATCH route with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> patch(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(PATCH, pattern, handler, middleware);
    }
    
    /**
     * Registers a DELETE route.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> delete(String pattern, Middleware<E, S> handler) {
        return add(DELETE, pattern, handler, List.of());
    }
    
    /**
     * Registers a DELETE route with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> delete(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(DELETE, pattern, handler, middleware);
    }
    
    /**
     * Registers a HEAD route.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> head(String pattern, Middleware<E, S> handler) {
        return add(HEAD, pattern, handler, List.of());
    }
    
    /**
     * Registers a HEAD route with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> head(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(HEAD, pattern, handler, middleware);
    }
    
    /**
     * Registers an OPTIONS route.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> options(String pattern, Middleware<E, S> handler) {
        return add(OPTIONS, pattern, handler, List.of());
    }
    
    /**
     * Registers an OPTIONS route with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> options(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(OPTIONS, pattern, handler, middleware);
    }
    
    /**
     * Registers a route matching any method.<p>
     * 
     * The route is consulted only if no route of the request's method
     * matched.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #add(String, String, Middleware, List)
     */
    default Router<E, S> any(String pattern, Middleware<E, S> handler) {
        return add(ANY, pattern, handler, List.of());
    }
    
    /**
     * Registers a route matching any method, with route-specific middleware.
     * 
     * @param pattern route pattern
     * @param handler the route's handler
     * @param middleware of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @see #any(String, Middleware)
     */
    default Router<E, S> any(String pattern, Middleware<E, S> handler,
            List<? extends Middleware<E, S>> middleware) {
        return add(ANY, pattern, handler, middleware);
    }
    
    /**
     * Mounts a child router under a path prefix.<p>
     * 
     * A request whose path starts with the prefix, of any method, is delegated
     * to the child, with the prefix stripped from the path. For example, with
     * the prefix "/api", the child sees "/api/users" as "/users" and "/api" as
     * "/".<p>
     * 
     * The child receives the same environment value and the very same store
     * reference as the parent's chain. The request's headers and body are
     * forwarded, not copied.<p>
     * 
     * The mount is registered as a route of method
     * {@value HttpConstants.Method#ANY}. Global middleware of this router
     * added before the mount applies to it. The child's own global middleware
     * applies to the child's routes.<p>
     * 
     * The prefix is matched literally; it can not contain path parameters or
     * a wildcard.
     * 
     * @param prefix path prefix
     * @param child router
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code child} is this router
     * @throws RoutePatternInvalidException
     *             if {@code prefix} has a parameter or wildcard segment
     */
    Router<E, S> mount(String prefix, Router<E, S> child);
    
    /**
     * Resolves the request to a route and executes its invocation chain.<p>
     * 
     * The returned stage completes with:
     * <ul>
     *   <li>{@link Responses#notFound()} if no route matched</li>
     *   <li>{@link Responses#internalServerError()} if a middleware failed</li>
     *   <li>{@link Responses#ok()} if no entity of the chain produced a
     *       response</li>
     *   <li>otherwise the response produced by the chain</li>
     * </ul>
     * 
     * The stage completes exceptionally if the handler failed, or if a
     * middleware {@linkplain Chain#proceed() proceeded} twice.
     * 
     * @param request to handle
     * @param env environment value, available through {@link Context#env()}
     * @param store store value, available through {@link Context#store()}
     * 
     * @return the result (never {@code null})
     * 
     * @throws NullPointerException
     *             if {@code request} is {@code null}
     */
    CompletionStage<Response> handle(Request request, E env, S store);
    
    /**
     * Equivalent to {@code handle(request, env, null)}.
     * 
     * @param request to handle
     * @param env environment value
     * 
     * @return the result (never {@code null})
     * 
     * @throws NullPointerException
     *             if {@code request} is {@code null}
     */
    default CompletionStage<Response> handle(Request request, E env) {
        return handle(request, env, null);
    }
    
    /**
     * Returns the router's configuration.
     * 
     * @return the router's configuration (never {@code null})
     */
    Config config();
}
