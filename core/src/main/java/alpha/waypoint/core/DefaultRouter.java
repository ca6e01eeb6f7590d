package alpha.waypoint.core;

import alpha.waypoint.Config;
import alpha.waypoint.Router;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Request;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.route.RoutePatternInvalidException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;

import static alpha.waypoint.HttpConstants.Method.ANY;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Default implementation of {@link Router}.
 * 
 * @param <E> type of environment
 * @param <S> type of store
 */
public final class DefaultRouter<E, S> implements Router<E, S>
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouter.class.getPackageName());
    
    private final Config config;
    private final DefaultRouteRegistry<E, S> routes;
    private final List<Middleware<E, S>> global;
    
    /**
     * Constructs a {@code DefaultRouter}.
     * 
     * @param config of router
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public DefaultRouter(Config config) {
        this.config = requireNonNull(config);
        this.routes = new DefaultRouteRegistry<>(config);
        this.global = new ArrayList<>();
    }
    
    @Override
    public Router<E, S> use(Middleware<E, S> middleware) {
        global.add(requireNonNull(middleware));
        return this;
    }
    
    @Override
    public Router<E, S> add(
            String method, String pattern,
            Middleware<E, S> handler, List<? extends Middleware<E, S>> middleware)
    {
        requireNonNull(method);
        requireNonNull(pattern);
        requireNonNull(handler);
        if (method.isEmpty()) {
            throw new IllegalArgumentException("Empty method.");
        }
        // Snapshot; use() after this call does not apply
        var all = new ArrayList<Middleware<E, S>>(global.size() + middleware.size());
        all.addAll(global);
        all.addAll(middleware);
        routes.add(new Route<>(method, pattern, handler, List.copyOf(all)));
        return this;
    }
    
    @Override
    public Router<E, S> mount(String prefix, Router<E, S> child) {
        requireNonNull(prefix);
        requireNonNull(child);
        if (child == this) {
            throw new IllegalArgumentException("Can not mount a router in itself.");
        }
        for (String seg : Segments.split(prefix)) {
            if (Segments.isParam(seg) || Segments.isWildcard(seg)) {
                throw new RoutePatternInvalidException(
                        "Mount prefix must be literal: \"" + prefix + "\".");
            }
        }
        String pattern = MountHandler.pattern(prefix);
        LOG.log(DEBUG, () -> "Mounting router at \"" + pattern + "\".");
        return add(ANY, pattern, new MountHandler<>(prefix, child), List.of());
    }
    
    @Override
    public CompletionStage<Response> handle(Request request, E env, S store) {
        final var rt = RequestTarget.parse(request.target());
        final var match = routes.lookup(request.method(), rt.segments());
        if (match == null) {
            LOG.log(DEBUG, () -> "No route found for " + request.method() + " \"" + rt.path() + "\".");
            return completedStage(Responses.notFound());
        }
        LOG.log(DEBUG, () -> "Matched route: " + match.route());
        var ctx = new DefaultContext<>(request, match.params(), rt.queryMap(), env, store);
        return new InvocationChain<>(ctx, match.route())
                .execute()
                .thenApply(rsp -> rsp != null ? rsp : Responses.ok());
    }
    
    @Override
    public Config config() {
        return config;
    }
}
