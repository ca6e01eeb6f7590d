package alpha.waypoint.cors;

import alpha.waypoint.Chain;
import alpha.waypoint.handler.Context;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Response;

import java.util.concurrent.CompletionStage;

import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_ALLOW_CREDENTIALS;
import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_ALLOW_HEADERS;
import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_ALLOW_METHODS;
import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_ALLOW_ORIGIN;
import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_EXPOSE_HEADERS;
import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_MAX_AGE;
import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_REQUEST_HEADERS;
import static alpha.waypoint.HttpConstants.HeaderName.ACCESS_CONTROL_REQUEST_METHOD;
import static alpha.waypoint.HttpConstants.HeaderName.ORIGIN;
import static alpha.waypoint.HttpConstants.Method.OPTIONS;
import static java.util.Locale.ROOT;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * A middleware implementing Cross-Origin Resource Sharing.<p>
 * 
 * A preflight request (OPTIONS with an Origin header of an allowed origin) is
 * answered by this middleware with the CORS headers set, unless
 * {@link CorsOptions#preflightContinue()} is {@code true}, in which case the
 * headers are added to the response of the chain.<p>
 * 
 * For any other request with an allowed origin, the CORS headers are added to
 * the response of the chain. Requests without an Origin header, or from an
 * origin not allowed, pass through untouched.<p>
 * 
 * <pre>
 *   router.use(Cors.cors());
 * </pre>
 * 
 * This class is built on the public middleware contract only.
 * 
 * @param <E> type of environment
 * @param <S> type of store
 */
public final class Cors<E, S> implements Middleware<E, S>
{
    /**
     * Creates a CORS middleware using {@link CorsOptions#DEFAULT}.
     * 
     * @param <E> type of environment
     * @param <S> type of store
     * 
     * @return a CORS middleware
     */
    public static <E, S> Cors<E, S> cors() {
        return new Cors<>(CorsOptions.DEFAULT);
    }
    
    /**
     * Creates a CORS middleware.
     * 
     * @param options of middleware
     * @param <E> type of environment
     * @param <S> type of store
     * 
     * @return a CORS middleware
     * 
     * @throws NullPointerException if {@code options} is {@code null}
     */
    public static <E, S> Cors<E, S> cors(CorsOptions options) {
        return new Cors<>(options);
    }
    
    private final CorsOptions opts;
    
    private Cors(CorsOptions opts) {
        this.opts = requireNonNull(opts);
    }
    
    @Override
    public CompletionStage<Response> apply(Context<E, S> ctx, Chain chain) {
        var req = ctx.request();
        String origin = req.headers().firstValue(ORIGIN).orElse(null);
        if (origin == null || !opts.isAllowed(origin)) {
            return chain.proceed();
        }
        if (req.method().toUpperCase(ROOT).equals(OPTIONS)) {
            return preflight(ctx, chain, origin);
        }
        return chain.proceed().thenApply(rsp ->
                rsp == null ? null : withActualHeaders(rsp, origin));
    }
    
    private CompletionStage<Response> preflight(
            Context<E, S> ctx, Chain chain, String origin) {
        var headers = ctx.request().headers();
        if (!opts.preflightContinue()) {
            return completedStage(withPreflightHeaders(
                    Response.builder(opts.optionsSuccessStatus()),
                    origin,
                    headers.firstValue(ACCESS_CONTROL_REQUEST_METHOD).orElse(null),
                    headers.firstValue(ACCESS_CONTROL_REQUEST_HEADERS).orElse(null)));
        }
        return chain.proceed().thenApply(rsp -> withPreflightHeaders(
                rsp == null ? Response.builder(opts.optionsSuccessStatus()) : rsp.toBuilder(),
                origin,
                headers.firstValue(ACCESS_CONTROL_REQUEST_METHOD).orElse(null),
                headers.firstValue(ACCESS_CONTROL_REQUEST_HEADERS).orElse(null)));
    }
    
    private Response withPreflightHeaders(
            Response.Builder b, String origin, String reqMethod, String reqHeaders) {
        b = withCommonHeaders(b, origin);
        if (opts.maxAge() > 0) {
            b = b.header(ACCESS_CONTROL_MAX_AGE, Long.toString(opts.maxAge()));
        }
        if (reqMethod != null && opts.methods().contains(reqMethod.toUpperCase(ROOT))) {
            b = b.header(ACCESS_CONTROL_ALLOW_METHODS, String.join(", ", opts.methods()));
        }
        if (reqHeaders != null) {
            b = b.header(ACCESS_CONTROL_ALLOW_HEADERS, String.join(", ", opts.allowedHeaders()));
        }
        return b.build();
    }
    
    private Response withActualHeaders(Response rsp, String origin) {
        return withCommonHeaders(rsp.toBuilder(), origin).build();
    }
    
    private Response.Builder withCommonHeaders(Response.Builder b, String origin) {
        b = b.header(ACCESS_CONTROL_ALLOW_ORIGIN,
                opts.originPolicy() == CorsOptions.OriginPolicy.ANY ? "*" : origin);
        if (opts.credentials()) {
            b = b.header(ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        }
        if (!opts.exposedHeaders().isEmpty()) {
            b = b.header(ACCESS_CONTROL_EXPOSE_HEADERS, String.join(", ", opts.exposedHeaders()));
        }
        return b;
    }
}
