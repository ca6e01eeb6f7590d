package alpha.waypoint.core;

import alpha.waypoint.Chain;
import alpha.waypoint.Router;
import alpha.waypoint.handler.Context;
import alpha.waypoint.handler.Middleware;
import alpha.waypoint.message.Response;

import java.net.URI;
import java.util.concurrent.CompletionStage;

import static alpha.waypoint.core.Segments.ASTERISK_STR;
import static alpha.waypoint.core.Segments.SLASH_STR;

/**
 * The handler of a mounted router.<p>
 * 
 * Strips the mount prefix from the request path and delegates the request to
 * the child router, together with the same environment value and store
 * reference. The request's headers and body are forwarded as-is.
 * 
 * @param <E> type of environment
 * @param <S> type of store
 */
final class MountHandler<E, S> implements Middleware<E, S>
{
    /**
     * Returns the route pattern for the given mount prefix.<p>
     * 
     * E.g. "/api" and "/api/" both become "/api/*".
     * 
     * @param prefix of mount
     * 
     * @return a route pattern
     */
    static String pattern(String prefix) {
        return prefix + (prefix.endsWith(SLASH_STR) ? ASTERISK_STR : SLASH_STR + ASTERISK_STR);
    }
    
    private final String prefix;
    private final Router<E, S> child;
    
    MountHandler(String prefix, Router<E, S> child) {
        this.prefix = prefix.startsWith(SLASH_STR) ? prefix : SLASH_STR + prefix;
        this.child = child;
    }
    
    @Override
    public CompletionStage<Response> apply(Context<E, S> ctx, Chain ignored) {
        var req = ctx.request();
        var rewritten = req.withTarget(rewrite(req.target(), strip(RequestTarget.parse(req.target()).path())));
        return child.handle(rewritten, ctx.env(), ctx.store());
    }
    
    /**
     * Strips the prefix from the given path.<p>
     * 
     * The returned path always starts with exactly one "/", so that it can not
     * be mistaken for an authority when the target is in origin-form. If the
     * path does not start with the prefix, or nothing remains, "/" is
     * returned.
     * 
     * @param path raw path of request
     * 
     * @return the path of the child
     */
    String strip(String path) {
        if (!path.startsWith(prefix)) {
            return SLASH_STR;
        }
        int from = prefix.length();
        while (from < path.length() && path.charAt(from) == '/') {
            ++from;
        }
        return SLASH_STR + path.substring(from);
    }
    
    /**
     * Returns a copy of the given URI, with the raw path replaced.
     * 
     * @param uri to copy
     * @param rawPath new path (not decoded)
     * 
     * @return a new URI
     */
    static URI rewrite(URI uri, String rawPath) {
        var b = new StringBuilder();
        if (uri.getScheme() != null) {
            b.append(uri.getScheme()).append(':');
        }
        if (uri.getRawAuthority() != null) {
            b.append("//").append(uri.getRawAuthority());
        }
        b.append(rawPath);
        if (uri.getRawQuery() != null) {
            b.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            b.append('#').append(uri.getRawFragment());
        }
        return URI.create(b.toString());
    }
    
    @Override
    public String toString() {
        return MountHandler.class.getSimpleName() + "{prefix='" + prefix + "'}";
    }
}
