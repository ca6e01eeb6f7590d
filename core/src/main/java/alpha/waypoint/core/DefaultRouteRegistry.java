package alpha.waypoint.core;

import alpha.waypoint.Config;
import alpha.waypoint.route.RouteCollisionException;
import alpha.waypoint.route.RoutePatternInvalidException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static alpha.waypoint.HttpConstants.Method.ANY;
import static alpha.waypoint.core.Segments.ASTERISK_STR;
import static alpha.waypoint.core.Segments.isParam;
import static alpha.waypoint.core.Segments.isWildcard;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.text.MessageFormat.format;
import static java.util.Collections.unmodifiableMap;

/**
 * A registry of routes, with one tree per method.<p>
 * 
 * Routes registered using the method {@value alpha.waypoint.HttpConstants.Method#ANY}
 * go to a separate tree, which is consulted only if the tree of the request's
 * method did not produce a match.
 * 
 * @param <E> type of environment
 * @param <S> type of store
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultRouteRegistry<E, S>
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouteRegistry.class.getPackageName());
    
    /*
     * Implementation note:
     * 
     * Route objects are stored in the tree as node values. Literal segments
     * are keyed as-is, a path parameter is the node's one parameter child and
     * the wildcard is the node's one wildcard child. The parameter name is
     * stored in the parent of the parameter child. I.e., route
     * "/user/:id/file/*" will be stored as:
     * 
     *   root -> "user" -> param(id) -> "file" -> wildcard -> route object
     * 
     * When looking up a route given a request path, it's only a matter of
     * reading the hierarchy using the path segments until we've reached our
     * position, collecting parameter values on the way. If that position has a
     * route stored, then it's a match.
     */
    
    private final Config config;
    private final Map<String, Tree<Route<E, S>>> trees = new HashMap<>();
    
    DefaultRouteRegistry(Config config) {
        this.config = config;
    }
    
    /**
     * Adds a route.<p>
     * 
     * A route already registered with the same method and pattern is replaced.
     * 
     * @param r route to add
     * 
     * @throws RoutePatternInvalidException
     *             if the pattern is invalid (as configured)
     * @throws RouteCollisionException
     *             if a path parameter is renamed (and this is configured to be
     *             rejected)
     */
    void add(Route<E, S> r) {
        final List<String> segments = Segments.split(r.pattern());
        validate(r, segments);
        
        Tree.Node<Route<E, S>> n = trees.computeIfAbsent(r.method(), k -> new Tree<>()).root();
        for (String s : segments) {
            if (isWildcard(s)) {
                // Anything after is ignored (if not rejected by validate())
                n = n.wildcardOrCreate();
                break;
            } else if (isParam(s)) {
                n = paramOrCreate(n, s.substring(1), r);
            } else {
                n = n.literalOrCreate(s);
            }
        }
        
        Route<E, S> old = n.set(r);
        if (old == null) {
            LOG.log(DEBUG, () -> "Registered route: " + r);
        } else {
            LOG.log(DEBUG, () -> format("Route \"{0}\" replaced \"{1}\".", r, old));
        }
    }
    
    private void validate(Route<E, S> r, List<String> segments) {
        int wildcard = segments.indexOf(ASTERISK_STR);
        if (wildcard != -1 && wildcard < segments.size() - 1) {
            if (config.rejectSegmentsAfterWildcard()) {
                throw new RoutePatternInvalidException(
                        "Segments after wildcard: \"" + r.pattern() + "\".");
            }
            LOG.log(WARNING, () ->
                "Segments after wildcard are ignored: \"" + r.pattern() + "\".");
        }
        for (String s : segments.subList(0, wildcard == -1 ? segments.size() : wildcard)) {
            if (isParam(s) && s.length() == 1) {
                if (config.rejectEmptyParameterName()) {
                    throw new RoutePatternInvalidException(
                            "Empty path parameter name: \"" + r.pattern() + "\".");
                }
                LOG.log(WARNING, () ->
                    "Empty path parameter name: \"" + r.pattern() + "\".");
            }
        }
    }
    
    private Tree.Node<Route<E, S>> paramOrCreate(
            Tree.Node<Route<E, S>> parent, String name, Route<E, S> r)
    {
        final String prev = parent.paramName();
        if (prev != null && !prev.equals(name)) {
            if (config.rejectParameterRename()) {
                throw new RouteCollisionException(format(
                        "Route \"{0}\" renames path parameter \"{1}\" to \"{2}\".",
                        r, prev, name));
            }
            LOG.log(WARNING, () -> format(
                    "Route \"{0}\" renamed path parameter \"{1}\" to \"{2}\"; " +
                    "applies to all routes sharing the parameter.", r, prev, name));
        }
        return parent.paramOrCreate(name);
    }
    
    /**
     * Match the path segments from a request path against a route.<p>
     * 
     * First the tree of the method is searched, then the tree of
     * {@value alpha.waypoint.HttpConstants.Method#ANY}.
     * 
     * @param method of request
     * @param segments of request path (not decoded)
     * 
     * @return a match, or {@code null} if no route matched
     */
    RouteMatch<E, S> lookup(String method, List<String> segments) {
        RouteMatch<E, S> m = match(trees.get(method), segments);
        if (m == null && !method.equals(ANY)) {
            m = match(trees.get(ANY), segments);
        }
        return m;
    }
    
    private static <E, S> RouteMatch<E, S> match(
            Tree<Route<E, S>> tree, List<String> segments)
    {
        if (tree == null) {
            return null;
        }
        
        Tree.Node<Route<E, S>> n = tree.root();
        Map<String, String> params = Map.of();
        boolean rest = false;
        
        for (int i = 0; i < segments.size(); ++i) {
            final String s = segments.get(i);
            Tree.Node<Route<E, S>> c;
            if ((c = n.literal(s)) != null) {
                // Literal found, on to next
                n = c;
            } else if ((c = n.param()) != null) {
                // Segment will be read as value to path param, on to next
                (params = mk(params)).put(n.paramName(), s);
                n = c;
            } else if ((c = n.wildcard()) != null) {
                // Wildcard eats the rest
                (params = mk(params)).put(ASTERISK_STR, Segments.join(segments, i));
                n = c;
                rest = true;
                break;
            } else {
                // No partial credit
                return null;
            }
        }
        
        Route<E, S> r = n.get();
        if (r == null && !rest && n.wildcard() != null) {
            // Nothing was there? The wildcard also matches nothing
            r = n.wildcard().get();
            if (r != null) {
                (params = mk(params)).put(ASTERISK_STR, "");
            }
        }
        
        return r == null ? null : new RouteMatch<>(r, unmodifiableMap(params));
    }
    
    private static <K, V> Map<K, V> mk(Map<K, V> map) {
        return map.isEmpty() ? new HashMap<>() : map;
    }
    
    /**
     * FOR TESTS ONLY: Shortcut for {@link Tree#toMap(String)} using "/" as
     * key-segment delimiter.
     * 
     * @param method of routes
     * 
     * @return all registered routes of the method
     */
    Map<String, Route<E, S>> dump(String method) {
        var t = trees.get(method);
        return t == null ? Map.of() : t.toMap("/");
    }
}
