package alpha.waypoint.core;

import java.util.Map;

/**
 * A match of a route from the registry.<p>
 * 
 * This container carries the route, but also the path parameter names and
 * values as interpolated from the request path and the route's position in the
 * tree.
 * 
 * @param route matched
 * @param params path parameters (unmodifiable, values not decoded)
 * @param <E> type of environment
 * @param <S> type of store
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
record RouteMatch<E, S>(Route<E, S> route, Map<String, String> params) {
    // Empty
}
