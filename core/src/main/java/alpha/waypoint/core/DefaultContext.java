package alpha.waypoint.core;

import alpha.waypoint.handler.Context;
import alpha.waypoint.message.Request;

import java.util.Map;

/**
 * Default implementation of {@link Context}.
 * 
 * @param request the request
 * @param params path parameters of the matched route
 * @param query decoded query parameters
 * @param env environment value
 * @param store store value
 * @param <E> type of environment
 * @param <S> type of store
 */
record DefaultContext<E, S>(
        Request request,
        Map<String, String> params,
        Map<String, String> query,
        E env,
        S store) implements Context<E, S>
{
    // Empty
}
