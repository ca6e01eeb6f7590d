package alpha.waypoint.handler;

import alpha.waypoint.message.Request;

import java.util.Map;

/**
 * The context of a request, given to each entity of its invocation chain.<p>
 * 
 * A context is created for each request that a router handles. It is never
 * shared across requests, though the store value it carries may be.
 * 
 * @param <E> type of environment
 * @param <S> type of store
 */
public interface Context<E, S>
{
    /**
     * Returns the request.
     * 
     * @return the request (never {@code null})
     */
    Request request();
    
    /**
     * Returns the path parameters of the matched route.<p>
     * 
     * The values are not percent-decoded. A route pattern ending with a
     * wildcard binds the rest of the path under the name "*".
     * 
     * @return an unmodifiable map (never {@code null})
     */
    Map<String, String> params();
    
    /**
     * Returns a path parameter value.
     * 
     * @param name of parameter
     * 
     * @return the value, or {@code null} if not present
     */
    default String param(String name) {
        return params().get(name);
    }
    
    /**
     * Returns the query parameters of the request.<p>
     * 
     * Keys and values are decoded. If a key is repeated, the last value wins.
     * 
     * @return an unmodifiable map (never {@code null})
     */
    Map<String, String> query();
    
    /**
     * Returns a query parameter value.
     * 
     * @param name of parameter
     * 
     * @return the value, or {@code null} if not present
     */
    default String queryParam(String name) {
        return query().get(name);
    }
    
    /**
     * Returns the environment value given to the router.
     * 
     * @return the environment value (may be {@code null})
     */
    E env();
    
    /**
     * Returns the store value given to the router.<p>
     * 
     * All entities of the chain, including those of a mounted router, see the
     * same instance.
     * 
     * @return the store value (may be {@code null})
     */
    S store();
}
