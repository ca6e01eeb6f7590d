package alpha.waypoint.core;

import alpha.waypoint.handler.Middleware;

import java.util.List;

/**
 * A registered route; a handler and the middleware to execute before it.<p>
 * 
 * The middleware list is a snapshot taken at the time of registration.
 * 
 * @param method registered method
 * @param pattern registered pattern
 * @param handler terminal handler
 * @param middleware executed in order before the handler (unmodifiable)
 * @param <E> type of environment
 * @param <S> type of store
 */
record Route<E, S>(
        String method,
        String pattern,
        Middleware<E, S> handler,
        List<Middleware<E, S>> middleware)
{
    @Override
    public String toString() {
        return method + " " + pattern;
    }
}
