package alpha.waypoint.route;

import alpha.waypoint.Config;

import java.io.Serial;

/**
 * Thrown by a router when a route is registered whose path parameter has a
 * different name than the path parameter already registered at the same
 * position, and {@link Config#rejectParameterRename()} is {@code true}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class RouteCollisionException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RouteCollisionException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteCollisionException(String message) {
        super(message);
    }
}
