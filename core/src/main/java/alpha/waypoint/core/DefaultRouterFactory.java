package alpha.waypoint.core;

import alpha.waypoint.Config;
import alpha.waypoint.Router;
import alpha.waypoint.RouterFactory;

/**
 * Is the default implementation of {@link RouterFactory}, creating a
 * {@link DefaultRouter}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultRouterFactory implements RouterFactory
{
    /**
     * Constructs this object.
     */
    public DefaultRouterFactory() {
        // Empty
    }
    
    @Override
    public <E, S> Router<E, S> create(Config config) {
        return new DefaultRouter<>(config);
    }
}
