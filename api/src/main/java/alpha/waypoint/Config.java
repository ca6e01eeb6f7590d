package alpha.waypoint;

import alpha.waypoint.route.RouteCollisionException;
import alpha.waypoint.route.RoutePatternInvalidException;

/**
 * Router configuration.<p>
 * 
 * The configuration is consulted while routes are being registered. It decides
 * how strictly the router treats route patterns that are ambiguous or
 * malformed. Nothing in here affects how a request is served.<p>
 * 
 * {@link #toBuilder()} allows for any configuration object to be used as a
 * template for a new instance. The static method {@link #configuration()} is a
 * shortcut for {@code Config.DEFAULT.toBuilder()}:
 * 
 * <pre>
 *   Router&lt;Env, Store&gt; router = Router.create(configuration()
 *           .rejectParameterRename(true)
 *           .build());
 * </pre>
 * 
 * The implementation is immutable and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * The configuration used by {@link Router#create()}.<p>
     * 
     * This instance contains the following values:<p>
     * 
     * Reject segments after wildcard = true<br>
     * Reject parameter rename = false<br>
     * Reject empty parameter name = false
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns whether to reject a route pattern that declares segments after
     * the wildcard segment.<p>
     * 
     * The wildcard segment ({@code "*"}) consumes the remainder of the request
     * path, and so segments that follow can never be matched. For example,
     * "/files/&#42;/meta".<p>
     * 
     * If {@code true}, the registration throws a {@link
     * RoutePatternInvalidException}. If {@code false}, the trailing segments
     * are ignored and a warning is logged.<p>
     * 
     * The default is {@code true}.
     * 
     * @return whether to reject segments after the wildcard segment
     */
    boolean rejectSegmentsAfterWildcard();
    
    /**
     * Returns whether to reject a parameter segment that would rename an
     * already registered parameter.<p>
     * 
     * For example, first "/users/:id" is registered, then "/users/:name/posts".
     * Both patterns share the same parameter position in the tree, but only
     * one name can be used for the captured segment.<p>
     * 
     * If {@code true}, the second registration throws a {@link
     * RouteCollisionException}. If {@code false}, the most recent registration
     * wins; all routes below the parameter position will from now on capture
     * the segment using the new name. A warning is logged.<p>
     * 
     * The default is {@code false}.
     * 
     * @return whether to reject a parameter rename
     */
    boolean rejectParameterRename();
    
    /**
     * Returns whether to reject a parameter segment without a name, i.e. a
     * lone colon ({@code "/users/:"}).<p>
     * 
     * If {@code true}, the registration throws a {@link
     * RoutePatternInvalidException}. If {@code false}, the segment is captured
     * using the empty string as key, and a warning is logged.<p>
     * 
     * The default is {@code false}.
     * 
     * @return whether to reject an empty parameter name
     */
    boolean rejectEmptyParameterName();
    
    /**
     * Returns the builder instance that built this configuration.<p>
     * 
     * The builder may be used for further modifications of the configuration.
     * 
     * @return the builder instance that built this configuration
     */
    Config.Builder toBuilder();
    
    /**
     * Returns the builder used to build the default configuration.
     * 
     * @return the builder used to build the default configuration
     * 
     * @see #DEFAULT
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable; all setter methods return a new builder. The
     * initial builder is retrieved using {@link Config#toBuilder()}.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @see Config#rejectSegmentsAfterWildcard()
         */
        Builder rejectSegmentsAfterWildcard(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @see Config#rejectParameterRename()
         */
        Builder rejectParameterRename(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @see Config#rejectEmptyParameterName()
         */
        Builder rejectEmptyParameterName(boolean newVal);
        
        /**
         * Builds a configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
