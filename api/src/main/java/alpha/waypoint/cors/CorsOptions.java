package alpha.waypoint.cors;

import alpha.waypoint.util.AbstractImmutableBuilder;

import java.util.List;
import java.util.function.Consumer;

import static alpha.waypoint.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.waypoint.HttpConstants.Method.DELETE;
import static alpha.waypoint.HttpConstants.Method.GET;
import static alpha.waypoint.HttpConstants.Method.HEAD;
import static alpha.waypoint.HttpConstants.Method.PATCH;
import static alpha.waypoint.HttpConstants.Method.POST;
import static alpha.waypoint.HttpConstants.Method.PUT;
import static alpha.waypoint.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;

/**
 * Options of the {@link Cors} middleware.<p>
 * 
 * The default options allow any origin, echo the request's origin in the
 * Access-Control-Allow-Origin header, allow methods GET, HEAD, PUT, PATCH,
 * POST and DELETE, allow the Content-Type header, expose no headers, do not
 * allow credentials, cache preflight results for 24 hours, and answer
 * preflight requests directly with "204 No Content".<p>
 * 
 * <pre>
 *   CorsOptions opts = CorsOptions.DEFAULT.toBuilder()
 *           .origins("https://example.com", "https://api.example.com")
 *           .methods("GET", "POST")
 *           .allowedHeaders("Content-Type", "Authorization")
 *           .credentials(true)
 *           .maxAge(3600)
 *           .build();
 * </pre>
 */
public final class CorsOptions
{
    /**
     * How origins are allowed.
     */
    public enum OriginPolicy {
        /**
         * Any origin is allowed, and Access-Control-Allow-Origin is set to
         * "*".
         */
        ANY,
        /**
         * No origin is allowed; the middleware is effectively disabled.
         */
        NONE,
        /**
         * Only the listed origins are allowed, and Access-Control-Allow-Origin
         * echoes the request's origin. The entry "*" allows any origin.
         */
        LISTED
    }
    
    /** The default options. */
    public static final CorsOptions DEFAULT = Builder.ROOT.build();
    
    private final Builder origin;
    private final OriginPolicy policy;
    private final List<String> origins,
                               methods,
                               allowedHeaders,
                               exposedHeaders;
    private final boolean credentials,
                          preflightContinue;
    private final long maxAge;
    private final int optionsSuccessStatus;
    
    private CorsOptions(Builder origin, Builder.MutableState s) {
        this.origin               = origin;
        this.policy               = s.policy;
        this.origins              = s.origins;
        this.methods              = s.methods;
        this.allowedHeaders       = s.allowedHeaders;
        this.exposedHeaders       = s.exposedHeaders;
        this.credentials          = s.credentials;
        this.preflightContinue    = s.preflightContinue;
        this.maxAge               = s.maxAge;
        this.optionsSuccessStatus = s.optionsSuccessStatus;
    }
    
    /**
     * Returns the origin policy.
     * 
     * @return the origin policy (never {@code null})
     */
    public OriginPolicy originPolicy() {
        return policy;
    }
    
    /**
     * Returns the allowed origins.<p>
     * 
     * Only applicable to policy {@link OriginPolicy#LISTED}.
     * 
     * @return the allowed origins (unmodifiable)
     */
    public List<String> origins() {
        return origins;
    }
    
    /**
     * Returns the methods of Access-Control-Allow-Methods.
     * 
     * @return allowed methods (unmodifiable)
     */
    public List<String> methods() {
        return methods;
    }
    
    /**
     * Returns the headers of Access-Control-Allow-Headers.
     * 
     * @return allowed headers (unmodifiable)
     */
    public List<String> allowedHeaders() {
        return allowedHeaders;
    }
    
    /**
     * Returns the headers of Access-Control-Expose-Headers.
     * 
     * @return exposed headers (unmodifiable)
     */
    public List<String> exposedHeaders() {
        return exposedHeaders;
    }
    
    /**
     * Returns whether Access-Control-Allow-Credentials is set.
     * 
     * @return see JavaDoc
     */
    public boolean credentials() {
        return credentials;
    }
    
    /**
     * Returns the value of Access-Control-Max-Age, in seconds.<p>
     * 
     * 0 means the header is not set.
     * 
     * @return see JavaDoc
     */
    public long maxAge() {
        return maxAge;
    }
    
    /**
     * Returns whether a preflight request proceeds the chain.<p>
     * 
     * If {@code false}, the middleware responds to the preflight request. If
     * {@code true}, the CORS headers are added to the response of the chain.
     * 
     * @return see JavaDoc
     */
    public boolean preflightContinue() {
        return preflightContinue;
    }
    
    /**
     * Returns the status code of a preflight response.
     * 
     * @return the status code of a preflight response
     */
    public int optionsSuccessStatus() {
        return optionsSuccessStatus;
    }
    
    /**
     * Returns {@code true} if the origin is allowed.
     * 
     * @param requestOrigin value of the request's Origin header
     * 
     * @return {@code true} if the origin is allowed
     */
    public boolean isAllowed(String requestOrigin) {
        switch (policy) {
            case ANY:  return true;
            case NONE: return false;
            default:
                return origins.contains("*") || origins.contains(requestOrigin);
        }
    }
    
    /**
     * Returns a builder which will build options equal to these.
     * 
     * @return a builder
     */
    public Builder toBuilder() {
        return origin;
    }
    
    @Override
    public String toString() {
        return CorsOptions.class.getSimpleName() + "{" +
                "policy=" + policy +
                ", origins=" + origins +
                ", methods=" + methods +
                ", allowedHeaders=" + allowedHeaders +
                ", exposedHeaders=" + exposedHeaders +
                ", credentials=" + credentials +
                ", maxAge=" + maxAge +
                ", preflightContinue=" + preflightContinue +
                ", optionsSuccessStatus=" + optionsSuccessStatus + '}';
    }
    
    /**
     * Builder of {@code CorsOptions}.<p>
     * 
     * The builder is immutable; every method returns a new builder instance.
     */
    public static final class Builder
            extends AbstractImmutableBuilder<Builder.MutableState>
    {
        static final Builder ROOT = new Builder();
        
        private static class MutableState {
            OriginPolicy policy = OriginPolicy.LISTED;
            List<String> origins = List.of("*"),
                         methods = List.of(GET, HEAD, PUT, PATCH, POST, DELETE),
                         allowedHeaders = List.of(CONTENT_TYPE),
                         exposedHeaders = List.of();
            boolean credentials = false,
                    preflightContinue = false;
            long maxAge = 86_400;
            int optionsSuccessStatus = TWO_HUNDRED_FOUR;
        }
        
        private Builder() {
            // super()
        }
        
        private Builder(Builder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        /**
         * Allows any origin, with Access-Control-Allow-Origin set to "*".
         * 
         * @return a new builder representing the new state
         */
        public Builder anyOrigin() {
            return new Builder(this, s -> {
                s.policy = OriginPolicy.ANY;
                s.origins = List.of();
            });
        }
        
        /**
         * Allows no origin.
         * 
         * @return a new builder representing the new state
         */
        public Builder noOrigin() {
            return new Builder(this, s -> {
                s.policy = OriginPolicy.NONE;
                s.origins = List.of();
            });
        }
        
        /**
         * Allows only the given origins.<p>
         * 
         * The entry "*" allows any origin.
         * 
         * @param origins allowed
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code origins} or an element thereof is {@code null}
         */
        public Builder origins(String... origins) {
            var copy = List.of(origins);
            return new Builder(this, s -> {
                s.policy = OriginPolicy.LISTED;
                s.origins = copy;
            });
        }
        
        /**
         * Sets the methods of Access-Control-Allow-Methods.
         * 
         * @param methods allowed
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code methods} or an element thereof is {@code null}
         */
        public Builder methods(String... methods) {
            var copy = List.of(methods);
            return new Builder(this, s -> s.methods = copy);
        }
        
        /**
         * Sets the headers of Access-Control-Allow-Headers.
         * 
         * @param headers allowed
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code headers} or an element thereof is {@code null}
         */
        public Builder allowedHeaders(String... headers) {
            var copy = List.of(headers);
            return new Builder(this, s -> s.allowedHeaders = copy);
        }
        
        /**
         * Sets the headers of Access-Control-Expose-Headers.
         * 
         * @param headers exposed
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code headers} or an element thereof is {@code null}
         */
        public Builder exposedHeaders(String... headers) {
            var copy = List.of(headers);
            return new Builder(this, s -> s.exposedHeaders = copy);
        }
        
        /**
         * Sets whether to allow credentials.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         */
        public Builder credentials(boolean newVal) {
            return new Builder(this, s -> s.credentials = newVal);
        }
        
        /**
         * Sets Access-Control-Max-Age, in seconds.<p>
         * 
         * 0 disables the header.
         * 
         * @param seconds new value
         * 
         * @return a new builder representing the new state
         * 
         * @throws IllegalArgumentException if {@code seconds} is negative
         */
        public Builder maxAge(long seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("Negative max age: " + seconds);
            }
            return new Builder(this, s -> s.maxAge = seconds);
        }
        
        /**
         * Sets whether a preflight request proceeds the chain.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         */
        public Builder preflightContinue(boolean newVal) {
            return new Builder(this, s -> s.preflightContinue = newVal);
        }
        
        /**
         * Sets the status code of a preflight response.
         * 
         * @param statusCode new value
         * 
         * @return a new builder representing the new state
         */
        public Builder optionsSuccessStatus(int statusCode) {
            return new Builder(this, s -> s.optionsSuccessStatus = statusCode);
        }
        
        /**
         * Builds the options.
         * 
         * @return options
         */
        public CorsOptions build() {
            return new CorsOptions(this, constructState(MutableState::new));
        }
    }
}
