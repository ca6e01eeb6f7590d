package alpha.waypoint;

import alpha.waypoint.message.Responses;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 * 
 * Only the constants the router and its companion middleware have a use for
 * are declared. The router itself is transport agnostic and never validates
 * a method token or a status code against these constants.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * HTTP methods.<p>
     * 
     * The method is a case-sensitive string and can be anything. The router
     * stores one route tree per method token, plus one tree for the
     * catch-all token {@link #ANY}.
     */
    public static final class Method {
        private Method() {
            // Empty
        }
        
        /** {@code GET} */
        public static final String GET = "GET";
        /** {@code HEAD} */
        public static final String HEAD = "HEAD";
        /** {@code POST} */
        public static final String POST = "POST";
        /** {@code PUT} */
        public static final String PUT = "PUT";
        /** {@code PATCH} */
        public static final String PATCH = "PATCH";
        /** {@code DELETE} */
        public static final String DELETE = "DELETE";
        /** {@code OPTIONS} */
        public static final String OPTIONS = "OPTIONS";
        
        /**
         * Pseudo-method of the catch-all route tree.<p>
         * 
         * This is not a real HTTP method. Routes registered using this token
         * are consulted only after the lookup in the tree of the request's
         * method failed. Mounted routers are registered in this tree.
         */
        public static final String ANY = "*";
    }
    
    /**
     * Status codes used by the router.
     * 
     * @see Responses
     */
    public static final class StatusCode {
        private StatusCode() {
            // Empty
        }
        
        /** {@code 200 (OK)} */
        public static final int TWO_HUNDRED = 200;
        /** {@code 204 (No Content)} */
        public static final int TWO_HUNDRED_FOUR = 204;
        /** {@code 403 (Forbidden)} */
        public static final int FOUR_HUNDRED_THREE = 403;
        /** {@code 404 (Not Found)} */
        public static final int FOUR_HUNDRED_FOUR = 404;
        /** {@code 500 (Internal Server Error)} */
        public static final int FIVE_HUNDRED = 500;
    }
    
    /**
     * Reason phrases, one for each {@link StatusCode}.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Empty
        }
        
        /** Used when the status code is not known. */
        public static final String UNKNOWN = "Unknown";
        /** {@code 200 (OK)} */
        public static final String OK = "OK";
        /** {@code 204 (No Content)} */
        public static final String NO_CONTENT = "No Content";
        /** {@code 403 (Forbidden)} */
        public static final String FORBIDDEN = "Forbidden";
        /** {@code 404 (Not Found)} */
        public static final String NOT_FOUND = "Not Found";
        /** {@code 500 (Internal Server Error)} */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
    }
    
    /**
     * Header names.<p>
     * 
     * Header names are case-insensitive.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Empty
        }
        
        /** {@code Content-Type} */
        public static final String CONTENT_TYPE = "Content-Type";
        /** {@code Origin} */
        public static final String ORIGIN = "Origin";
        /** {@code Access-Control-Allow-Origin} */
        public static final String ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
        /** {@code Access-Control-Allow-Credentials} */
        public static final String ACCESS_CONTROL_ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";
        /** {@code Access-Control-Allow-Methods} */
        public static final String ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";
        /** {@code Access-Control-Allow-Headers} */
        public static final String ACCESS_CONTROL_ALLOW_HEADERS = "Access-Control-Allow-Headers";
        /** {@code Access-Control-Expose-Headers} */
        public static final String ACCESS_CONTROL_EXPOSE_HEADERS = "Access-Control-Expose-Headers";
        /** {@code Access-Control-Max-Age} */
        public static final String ACCESS_CONTROL_MAX_AGE = "Access-Control-Max-Age";
        /** {@code Access-Control-Request-Method} */
        public static final String ACCESS_CONTROL_REQUEST_METHOD = "Access-Control-Request-Method";
        /** {@code Access-Control-Request-Headers} */
        public static final String ACCESS_CONTROL_REQUEST_HEADERS = "Access-Control-Request-Headers";
    }
}
