package alpha.waypoint.testutil;

import alpha.waypoint.message.Request;

import static alpha.waypoint.HttpConstants.Method.DELETE;
import static alpha.waypoint.HttpConstants.Method.GET;
import static alpha.waypoint.HttpConstants.Method.OPTIONS;
import static alpha.waypoint.HttpConstants.Method.POST;

/**
 * Factories of {@link Request}s.<p>
 * 
 * The request-target is resolved against "http://localhost".
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class TestRequests {
    private TestRequests() {
        // Empty
    }
    
    private static final String HOST = "http://localhost";
    
    /**
     * Creates a GET request.
     * 
     * @param pathAndQuery e.g. "/users/123?sort=asc"
     * 
     * @return a request
     */
    public static Request get(String pathAndQuery) {
        return request(GET, pathAndQuery);
    }
    
    /**
     * Creates a POST request.
     * 
     * @param pathAndQuery e.g. "/users"
     * 
     * @return a request
     */
    public static Request post(String pathAndQuery) {
        return request(POST, pathAndQuery);
    }
    
    /**
     * Creates a DELETE request.
     * 
     * @param pathAndQuery e.g. "/users/123"
     * 
     * @return a request
     */
    public static Request delete(String pathAndQuery) {
        return request(DELETE, pathAndQuery);
    }
    
    /**
     * Creates an OPTIONS request.
     * 
     * @param pathAndQuery e.g. "/users"
     * 
     * @return a request
     */
    public static Request options(String pathAndQuery) {
        return request(OPTIONS, pathAndQuery);
    }
    
    /**
     * Creates a request.
     * 
     * @param method of request
     * @param pathAndQuery e.g. "/users/123?sort=asc"
     * 
     * @return a request
     */
    public static Request request(String method, String pathAndQuery) {
        return builder(method, pathAndQuery).build();
    }
    
    /**
     * Creates a request builder.
     * 
     * @param method of request
     * @param pathAndQuery e.g. "/users/123?sort=asc"
     * 
     * @return a request builder
     */
    public static Request.Builder builder(String method, String pathAndQuery) {
        return Request.builder(method, HOST + pathAndQuery);
    }
}
