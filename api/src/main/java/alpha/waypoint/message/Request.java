package alpha.waypoint.message;

import alpha.waypoint.Router;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.util.concurrent.Flow;

/**
 * An inbound request, as handed to {@link Router#handle(Request, Object,
 * Object) Router.handle()} by the transport layer.<p>
 * 
 * The router reads the method and the request-target. Headers and body are
 * carried along untouched for the middleware and the request handler. The
 * router never subscribes to the body.<p>
 * 
 * The implementation is immutable, but the body publisher is not necessarily
 * so. A typical body can be consumed only once, and it is up to the
 * application to coordinate who does it.
 * 
 * <pre>
 *   Request req = Request.builder("GET", "http://localhost/users/123")
 *                        .header("Accept", "text/plain")
 *                        .build();
 * </pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Request
{
    /**
     * Returns a builder of a request.
     * 
     * @param method request method, e.g. "GET"
     * @param target request-target
     * 
     * @return a builder
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static Builder builder(String method, URI target) {
        return DefaultRequest.DefaultBuilder.ROOT.method(method).target(target);
    }
    
    /**
     * Returns a builder of a request.
     * 
     * @param method request method, e.g. "GET"
     * @param target request-target, as parsed by {@link URI#create(String)}
     * 
     * @return a builder
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code target} is not a valid URI
     */
    static Builder builder(String method, String target) {
        return builder(method, URI.create(target));
    }
    
    /**
     * Returns the request method.<p>
     * 
     * The value is case-sensitive and is used as-is by the router to select
     * a route tree.
     * 
     * @return the request method (never {@code null})
     */
    String method();
    
    /**
     * Returns the request-target.<p>
     * 
     * The target may be absolute ("http://host/path?query") or only contain
     * the path and query ("/path?query"). The router reads the raw
     * (not percent-decoded) path and query.
     * 
     * @return the request-target (never {@code null})
     */
    URI target();
    
    /**
     * Returns the request headers.
     * 
     * @return the request headers (never {@code null})
     */
    HttpHeaders headers();
    
    /**
     * Returns the request body.<p>
     * 
     * If no body was set, the publisher is empty.
     * 
     * @return the request body (never {@code null})
     */
    Flow.Publisher<ByteBuffer> body();
    
    /**
     * Returns a request equal to this one, except for the given target.<p>
     * 
     * The returned request has the same method, equal headers and the very
     * same body publisher instance as this request. The body is forwarded, not
     * copied.
     * 
     * @param newTarget of the new request
     * 
     * @return a new request
     * 
     * @throws NullPointerException if {@code newTarget} is {@code null}
     */
    Request withTarget(URI newTarget);
    
    /**
     * Returns a builder which will build a request equal to this one.
     * 
     * @return a builder
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link Request}.<p>
     * 
     * The builder is immutable; every method returns a new builder instance.
     */
    interface Builder {
        /**
         * Sets the request method.
         * 
         * @param method value
         * 
         * @return a new builder
         * 
         * @throws NullPointerException if {@code method} is {@code null}
         */
        Builder method(String method);
        
        /**
         * Sets the request-target.
         * 
         * @param target value
         * 
         * @return a new builder
         * 
         * @throws NullPointerException if {@code target} is {@code null}
         */
        Builder target(URI target);
        
        /**
         * Adds a header value.
         * 
         * @param name header name
         * @param value header value
         * 
         * @return a new builder
         * 
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder header(String name, String value);
        
        /**
         * Sets the body.<p>
         * 
         * {@link HttpRequest.BodyPublishers} has many factories for publishers
         * that can be used as a body.
         * 
         * @param body the body
         * 
         * @return a new builder
         * 
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(Flow.Publisher<ByteBuffer> body);
        
        /**
         * Builds the request.
         * 
         * @return a request
         */
        Request build();
    }
}
