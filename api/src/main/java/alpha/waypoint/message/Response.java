package alpha.waypoint.message;

import alpha.waypoint.HttpConstants.StatusCode;

import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;

/**
 * A status line, followed by optional headers and body.<p>
 * 
 * Can be built using a {@link Response.Builder}:
 * 
 * <pre>
 *   Response r = Response.builder(200)
 *                        .header("Content-Type", "text/plain; charset=utf-8")
 *                        .body("Hello")
 *                        .build();
 * </pre>
 * 
 * {@link Responses} has factories for commonly used responses. Any response
 * may be used as a template for a new response:
 * 
 * <pre>
 *   Response r = Responses.noContent().toBuilder()
 *                         .header("Access-Control-Max-Age", "86400")
 *                         .build();
 * </pre>
 * 
 * The implementation is immutable and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Responses
 */
public interface Response
{
    /**
     * Returns a builder with the given status code set.
     * 
     * @param statusCode response status code
     * 
     * @return a builder
     */
    static Builder builder(int statusCode) {
        return DefaultResponse.DefaultBuilder.ROOT.statusCode(statusCode);
    }
    
    /**
     * Returns the status code.
     * 
     * @return the status code
     */
    int statusCode();
    
    /**
     * Returns the reason phrase.
     * 
     * @return the reason phrase (never {@code null})
     */
    String reasonPhrase();
    
    /**
     * Returns the response headers.
     * 
     * @return the response headers (never {@code null})
     */
    HttpHeaders headers();
    
    /**
     * Returns a read-only view of the body.<p>
     * 
     * Each call returns a new view, positioned at the first byte.
     * 
     * @return the body (never {@code null})
     */
    ByteBuffer body();
    
    /**
     * Returns the body decoded as UTF-8.
     * 
     * @return the body decoded as UTF-8 (never {@code null})
     */
    String bodyAsString();
    
    /**
     * Returns {@code true} if the status-code is 2XX (Successful).
     * 
     * @return {@code true} if the status-code is 2XX (Successful)
     */
    default boolean isSuccessful() {
        return statusCode() >= StatusCode.TWO_HUNDRED && statusCode() < 300;
    }
    
    /**
     * Returns a builder which will build a response equal to this one.
     * 
     * @return a builder
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link Response}.<p>
     * 
     * The builder is immutable; every method returns a new builder instance.
     * The builder may be used as a template to derive new responses.<p>
     * 
     * Header names are case-insensitive. The header methods that set or remove
     * a header therefore target all previously added values of that name,
     * regardless of case.
     */
    interface Builder
    {
        /**
         * Sets a status code.<p>
         * 
         * If the reason phrase has not been set, it is derived from the status
         * code when the response is built.
         * 
         * @param statusCode value (any integer value)
         * 
         * @return a new builder representing the new state
         */
        Builder statusCode(int statusCode);
        
        /**
         * Sets a reason phrase.
         * 
         * @param reasonPhrase value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code reasonPhrase} is {@code null}
         */
        Builder reasonPhrase(String reasonPhrase);
        
        /**
         * Sets a header, replacing any previously set values.
         * 
         * @param name header name
         * @param value header value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder header(String name, String value);
        
        /**
         * Adds a header value.
         * 
         * @param name header name
         * @param value header value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder addHeader(String name, String value);
        
        /**
         * Removes all values of a header.
         * 
         * @param name header name
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code name} is {@code null}
         */
        Builder removeHeader(String name);
        
        /**
         * Sets the body, encoded using UTF-8.
         * 
         * @param body the body
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(String body);
        
        /**
         * Sets the body.<p>
         * 
         * The array is copied.
         * 
         * @param body the body
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(byte[] body);
        
        /**
         * Builds the response.
         * 
         * @return a response
         * 
         * @throws IllegalStateException
         *             if the status code has not been set
         */
        Response build();
    }
}
