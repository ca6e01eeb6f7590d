package alpha.waypoint.message;

import static alpha.waypoint.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.waypoint.HttpConstants.ReasonPhrase.FORBIDDEN;
import static alpha.waypoint.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.waypoint.HttpConstants.ReasonPhrase.NOT_FOUND;
import static alpha.waypoint.HttpConstants.ReasonPhrase.NO_CONTENT;
import static alpha.waypoint.HttpConstants.ReasonPhrase.OK;
import static alpha.waypoint.HttpConstants.ReasonPhrase.UNKNOWN;
import static alpha.waypoint.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.waypoint.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.waypoint.HttpConstants.StatusCode.FOUR_HUNDRED_THREE;
import static alpha.waypoint.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.waypoint.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link Response}s.<p>
 * 
 * The responses created by this class are immutable and may be cached and
 * shared freely. A response may be used as a template through
 * {@link Response#toBuilder()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Responses
{
    private static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
    
    private static final Response
            OK_EMPTY   = status(TWO_HUNDRED, OK),
            NO_CONT    = status(TWO_HUNDRED_FOUR, NO_CONTENT),
            FORBID     = status(FOUR_HUNDRED_THREE, FORBIDDEN),
            NOT_FND    = textWith(FOUR_HUNDRED_FOUR, NOT_FOUND),
            SERVER_ERR = textWith(FIVE_HUNDRED, INTERNAL_SERVER_ERROR);
    
    private Responses() {
        // Empty
    }
    
    /**
     * Returns a response with the given status code and no body.<p>
     * 
     * The reason phrase is derived from the status code, or "Unknown" if the
     * code is not known to this class.
     * 
     * @param code status code
     * 
     * @return a response
     */
    public static Response status(int code) {
        return Response.builder(code).build();
    }
    
    /**
     * Returns a response with the given status code, reason phrase and no
     * body.
     * 
     * @param code status code
     * @param phrase reason phrase
     * 
     * @return a response
     * 
     * @throws NullPointerException if {@code phrase} is {@code null}
     */
    public static Response status(int code, String phrase) {
        return Response.builder(code).reasonPhrase(phrase).build();
    }
    
    /**
     * Returns "200 OK" with no body.<p>
     * 
     * This is also the response a router returns when no entity of the
     * invocation chain produced a response.
     * 
     * @return "200 OK"
     */
    public static Response ok() {
        return OK_EMPTY;
    }
    
    /**
     * Returns "200 OK" with a text body.<p>
     * 
     * The body is encoded using UTF-8 and the Content-Type is set to
     * "text/plain; charset=utf-8".
     * 
     * @param body text
     * 
     * @return "200 OK"
     * 
     * @throws NullPointerException if {@code body} is {@code null}
     */
    public static Response text(String body) {
        requireNonNull(body);
        return OK_EMPTY.toBuilder()
                .header(CONTENT_TYPE, TEXT_PLAIN_UTF8)
                .body(body)
                .build();
    }
    
    /**
     * Returns "204 No Content".
     * 
     * @return "204 No Content"
     */
    public static Response noContent() {
        return NO_CONT;
    }
    
    /**
     * Returns "403 Forbidden".
     * 
     * @return "403 Forbidden"
     */
    public static Response forbidden() {
        return FORBID;
    }
    
    /**
     * Returns "404 Not Found" with the text body "Not Found".
     * 
     * @return "404 Not Found"
     */
    public static Response notFound() {
        return NOT_FND;
    }
    
    /**
     * Returns "500 Internal Server Error" with the text body "Internal Server
     * Error".<p>
     * 
     * The body is generic and carries no detail of what went wrong.
     * 
     * @return "500 Internal Server Error"
     */
    public static Response internalServerError() {
        return SERVER_ERR;
    }
    
    static String phraseOf(int code) {
        switch (code) {
            case TWO_HUNDRED:        return OK;
            case TWO_HUNDRED_FOUR:   return NO_CONTENT;
            case FOUR_HUNDRED_THREE: return FORBIDDEN;
            case FOUR_HUNDRED_FOUR:  return NOT_FOUND;
            case FIVE_HUNDRED:       return INTERNAL_SERVER_ERROR;
            default:                 return UNKNOWN;
        }
    }
    
    private static Response textWith(int code, String phrase) {
        return Response.builder(code)
                .reasonPhrase(phrase)
                .header(CONTENT_TYPE, TEXT_PLAIN_UTF8)
                .body(phrase)
                .build();
    }
}
