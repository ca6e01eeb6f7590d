package alpha.waypoint.testutil;

import alpha.waypoint.message.Response;
import org.assertj.core.api.MapAssert;

import java.net.http.HttpHeaders;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assertion utils.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Assertions {
    private Assertions() {
        // Empty
    }
    
    /**
     * {@return a {@code MapAssert} of the given response's headers}<p>
     * 
     * This method is equivalent to:
     * <pre>
     *   {@link #assertHeaders(HttpHeaders) assertHeaders
     *   }(response.{@link Response#headers() headers}())
     * </pre>
     * 
     * @param response to get headers from
     */
    public static MapAssert<String, List<String>> assertHeaders(Response response) {
        return assertHeaders(response.headers());
    }
    
    /**
     * {@return a {@code MapAssert} of the given {@code headers}}<p>
     * 
     * The headers are copied into a {@code LinkedHashMap}, in the order
     * defined by {@code HttpHeaders}; i.e. header names are compared
     * case-sensitively by the returned API, as they were given to the builder.
     * 
     * @param headers to assert
     */
    public static MapAssert<String, List<String>> assertHeaders(HttpHeaders headers) {
        return assertThat(new LinkedHashMap<>(headers.map()));
    }
    
    /**
     * Asserts the status code and body of a response.
     * 
     * @param response to assert
     * @param statusCode expected
     * @param body expected (UTF-8 decoded)
     */
    public static void assertResponse(Response response, int statusCode, String body) {
        assertThat(response.statusCode()).isEqualTo(statusCode);
        assertThat(response.bodyAsString()).isEqualTo(body);
    }
}
