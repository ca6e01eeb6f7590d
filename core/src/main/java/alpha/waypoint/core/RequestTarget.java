package alpha.waypoint.core;

import java.net.URI;
import java.net.URLDecoder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;

/**
 * The path segments and the query of a request-target.<p>
 * 
 * The path is split into segments as specified by
 * {@link Segments#split(String)}. The segments are not percent-decoded.<p>
 * 
 * The query is parsed as "application/x-www-form-urlencoded"; pairs are
 * separated by '&amp;', a pair's key and value by the first '='. Keys and values
 * are decoded ('+' becomes a space). If a key is repeated, the last value
 * wins. If a key or value is malformed, it is kept as-is.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestTarget
{
    private static final System.Logger LOG
            = System.getLogger(RequestTarget.class.getPackageName());
    
    /**
     * Parse the given request-target.
     * 
     * @param target to parse
     * 
     * @return a complex type of the input
     * 
     * @throws NullPointerException if {@code target} is {@code null}
     */
    static RequestTarget parse(URI target) {
        String path = target.getRawPath(),
               query = target.getRawQuery();
        return new RequestTarget(
                path == null ? "" : path,
                query == null ? "" : query);
    }
    
    private final String path;
    private final String query;
    
    private RequestTarget(String path, String query) {
        this.path = path;
        this.query = query;
    }
    
    /**
     * Returns the raw path.
     * 
     * @return the raw path (never {@code null}, may be empty)
     */
    String path() {
        return path;
    }
    
    private List<String> segments;
    
    /**
     * Returns the path segments, not percent-decoded.
     * 
     * @return the path segments (unmodifiable)
     */
    List<String> segments() {
        var s = segments;
        return s != null ? s : (segments = Segments.split(path));
    }
    
    private Map<String, String> queryMap;
    
    /**
     * Returns the decoded query parameters.
     * 
     * @return the decoded query parameters (unmodifiable)
     */
    Map<String, String> queryMap() {
        var m = queryMap;
        return m != null ? m : (queryMap = parseQuery());
    }
    
    private Map<String, String> parseQuery() {
        if (query.isEmpty()) {
            return Map.of();
        }
        Map<String, String> m = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String k = eq == -1 ? pair : pair.substring(0, eq),
                   v = eq == -1 ? "" : pair.substring(eq + 1);
            // Last one wins
            m.put(decode(k), decode(v));
        }
        return unmodifiableMap(m);
    }
    
    private static String decode(String str) {
        try {
            return URLDecoder.decode(str, UTF_8);
        } catch (IllegalArgumentException e) {
            LOG.log(DEBUG, () -> "Malformed query component kept as-is: " + str);
            return str;
        }
    }
    
    @Override
    public String toString() {
        return RequestTarget.class.getSimpleName() + "{" +
                "path='" + path + '\'' +
                ", query='" + query + "'}";
    }
}
