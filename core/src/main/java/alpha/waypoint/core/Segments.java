package alpha.waypoint.core;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;

/**
 * Util class for segments.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Segments
{
    static final char COLON_CH = ':',    // marker of path param
                      ASTERISK_CH = '*'; // the wildcard
    
    static final String ASTERISK_STR = "*",
                        SLASH_STR = "/";
    
    private Segments() {
        // Empty
    }
    
    /**
     * Splits the given path into segments.<p>
     * 
     * Empty segments are dropped. E.g.
     * <pre>
     *   "/a/b"   =&gt; ["a", "b"]
     *   "a/b/"   =&gt; ["a", "b"]
     *   "//a//b" =&gt; ["a", "b"]
     *   "/"      =&gt; []
     *   ""       =&gt; []
     * </pre>
     * 
     * No decoding or other normalization takes place.
     * 
     * @param path to split
     * 
     * @return an unmodifiable list of segments (never {@code null})
     * 
     * @throws NullPointerException if {@code path} is {@code null}
     */
    static List<String> split(String path) {
        List<String> keep = new ArrayList<>();
        int from = 0;
        for (;;) {
            int to = path.indexOf('/', from);
            String t = to == -1 ? path.substring(from) : path.substring(from, to);
            if (!t.isEmpty()) {
                keep.add(t);
            }
            if (to == -1) {
                return unmodifiableList(keep);
            }
            from = to + 1;
        }
    }
    
    /**
     * Joins the segments from the given index with "/".<p>
     * 
     * If {@code from} is equal to the size of the list, the empty string is
     * returned.
     * 
     * @param segments to join
     * @param from index (inclusive)
     * 
     * @return joined segments
     */
    static String join(List<String> segments, int from) {
        return String.join(SLASH_STR, segments.subList(from, segments.size()));
    }
    
    /**
     * Returns {@code true} if the segment is a path parameter.
     * 
     * @param segment to test
     * 
     * @return {@code true} if the segment is a path parameter
     */
    static boolean isParam(String segment) {
        return segment.charAt(0) == COLON_CH;
    }
    
    /**
     * Returns {@code true} if the segment is the wildcard.
     * 
     * @param segment to test
     * 
     * @return {@code true} if the segment is the wildcard
     */
    static boolean isWildcard(String segment) {
        return segment.equals(ASTERISK_STR);
    }
}
