package alpha.waypoint.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link RequestTarget}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class RequestTargetTest
{
    @Test
    void segments_not_decoded() {
        var rt = parse("http://localhost/a%20b//c/?x=1");
        assertThat(rt.path()).isEqualTo("/a%20b//c/");
        assertThat(rt.segments()).isEqualTo(List.of("a%20b", "c"));
    }
    
    @Test
    void no_path() {
        var rt = parse("http://localhost");
        assertThat(rt.path()).isEmpty();
        assertThat(rt.segments()).isEmpty();
        assertThat(rt.queryMap()).isEmpty();
    }
    
    @Test
    void origin_form() {
        assertThat(parse("/a/b?c=d").segments()).containsExactly("a", "b");
    }
    
    @Test
    void query_decoded() {
        var rt = parse("/?name=John+Doe&city=S%C3%A3o%20Paulo&flag&=v");
        assertThat(rt.queryMap()).isEqualTo(Map.of(
                "name", "John Doe",
                "city", "São Paulo",
                "flag", "",
                "", "v"));
    }
    
    @Test
    void query_last_value_wins() {
        assertThat(parse("/?a=1&b=2&a=3").queryMap())
                .isEqualTo(Map.of("a", "3", "b", "2"));
    }
    
    @Test
    void query_value_split_at_first_equals() {
        assertThat(parse("/?expr=a=b").queryMap())
                .isEqualTo(Map.of("expr", "a=b"));
    }
    
    @Test
    void query_plus_and_percent_encoded_plus() {
        assertThat(parse("/?a=1+1&b=1%2B1").queryMap())
                .isEqualTo(Map.of("a", "1 1", "b", "1+1"));
    }
    
    @Test
    void query_empty_pairs_skipped() {
        assertThat(parse("/?&&a=1&").queryMap())
                .isEqualTo(Map.of("a", "1"));
    }
    
    private static RequestTarget parse(String uri) {
        return RequestTarget.parse(URI.create(uri));
    }
}
