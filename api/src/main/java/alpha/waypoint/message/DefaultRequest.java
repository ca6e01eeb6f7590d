package alpha.waypoint.message;

import alpha.waypoint.util.AbstractImmutableBuilder;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Flow;
import java.util.function.Consumer;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@code Request}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultRequest implements Request
{
    private final String method;
    private final URI target;
    private final HttpHeaders headers;
    private final Flow.Publisher<ByteBuffer> body;
    private final DefaultBuilder origin;
    
    private DefaultRequest(
            String method, URI target, HttpHeaders headers,
            Flow.Publisher<ByteBuffer> body, DefaultBuilder origin)
    {
        this.method  = method;
        this.target  = target;
        this.headers = headers;
        this.body    = body;
        this.origin  = origin;
    }
    
    @Override
    public String method() {
        return method;
    }
    
    @Override
    public URI target() {
        return target;
    }
    
    @Override
    public HttpHeaders headers() {
        return headers;
    }
    
    @Override
    public Flow.Publisher<ByteBuffer> body() {
        return body;
    }
    
    @Override
    public Request withTarget(URI newTarget) {
        return origin.target(newTarget).build();
    }
    
    @Override
    public Request.Builder toBuilder() {
        return origin;
    }
    
    @Override
    public String toString() {
        return DefaultRequest.class.getSimpleName() + "{" +
                "method=\"" + method + '"' +
                ", target=\"" + target + '"' +
                ", headers=" + headers.map() +
                ", body=?}";
    }
    
    /**
     * Default implementation of {@code Request.Builder}.
     */
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Request.Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        private static class MutableState {
            String method;
            URI target;
            Map<String, List<String>> headers = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            Flow.Publisher<ByteBuffer> body = HttpRequest.BodyPublishers.noBody();
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Request.Builder method(String method) {
            requireNonNull(method);
            return new DefaultBuilder(this, s -> s.method = method);
        }
        
        @Override
        public DefaultBuilder target(URI target) {
            requireNonNull(target);
            return new DefaultBuilder(this, s -> s.target = target);
        }
        
        @Override
        public Request.Builder header(String name, String value) {
            requireNonNull(name);
            requireNonNull(value);
            return new DefaultBuilder(this, s ->
                    s.headers.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value));
        }
        
        @Override
        public Request.Builder body(Flow.Publisher<ByteBuffer> body) {
            requireNonNull(body);
            return new DefaultBuilder(this, s -> s.body = body);
        }
        
        @Override
        public Request build() {
            var s = constructState(MutableState::new);
            if (s.method == null || s.target == null) {
                throw new IllegalStateException("Method and target are required.");
            }
            return new DefaultRequest(
                    s.method,
                    s.target,
                    HttpHeaders.of(s.headers, (n, v) -> true),
                    s.body,
                    this);
        }
    }
}
