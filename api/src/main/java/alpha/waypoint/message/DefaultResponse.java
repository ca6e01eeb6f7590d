package alpha.waypoint.message;

import alpha.waypoint.util.AbstractImmutableBuilder;

import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@code Response}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultResponse implements Response
{
    private static final byte[] EMPTY = new byte[0];
    
    private final int statusCode;
    private final String reasonPhrase;
    private final HttpHeaders headers;
    // Never leaked
    private final byte[] body;
    private final DefaultBuilder origin;
    
    private DefaultResponse(
            int statusCode,
            String reasonPhrase,
            HttpHeaders headers,
            byte[] body,
            DefaultBuilder origin)
    {
        this.statusCode   = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.headers      = headers;
        this.body         = body;
        this.origin       = origin;
    }
    
    @Override
    public int statusCode() {
        return statusCode;
    }
    
    @Override
    public String reasonPhrase() {
        return reasonPhrase;
    }
    
    @Override
    public HttpHeaders headers() {
        return headers;
    }
    
    @Override
    public ByteBuffer body() {
        return ByteBuffer.wrap(body).asReadOnlyBuffer();
    }
    
    @Override
    public String bodyAsString() {
        return new String(body, UTF_8);
    }
    
    @Override
    public Response.Builder toBuilder() {
        return origin;
    }
    
    @Override
    public String toString() {
        return DefaultResponse.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", reasonPhrase='" + reasonPhrase + '\'' +
                ", headers=" + headers.map() +
                ", body=" + body.length + " byte(s)}";
    }
    
    /**
     * Default implementation of {@code Response.Builder}.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Response.Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        private static class MutableState {
            Integer statusCode;
            String reasonPhrase;
            Map<String, List<String>> headers = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            byte[] body = EMPTY;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Response.Builder statusCode(int statusCode) {
            return new DefaultBuilder(this, s -> s.statusCode = statusCode);
        }
        
        @Override
        public Response.Builder reasonPhrase(String reasonPhrase) {
            requireNonNull(reasonPhrase);
            return new DefaultBuilder(this, s -> s.reasonPhrase = reasonPhrase);
        }
        
        @Override
        public Response.Builder header(String name, String value) {
            requireNonNull(name);
            requireNonNull(value);
            return new DefaultBuilder(this, s -> {
                var vals = new ArrayList<String>(1);
                vals.add(value);
                s.headers.put(name, vals);
            });
        }
        
        @Override
        public Response.Builder addHeader(String name, String value) {
            requireNonNull(name);
            requireNonNull(value);
            return new DefaultBuilder(this, s ->
                    s.headers.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value));
        }
        
        @Override
        public Response.Builder removeHeader(String name) {
            requireNonNull(name);
            return new DefaultBuilder(this, s -> s.headers.remove(name));
        }
        
        @Override
        public Response.Builder body(String body) {
            return body(body.getBytes(UTF_8));
        }
        
        @Override
        public Response.Builder body(byte[] body) {
            final byte[] copy = body.clone();
            return new DefaultBuilder(this, s -> s.body = copy);
        }
        
        @Override
        public Response build() {
            var s = constructState(MutableState::new);
            if (s.statusCode == null) {
                throw new IllegalStateException("Status code not set.");
            }
            String phrase = s.reasonPhrase != null ?
                    s.reasonPhrase : Responses.phraseOf(s.statusCode);
            return new DefaultResponse(
                    s.statusCode,
                    phrase,
                    HttpHeaders.of(s.headers, (n, v) -> true),
                    s.body,
                    this);
        }
    }
}
