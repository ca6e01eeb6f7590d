package alpha.waypoint.message;

import org.junit.jupiter.api.Test;

import java.nio.ReadOnlyBufferException;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Response.Builder} and {@link Responses}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class ResponseBuilderTest
{
    @Test
    void happy_path() {
        var r = Response.builder(201)
                .reasonPhrase("Created")
                .header("Location", "/users/1")
                .body("done")
                .build();
        assertThat(r.statusCode()).isEqualTo(201);
        assertThat(r.reasonPhrase()).isEqualTo("Created");
        assertThat(r.headers().firstValue("location")).hasValue("/users/1");
        assertThat(r.bodyAsString()).isEqualTo("done");
    }
    
    @Test
    void status_code_required() {
        assertThatThrownBy(DefaultResponse.DefaultBuilder.ROOT::build)
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Status code not set.");
    }
    
    @Test
    void reason_phrase_derived() {
        assertThat(Responses.status(404).reasonPhrase()).isEqualTo("Not Found");
        assertThat(Responses.status(299).reasonPhrase()).isEqualTo("Unknown");
    }
    
    @Test
    void header_replaces_case_insensitive() {
        var r = Response.builder(200)
                .addHeader("X-Thing", "1")
                .addHeader("x-thing", "2")
                .build();
        assertThat(r.headers().allValues("X-THING")).containsExactly("1", "2");
        
        var r2 = r.toBuilder().header("X-Thing", "3").build();
        assertThat(r2.headers().allValues("x-thing")).containsExactly("3");
        
        var r3 = r2.toBuilder().removeHeader("X-THING").build();
        assertThat(r3.headers().map()).isEmpty();
    }
    
    @Test
    void builder_is_immutable() {
        var template = Response.builder(200).header("A", "1");
        var one = template.header("B", "2").build();
        var two = template.build();
        assertThat(one.headers().map()).containsOnlyKeys("A", "B");
        assertThat(two.headers().map()).containsOnlyKeys("A");
    }
    
    @Test
    void body_is_copied_and_read_only() {
        byte[] bytes = "abc".getBytes(UTF_8);
        var r = Response.builder(200).body(bytes).build();
        bytes[0] = 'X';
        assertThat(r.bodyAsString()).isEqualTo("abc");
        assertThatThrownBy(() -> r.body().put((byte) 1))
                .isExactlyInstanceOf(ReadOnlyBufferException.class);
        // Each view starts at first byte
        r.body().get();
        assertThat(r.body().remaining()).isEqualTo(3);
    }
    
    @Test
    void ok_has_empty_body() {
        var r = Responses.ok();
        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.reasonPhrase()).isEqualTo("OK");
        assertThat(r.body().hasRemaining()).isFalse();
        assertThat(r.isSuccessful()).isTrue();
    }
    
    @Test
    void text() {
        var r = Responses.text("Hello");
        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.bodyAsString()).isEqualTo("Hello");
        assertThat(r.headers().map())
                .containsEntry("Content-Type", List.of("text/plain; charset=utf-8"));
    }
    
    @Test
    void not_found_and_server_error_bodies() {
        assertThat(Responses.notFound().statusCode()).isEqualTo(404);
        assertThat(Responses.notFound().bodyAsString()).isEqualTo("Not Found");
        assertThat(Responses.internalServerError().statusCode()).isEqualTo(500);
        assertThat(Responses.internalServerError().bodyAsString())
                .isEqualTo("Internal Server Error");
        assertThat(Responses.internalServerError().isSuccessful()).isFalse();
    }
}
