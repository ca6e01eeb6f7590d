package alpha.waypoint.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Small tests for {@link Tree}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class TreeTest
{
    private final Tree<String> testee = new Tree<>();
    
    @Test
    void root_value() {
        assertThat(testee.root().set("v")).isNull();
        assertThat(testee.root().get()).isEqualTo("v");
        assertThat(testee.root().set("w")).isEqualTo("v");
        assertThat(testee.toMap("/")).containsExactly(entry("/", "w"));
    }
    
    @Test
    void all_three_child_types_coexist() {
        var r = testee.root();
        r.literalOrCreate("users").literalOrCreate("admin").set("literal");
        r.literalOrCreate("users").paramOrCreate("id").set("param");
        r.literalOrCreate("users").wildcardOrCreate().set("wildcard");
        
        assertThat(testee.toMap("/")).containsOnly(
                entry("/users/admin", "literal"),
                entry("/users/:id",   "param"),
                entry("/users/*",     "wildcard"));
    }
    
    @Test
    void literal_reused() {
        var a = testee.root().literalOrCreate("a");
        assertThat(testee.root().literalOrCreate("a")).isSameAs(a);
        assertThat(testee.root().literal("a")).isSameAs(a);
        assertThat(testee.root().literal("b")).isNull();
    }
    
    @Test
    void param_reused_and_renamed() {
        var p = testee.root().paramOrCreate("id");
        assertThat(testee.root().paramName()).isEqualTo("id");
        assertThat(testee.root().paramOrCreate("name")).isSameAs(p);
        assertThat(testee.root().paramName()).isEqualTo("name");
    }
    
    @Test
    void nodes_without_value_not_dumped() {
        testee.root().literalOrCreate("a").literalOrCreate("b").set("v");
        assertThat(testee.toMap("/")).containsExactly(entry("/a/b", "v"));
        assertThat(testee.root().wildcard()).isNull();
        assertThat(testee.root().param()).isNull();
    }
}
