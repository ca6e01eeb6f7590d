package alpha.waypoint;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class ConfigTest
{
    @Test
    void defaults() {
        var c = Config.DEFAULT;
        assertThat(c.rejectSegmentsAfterWildcard()).isTrue();
        assertThat(c.rejectParameterRename()).isFalse();
        assertThat(c.rejectEmptyParameterName()).isFalse();
    }
    
    @Test
    void builder_is_immutable() {
        var root = Config.configuration();
        var changed = root.rejectParameterRename(true);
        assertThat(root.build().rejectParameterRename()).isFalse();
        assertThat(changed.build().rejectParameterRename()).isTrue();
    }
    
    @Test
    void toBuilder_retains_values() {
        var c = Config.configuration()
                .rejectSegmentsAfterWildcard(false)
                .rejectEmptyParameterName(true)
                .build();
        var d = c.toBuilder().rejectParameterRename(true).build();
        assertThat(d.rejectSegmentsAfterWildcard()).isFalse();
        assertThat(d.rejectEmptyParameterName()).isTrue();
        assertThat(d.rejectParameterRename()).isTrue();
        // Original untouched
        assertThat(c.rejectParameterRename()).isFalse();
    }
    
    @Test
    void last_modification_wins() {
        var c = Config.configuration()
                .rejectSegmentsAfterWildcard(false)
                .rejectSegmentsAfterWildcard(true)
                .build();
        assertThat(c.rejectSegmentsAfterWildcard()).isTrue();
    }
}
