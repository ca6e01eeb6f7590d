package alpha.waypoint;

import alpha.waypoint.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

/**
 * Default implementation of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final boolean rejectSegmentsAfterWildcard,
                          rejectParameterRename,
                          rejectEmptyParameterName;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                     = b;
        rejectSegmentsAfterWildcard = s.rejectSegmentsAfterWildcard;
        rejectParameterRename       = s.rejectParameterRename;
        rejectEmptyParameterName    = s.rejectEmptyParameterName;
    }
    
    @Override
    public boolean rejectSegmentsAfterWildcard() {
        return rejectSegmentsAfterWildcard;
    }
    
    @Override
    public boolean rejectParameterRename() {
        return rejectParameterRename;
    }
    
    @Override
    public boolean rejectEmptyParameterName() {
        return rejectEmptyParameterName;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "rejectSegmentsAfterWildcard=" + rejectSegmentsAfterWildcard +
                ", rejectParameterRename=" + rejectParameterRename +
                ", rejectEmptyParameterName=" + rejectEmptyParameterName + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            boolean rejectSegmentsAfterWildcard = true,
                    rejectParameterRename       = false,
                    rejectEmptyParameterName    = false;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder rejectSegmentsAfterWildcard(boolean newVal) {
            return new DefaultBuilder(this, s -> s.rejectSegmentsAfterWildcard = newVal);
        }
        
        @Override
        public Builder rejectParameterRename(boolean newVal) {
            return new DefaultBuilder(this, s -> s.rejectParameterRename = newVal);
        }
        
        @Override
        public Builder rejectEmptyParameterName(boolean newVal) {
            return new DefaultBuilder(this, s -> s.rejectEmptyParameterName = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
