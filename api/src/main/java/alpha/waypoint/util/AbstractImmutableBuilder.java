package alpha.waypoint.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Baseclass for immutable builders.<p>
 * 
 * Each builder instance is a link in a backwards-pointing chain and stores
 * nothing but one modification of the state. Setting a value never mutates
 * the builder; it returns a new link. When the product is built, the
 * modifications are replayed in the order they were made against a fresh
 * state container, see {@link #constructState(Supplier)}.<p>
 * 
 * One consequence is that any builder may be used as a template for many
 * products, and it is always safe to share a builder across threads.
 * 
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs the root of a builder chain.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a link in the builder chain.
     * 
     * @param prev previous builder
     * @param modifier to apply on the state
     * 
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a new state container and applies all modifiers of this chain,
     * oldest first.<p>
     * 
     * The concrete builder's {@code build} method is expected to call this
     * method and hand the state to the product's constructor.
     * 
     * @param factory of state
     * 
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
