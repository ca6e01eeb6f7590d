package alpha.waypoint;

/**
 * Factory of {@code Router}.<p>
 * 
 * Application code should have no use of this type. It is only public because
 * it is a requirement by Java's service-provider mechanism.
 */
@FunctionalInterface
public interface RouterFactory {
    /**
     * Creates a new {@code Router}.<p>
     * 
     * This method should only be used by the static method
     * {@link Router#create(Config) Router.create()}.
     * 
     * @param config of router
     * @param <E> type of environment
     * @param <S> type of store
     * 
     * @return a new {@code Router}
     * 
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    <E, S> Router<E, S> create(Config config);
}
