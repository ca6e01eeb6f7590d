/**
 * Home of the library-provided router implementation.<p>
 * 
 * The only public types in this package are {@link
 * alpha.waypoint.core.DefaultRouter} and {@link
 * alpha.waypoint.core.DefaultRouterFactory}, which is used by the {@link
 * alpha.waypoint.Router} interface to create the default implementation. All
 * other types in this package can therefore be regarded as an implementation
 * detail.<p>
 * 
 * Implementations of public interfaces provided by this package use the
 * "Default" name-prefix. For example, {@code DefaultContext} implements
 * {@code Context}.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.waypoint.core;
