/**
 * Types of the invocation chain; the middleware and handlers executed for a
 * matched route, and the context they are given.
 */
package alpha.waypoint.handler;
