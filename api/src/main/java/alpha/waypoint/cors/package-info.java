/**
 * A Cross-Origin Resource Sharing middleware.
 */
package alpha.waypoint.cors;
