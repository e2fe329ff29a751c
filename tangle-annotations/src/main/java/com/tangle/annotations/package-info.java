/**
 * Tangle annotations.
 * <ul>
 *   <li>{@link com.tangle.annotations.TangleValuer} – valuer (name, description); read at registration time by the valuer registry</li>
 * </ul>
 */
package com.tangle.annotations;
