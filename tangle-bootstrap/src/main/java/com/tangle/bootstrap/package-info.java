/**
 * Wires resolution, reordering and branching from {@link com.tangle.config.TangleConfig}.
 */
package com.tangle.bootstrap;
