/**
 * Built-in valuers for statement reordering and the {@link com.tangle.reorder.valuer.ValuerRegistry}
 * that looks them up by name.
 */
package com.tangle.reorder.valuer;
