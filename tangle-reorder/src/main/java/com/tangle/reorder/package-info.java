/**
 * Statement reordering: partitioning around control-flow breaks, lazy permutation search under a
 * {@link com.tangle.reorder.SearchLimits budget}, and scoring with pluggable
 * {@link com.tangle.reorder.Valuer valuers}.
 */
package com.tangle.reorder;
