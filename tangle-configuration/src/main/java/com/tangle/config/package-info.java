/**
 * Environment-driven settings for resolution, reordering and branching.
 */
package com.tangle.config;
