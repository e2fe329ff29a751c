/**
 * Branch catalog: typed collections of facts (predicates, exception statements, initial
 * expressions, preserving/destroying/randomising statements) and the constructors that wrap a
 * region of statements in an {@code if}, {@code if/else}, {@code try/except} or {@code while}
 * whose outcome those facts fix.
 */
package com.tangle.branch;
