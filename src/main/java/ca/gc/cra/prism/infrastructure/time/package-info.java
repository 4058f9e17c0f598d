/**
 * Clock adapters: wall clock and the in-process cycling step clock.
 */
package ca.gc.cra.prism.infrastructure.time;
