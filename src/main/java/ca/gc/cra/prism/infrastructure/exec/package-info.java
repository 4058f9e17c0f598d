/**
 * Executor factories producing named worker threads with uncaught-exception handlers.
 */
package ca.gc.cra.prism.infrastructure.exec;
