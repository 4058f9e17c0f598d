/**
 * Application layer of the pipeline.
 * <p><strong>Role:</strong> Hosts the controller, the branch and integration stages, and the ports they
 * depend on.</p>
 * <p><strong>Concurrency:</strong> The controller manages its worker pools explicitly; ports document what
 * callers may assume.</p>
 * <p><strong>Metrics:</strong> Emits the {@code pipeline.*} namespace.</p>
 */
package ca.gc.cra.prism.application;
