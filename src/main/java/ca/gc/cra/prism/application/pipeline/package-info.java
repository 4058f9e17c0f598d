/**
 * The staged fan-out/fan-in pipeline.
 * <p>{@link ca.gc.cra.prism.application.pipeline.PipelineController} owns the queues, the dispatch loop
 * and three pools: one dispatcher ({@code prism-dispatch-*}), up to {@code maxInFlight} envelope
 * workers ({@code prism-envelope-*}) and a shared branch pool ({@code prism-branch-*}) sized for nine
 * concurrent calls per envelope.</p>
 * <p>Each envelope is routed by its entry clock step, fanned out to eight perspective calls, then to nine
 * temporal-scope calls, and folded once by the integration stage. Per-item failures are recorded on the
 * envelope; only lifecycle misuse and submission rejections are thrown.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.pipeline;
