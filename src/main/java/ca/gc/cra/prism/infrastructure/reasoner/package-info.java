/**
 * HTTP implementation of the Reasoner port (OpenAI-compatible chat completions).
 */
package ca.gc.cra.prism.infrastructure.reasoner;
