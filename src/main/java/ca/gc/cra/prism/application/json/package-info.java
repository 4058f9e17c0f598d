/**
 * JSON form of envelopes.
 * <p>{@link ca.gc.cra.prism.application.json.EnvelopeJsonCodec} writes with a streaming generator and
 * reads through {@link ca.gc.cra.prism.application.json.JsonTree}, which the Reasoner adapter also uses
 * for response bodies.</p>
 */
package ca.gc.cra.prism.application.json;
