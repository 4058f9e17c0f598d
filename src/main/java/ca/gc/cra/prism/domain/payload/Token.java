package ca.gc.cra.prism.domain.payload;

import java.util.Objects;

/**
 * Atomic content unit: a piece of text with a category and source label.
 * <p>Salience, relevance and confidence default to {@value #DEFAULT_SCORE}; valence to 0.</p>
 */
public final class Token extends Payload {
  public static final double DEFAULT_SCORE = 0.5d;

  private final String content;
  private final TokenKind tokenKind;
  private final String source;
  private final double salience;
  private final double relevance;
  private final double confidence;
  private final double valence;

  public Token(String id, long createdAtMillis, String content, TokenKind tokenKind, String source) {
    this(id, createdAtMillis, content, tokenKind, source, DEFAULT_SCORE, DEFAULT_SCORE, DEFAULT_SCORE, 0.0d);
  }

  public Token(
      String id,
      long createdAtMillis,
      String content,
      TokenKind tokenKind,
      String source,
      double salience,
      double relevance,
      double confidence,
      double valence) {
    super(id, createdAtMillis);
    this.content = Objects.requireNonNull(content, "content");
    this.tokenKind = Objects.requireNonNull(tokenKind, "tokenKind");
    this.source = source == null ? "" : source;
    this.salience = salience;
    this.relevance = relevance;
    this.confidence = confidence;
    this.valence = valence;
  }

  public String content() {
    return content;
  }

  public TokenKind tokenKind() {
    return tokenKind;
  }

  public String source() {
    return source;
  }

  public double salience() {
    return salience;
  }

  public double relevance() {
    return relevance;
  }

  public double confidence() {
    return confidence;
  }

  public double valence() {
    return valence;
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.TOKEN;
  }

  @Override
  public String summary() {
    return content;
  }

  @Override
  public String toString() {
    return "Token{" + id() + ", " + tokenKind.label() + "}";
  }
}
