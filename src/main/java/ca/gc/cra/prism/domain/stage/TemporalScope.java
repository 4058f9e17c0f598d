package ca.gc.cra.prism.domain.stage;

/**
 * <strong>What:</strong> The nine static descriptors driving the Branch-B fan-out.
 * <p><strong>Why:</strong> Branch-B covers every combination of a three-valued temporal axis and a
 * three-valued scope axis; each combination is one branch task and one result slot.</p>
 * <p><strong>Role:</strong> Domain constant table laid out as a 3x3 grid (row = temporal, column = scope).</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum TemporalScope {
  PAST_UNIVERSAL(Temporal.PAST, Scope.UNIVERSAL, "Historical patterns and universal principles"),
  PAST_PARTICULAR(Temporal.PAST, Scope.PARTICULAR, "Specific memories and experiences"),
  PAST_RELATIONAL(Temporal.PAST, Scope.RELATIONAL, "Historical connections and relationships"),
  PRESENT_UNIVERSAL(Temporal.PRESENT, Scope.UNIVERSAL, "Current universal truths and laws"),
  PRESENT_PARTICULAR(Temporal.PRESENT, Scope.PARTICULAR, "Current specific situation and context"),
  PRESENT_RELATIONAL(Temporal.PRESENT, Scope.RELATIONAL, "Current relationships and dynamics"),
  FUTURE_UNIVERSAL(Temporal.FUTURE, Scope.UNIVERSAL, "Potential universal outcomes and trends"),
  FUTURE_PARTICULAR(Temporal.FUTURE, Scope.PARTICULAR, "Specific anticipated results"),
  FUTURE_RELATIONAL(Temporal.FUTURE, Scope.RELATIONAL, "Anticipated relationship changes");

  /** Fan-out width of Branch-B. */
  public static final int WIDTH = 9;

  private final Temporal temporal;
  private final Scope scope;
  private final String description;

  TemporalScope(Temporal temporal, Scope scope, String description) {
    this.temporal = temporal;
    this.scope = scope;
    this.description = description;
  }

  public int index() {
    return ordinal();
  }

  public Temporal temporal() {
    return temporal;
  }

  public Scope scope() {
    return scope;
  }

  public int row() {
    return temporal.ordinal();
  }

  public int column() {
    return scope.ordinal();
  }

  /**
   * Returns the descriptor name recorded on branch results, e.g. {@code Past-Universal}.
   *
   * @return descriptor name
   */
  public String displayName() {
    return temporal.label() + "-" + scope.label();
  }

  public String description() {
    return description;
  }

  /** Temporal axis of the grid. */
  public enum Temporal {
    PAST("Past", "What historical patterns or precedents are relevant?"),
    PRESENT("Present", "What is the current state and immediate context?"),
    FUTURE("Future", "What potential outcomes or trajectories exist?");

    private final String label;
    private final String guidance;

    Temporal(String label, String guidance) {
      this.label = label;
      this.guidance = guidance;
    }

    public String label() {
      return label;
    }

    public String guidance() {
      return guidance;
    }
  }

  /** Scope axis of the grid. */
  public enum Scope {
    UNIVERSAL("Universal", "What general principles or laws apply?"),
    PARTICULAR("Particular", "What specific details or instances are relevant?"),
    RELATIONAL("Relational", "What connections or relationships are important?");

    private final String label;
    private final String guidance;

    Scope(String label, String guidance) {
      this.label = label;
      this.guidance = guidance;
    }

    public String label() {
      return label;
    }

    public String guidance() {
      return guidance;
    }
  }
}
