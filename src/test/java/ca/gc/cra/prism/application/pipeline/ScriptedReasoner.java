package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.CancellationToken;
import ca.gc.cra.prism.application.port.GenerateOptions;
import ca.gc.cra.prism.application.port.ReasonerException;
import ca.gc.cra.prism.application.port.ReasonerPort;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reasoner double that echoes the prompt, records every call and fails calls matching a rule.
 * <p>With {@link #echoDescriptor()}, branch calls answer {@code descriptor + ":" + content} instead.</p>
 */
final class ScriptedReasoner implements ReasonerPort {
  private static final Pattern DESCRIPTOR = Pattern.compile("from the (\\S+) perspective");
  private static final Pattern CONTENT = Pattern.compile("^Content: (.*)$", Pattern.MULTILINE);

  private final List<Call> calls = new CopyOnWriteArrayList<>();
  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger maxActive = new AtomicInteger();
  private volatile Predicate<Call> failWhen = call -> false;
  private volatile CountDownLatch gate;
  private volatile boolean echoDescriptor;

  record Call(String prompt, GenerateOptions options, boolean cancelledAtEntry, CancellationToken token) {
    boolean isIntegration() {
      return options.maxOutputTokens() == PromptTemplates.INTEGRATION_MAX_TOKENS;
    }
  }

  ScriptedReasoner failWhen(Predicate<Call> rule) {
    this.failWhen = rule;
    return this;
  }

  ScriptedReasoner echoDescriptor() {
    this.echoDescriptor = true;
    return this;
  }

  /**
   * Blocks every call until {@link #release()}.
   */
  ScriptedReasoner hold() {
    this.gate = new CountDownLatch(1);
    return this;
  }

  void release() {
    CountDownLatch current = gate;
    if (current != null) {
      current.countDown();
    }
  }

  @Override
  public String generate(CancellationToken cancellation, String prompt, GenerateOptions options)
      throws ReasonerException {
    Call call = new Call(prompt, options, cancellation.isCancellationRequested(), cancellation);
    calls.add(call);
    int now = active.incrementAndGet();
    maxActive.accumulateAndGet(now, Math::max);
    try {
      CountDownLatch current = gate;
      if (current != null && !current.await(10, TimeUnit.SECONDS)) {
        throw new ReasonerException("gate not released");
      }
      if (failWhen.test(call)) {
        throw new ReasonerException("scripted failure");
      }
      return echoDescriptor && !call.isIntegration() ? descriptorEcho(call) : prompt;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ReasonerException("interrupted", ex);
    } finally {
      active.decrementAndGet();
    }
  }

  private static String descriptorEcho(Call call) {
    Matcher descriptor = DESCRIPTOR.matcher(call.options().systemPrompt());
    Matcher content = CONTENT.matcher(call.prompt());
    if (!descriptor.find() || !content.find()) {
      throw new IllegalStateException("cannot echo call: " + call.prompt());
    }
    return descriptor.group(1) + ":" + content.group(1);
  }

  List<Call> calls() {
    return List.copyOf(calls);
  }

  List<Call> integrationCalls() {
    return calls.stream().filter(Call::isIntegration).toList();
  }

  int maxConcurrentCalls() {
    return maxActive.get();
  }
}
