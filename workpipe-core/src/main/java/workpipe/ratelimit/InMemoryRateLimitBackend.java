package workpipe.ratelimit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link RateLimitBackend}. Per-domain updates are serialized by
 * {@link ConcurrentHashMap#compute}.
 */
public final class InMemoryRateLimitBackend implements RateLimitBackend {

  private record Forbidden(String url, long atMs) {
  }

  private final ConcurrentHashMap<String, DomainRateState> states = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Deque<Forbidden>> forbidden = new ConcurrentHashMap<>();

  @Override
  public DomainRateState getOrCreate(String domain, long baseDelayMs) {
    Objects.requireNonNull(domain, "domain");
    return states.computeIfAbsent(domain, d -> DomainRateState.initial(d, baseDelayMs));
  }

  @Override
  public DomainRateState update(String domain, long baseDelayMs, UnaryOperator<DomainRateState> mutation) {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(mutation, "mutation");
    return states.compute(domain, (d, current) -> {
      DomainRateState state = current != null ? current : DomainRateState.initial(d, baseDelayMs);
      return Objects.requireNonNull(mutation.apply(state), "mutation returned null");
    });
  }

  @Override
  public void record403(String domain, String url, long atMs) {
    Deque<Forbidden> deque = forbidden.computeIfAbsent(domain, d -> new ArrayDeque<>());
    synchronized (deque) {
      deque.addLast(new Forbidden(url, atMs));
    }
  }

  @Override
  public int count403(String domain, long sinceMs) {
    Deque<Forbidden> deque = forbidden.get(domain);
    if (deque == null) {
      return 0;
    }
    Set<String> urls = new HashSet<>();
    synchronized (deque) {
      for (Forbidden f : deque) {
        if (f.atMs() >= sinceMs) {
          urls.add(f.url());
        }
      }
    }
    return urls.size();
  }

  @Override
  public void clear403s(String domain) {
    forbidden.remove(domain);
  }

  @Override
  public int cleanupExpired403s(long beforeMs) {
    int removed = 0;
    for (Deque<Forbidden> deque : forbidden.values()) {
      synchronized (deque) {
        Iterator<Forbidden> it = deque.iterator();
        while (it.hasNext()) {
          if (it.next().atMs() < beforeMs) {
            it.remove();
            removed++;
          }
        }
      }
    }
    return removed;
  }

  @Override
  public List<DomainRateState> snapshot() {
    return new ArrayList<>(states.values());
  }
}
