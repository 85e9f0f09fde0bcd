package cafe.woden.chatwindow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jmolecules.ddd.annotation.ValueObject;

/** Aggregated reactions attached to one message, keyed by reaction name (usually an emoji). */
@ValueObject
public record ReactionSummary(Map<String, ReactionCount> byName) {

  public static final ReactionSummary EMPTY = new ReactionSummary(Map.of());

  /** Count for a single reaction name. */
  @ValueObject
  public record ReactionCount(int total, Set<String> clientIds) {
    public ReactionCount {
      if (total < 0) total = 0;
      clientIds =
          (clientIds == null || clientIds.isEmpty())
              ? Set.of()
              : Collections.unmodifiableSet(new LinkedHashSet<>(clientIds));
    }
  }

  public ReactionSummary {
    byName = normalize(byName);
  }

  public boolean isEmpty() {
    return byName.isEmpty();
  }

  public int total(String name) {
    ReactionCount c = byName.get(Objects.toString(name, ""));
    return c == null ? 0 : c.total();
  }

  private static Map<String, ReactionCount> normalize(Map<String, ReactionCount> raw) {
    if (raw == null || raw.isEmpty()) return Map.of();
    LinkedHashMap<String, ReactionCount> out = new LinkedHashMap<>();
    for (Map.Entry<String, ReactionCount> e : raw.entrySet()) {
      String name = Objects.toString(e.getKey(), "").trim();
      if (name.isEmpty() || e.getValue() == null) continue;
      out.put(name, e.getValue());
    }
    if (out.isEmpty()) return Map.of();
    return Collections.unmodifiableMap(out);
  }
}
