package ca.bsd.logcheck.domain.detection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from every {@link RadarCategory} to its ordered members.
 * <p>All four categories are always present; a category without members maps to an empty list.</p>
 *
 * @since 0.1.0
 */
public final class RadarCategories {
  private final Map<RadarCategory, List<RadarDetection>> members;

  /**
   * Creates a mapping, filling absent categories with empty lists.
   *
   * @param members category members; lists are copied
   */
  public RadarCategories(Map<RadarCategory, List<RadarDetection>> members) {
    Objects.requireNonNull(members, "members");
    EnumMap<RadarCategory, List<RadarDetection>> copy = new EnumMap<>(RadarCategory.class);
    for (RadarCategory category : RadarCategory.values()) {
      copy.put(category, List.copyOf(members.getOrDefault(category, List.of())));
    }
    this.members = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the members of one category.
   *
   * @param category category to look up; must not be {@code null}
   * @return ordered, unmodifiable members
   */
  public List<RadarDetection> get(RadarCategory category) {
    return members.get(Objects.requireNonNull(category, "category"));
  }

  /**
   * Returns the number of members of one category.
   *
   * @param category category to count
   * @return member count
   */
  public int count(RadarCategory category) {
    return get(category).size();
  }

  /**
   * Returns the full mapping in category declaration order.
   *
   * @return unmodifiable view
   */
  public Map<RadarCategory, List<RadarDetection>> asMap() {
    return members;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof RadarCategories that && members.equals(that.members));
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RadarCategories{");
    for (RadarCategory category : RadarCategory.values()) {
      if (sb.length() > "RadarCategories{".length()) {
        sb.append(", ");
      }
      sb.append(category.name()).append('=').append(count(category));
    }
    return sb.append('}').toString();
  }
}
