package org.hypertrace.core.metrics.query.api.predicate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Combinators and leaf tests for {@link Predicate}. */
public final class Predicates {

  private static final Predicate ALWAYS_TRUE = tagSet -> true;

  private Predicates() {}

  public static Predicate alwaysTrue() {
    return ALWAYS_TRUE;
  }

  /**
   * Conjunction of the given predicates. Null operands are skipped so optional constraints can be
   * passed straight through; with no remaining operands every tag set matches.
   */
  public static Predicate all(Predicate... predicates) {
    List<Predicate> operands = nonNull(predicates);
    if (operands.isEmpty()) {
      return ALWAYS_TRUE;
    }
    if (operands.size() == 1) {
      return operands.get(0);
    }
    return tagSet -> operands.stream().allMatch(predicate -> predicate.apply(tagSet));
  }

  /** Disjunction of the given predicates, null operands skipped. Matches nothing when empty. */
  public static Predicate any(Predicate... predicates) {
    List<Predicate> operands = nonNull(predicates);
    return tagSet -> operands.stream().anyMatch(predicate -> predicate.apply(tagSet));
  }

  public static Predicate not(Predicate predicate) {
    Objects.requireNonNull(predicate);
    return tagSet -> !predicate.apply(tagSet);
  }

  /** Matches tag sets whose value for {@code key} is one of {@code values}. */
  public static Predicate tagIn(String key, String... values) {
    Set<String> accepted = ImmutableSet.copyOf(values);
    return tagSet -> tagSet.get(key).map(accepted::contains).orElse(false);
  }

  /** Matches tag sets whose whole value for {@code key} matches the regular expression. */
  public static Predicate tagMatches(String key, String regex) {
    Pattern pattern = Pattern.compile(regex);
    return tagSet -> tagSet.get(key).map(value -> pattern.matcher(value).matches()).orElse(false);
  }

  private static List<Predicate> nonNull(Predicate... predicates) {
    return Arrays.stream(predicates)
        .filter(Objects::nonNull)
        .collect(Collectors.collectingAndThen(Collectors.toList(), ImmutableList::copyOf));
  }
}
