package org.hypertrace.core.metrics.query.api.predicate;

import org.hypertrace.core.metrics.query.api.timeseries.TagSet;

/** A boolean test over the tags of a series. Implementations must be immutable. */
@FunctionalInterface
public interface Predicate {

  boolean apply(TagSet tagSet);
}
