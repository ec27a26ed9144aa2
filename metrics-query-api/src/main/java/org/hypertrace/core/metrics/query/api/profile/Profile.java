package org.hypertrace.core.metrics.query.api.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/** One finished timing span. Timestamps are epoch milliseconds. */
@Value
public class Profile {
  String name;
  long startMillis;
  long finishMillis;

  @JsonProperty
  public long getDurationMillis() {
    return finishMillis - startMillis;
  }
}
