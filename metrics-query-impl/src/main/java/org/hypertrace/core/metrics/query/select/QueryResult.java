package org.hypertrace.core.metrics.query.select;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.hypertrace.core.metrics.query.api.timeseries.TaggedScalar;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;
import org.hypertrace.core.metrics.query.api.timeseries.Timeseries;

/** The result of one expression of a select, annotated with its query text and display name. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(Include.NON_NULL)
public class QueryResult {

  String query;
  String name;
  Type type;

  // set for SERIES
  List<Timeseries> series;
  Timerange timerange;

  // set for SCALARS
  List<TaggedScalar> scalars;

  public static QueryResult series(
      String query, String name, List<Timeseries> series, Timerange timerange) {
    return new QueryResult(query, name, Type.SERIES, List.copyOf(series), timerange, null);
  }

  public static QueryResult scalars(String query, String name, List<TaggedScalar> scalars) {
    return new QueryResult(query, name, Type.SCALARS, null, null, List.copyOf(scalars));
  }

  public enum Type {
    SERIES("series"),
    SCALARS("scalars");

    private final String jsonName;

    Type(String jsonName) {
      this.jsonName = jsonName;
    }

    @JsonValue
    public String getJsonName() {
      return jsonName;
    }
  }
}
