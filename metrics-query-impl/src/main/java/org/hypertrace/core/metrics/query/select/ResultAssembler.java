package org.hypertrace.core.metrics.query.select;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.exception.TypeMismatchException;
import org.hypertrace.core.metrics.query.api.expression.EvaluationNotes;
import org.hypertrace.core.metrics.query.api.expression.Expression;
import org.hypertrace.core.metrics.query.api.expression.Value;
import org.hypertrace.core.metrics.query.api.timeseries.SeriesList;
import org.hypertrace.core.metrics.query.api.timeseries.TaggedScalar;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;
import org.hypertrace.core.metrics.query.api.timeseries.Timeseries;
import org.hypertrace.core.metrics.query.api.util.NaturalOrderComparator;

/** Turns the evaluated values of a select into its {@link Result}. */
public class ResultAssembler {

  public static final String DESCRIPTION_KEY = "description";
  public static final String NOTES_KEY = "notes";
  public static final String RESOLUTION_KEY = "resolution";

  /**
   * The body is one {@link QueryResult} per expression, in expression order. Metadata carries the
   * tag values seen across all series, the evaluation notes, and the chosen resolution in
   * milliseconds.
   *
   * @throws TypeMismatchException if a value is missing, or is neither a series list nor a
   *     scalar set
   */
  public Result assemble(
      List<Expression> expressions,
      List<Value> values,
      NegotiatedTimerange negotiated,
      EvaluationNotes notes) {
    Preconditions.checkArgument(
        expressions.size() == values.size(),
        "Got %s values for %s expressions",
        values.size(),
        expressions.size());

    List<QueryResult> body = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      body.add(toQueryResult(expressions.get(i), values.get(i), negotiated.getTimerange()));
    }

    return Result.of(
        body,
        ImmutableMap.of(
            DESCRIPTION_KEY, describe(body),
            NOTES_KEY, notes.getNotes(),
            RESOLUTION_KEY, negotiated.getResolution().toMillis()));
  }

  private QueryResult toQueryResult(Expression expression, Value value, Timerange timerange) {
    if (value == null) {
      throw new TypeMismatchException(expression.getQueryText());
    }
    Optional<SeriesList> seriesList = value.toSeriesList(timerange);
    if (seriesList.isPresent()) {
      return QueryResult.series(
          expression.getQueryText(),
          expression.getDisplayName(),
          seriesList.get().getSeries(),
          timerange);
    }
    Optional<List<TaggedScalar>> scalars = value.toScalarSet();
    if (scalars.isPresent()) {
      return QueryResult.scalars(
          expression.getQueryText(), expression.getDisplayName(), scalars.get());
    }
    throw new TypeMismatchException(expression.getQueryText());
  }

  /** Tag key to every value it takes across the series of all results, naturally sorted. */
  static Map<String, List<String>> describe(List<QueryResult> results) {
    Map<String, List<String>> description = new TreeMap<>();
    for (QueryResult result : results) {
      if (result.getType() != QueryResult.Type.SERIES) {
        continue;
      }
      for (Timeseries series : result.getSeries()) {
        for (Map.Entry<String, String> tag : series.getTagSet().entrySet()) {
          description.computeIfAbsent(tag.getKey(), key -> new ArrayList<>()).add(tag.getValue());
        }
      }
    }
    description.replaceAll((key, values) -> sortedDistinct(values));
    return description;
  }

  // sorting groups equal values, so dropping adjacent repeats is enough
  static List<String> sortedDistinct(List<String> values) {
    NaturalOrderComparator.sort(values);
    List<String> filtered = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      if (i == 0 || !values.get(i - 1).equals(values.get(i))) {
        filtered.add(values.get(i));
      }
    }
    return filtered;
  }
}
