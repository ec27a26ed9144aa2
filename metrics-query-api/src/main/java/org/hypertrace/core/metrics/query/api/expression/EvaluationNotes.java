package org.hypertrace.core.metrics.query.api.expression;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Free-form remarks gathered while evaluating, returned to the user with the result. */
public class EvaluationNotes {

  private final List<String> notes = new ArrayList<>();

  public synchronized void addNote(String note) {
    notes.add(note);
  }

  public synchronized List<String> getNotes() {
    return ImmutableList.copyOf(notes);
  }
}
