package org.hypertrace.core.metrics.query.api.timeseries;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TimeseriesTest {

  @Test
  void samplesCannotBeChangedFromOutside() {
    double[] samples = {1.0, 2.0};
    Timeseries series = new Timeseries(samples, TagSet.of("host", "a"));

    samples[0] = 42.0;
    series.getValues()[1] = 42.0;

    assertArrayEquals(new double[] {1.0, 2.0}, series.getValues());
  }

  @Test
  void equalWhenSamplesAndTagsMatch() {
    assertEquals(
        new Timeseries(new double[] {1.0, 2.0}, TagSet.of("host", "a")),
        new Timeseries(new double[] {1.0, 2.0}, TagSet.of("host", "a")));
  }
}
