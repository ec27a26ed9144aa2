package org.hypertrace.core.metrics.query.api.timeseries;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TagSetTest {

  @Test
  void printsTagsInKeyOrder() {
    TagSet tagSet = TagSet.of(Map.of("host", "a", "app", "web"));

    assertEquals("app=web,host=a", tagSet.toString());
  }

  @Test
  void equalRegardlessOfInsertionOrder() {
    assertEquals(
        TagSet.of(Map.of("host", "a", "app", "web")), TagSet.of(Map.of("app", "web", "host", "a")));
  }

  @Test
  void lookupByKey() {
    TagSet tagSet = TagSet.of("host", "a");

    assertEquals(Optional.of("a"), tagSet.get("host"));
    assertEquals(Optional.empty(), tagSet.get("app"));
    assertTrue(tagSet.hasKey("host"));
    assertFalse(tagSet.hasKey("app"));
  }

  @Test
  void emptyMapGivesSharedEmptySet() {
    assertSame(TagSet.empty(), TagSet.of(Map.of()));
    assertTrue(TagSet.empty().isEmpty());
    assertEquals("", TagSet.empty().toString());
  }
}
