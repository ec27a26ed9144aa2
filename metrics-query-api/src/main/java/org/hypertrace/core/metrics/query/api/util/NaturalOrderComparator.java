package org.hypertrace.core.metrics.query.api.util;

import java.util.Comparator;
import java.util.List;

/**
 * Orders strings the way people read them: runs of digits compare by numeric value, so {@code
 * host2} sorts before {@code host10}. Strings that only differ in leading zeros fall back to plain
 * lexicographic order, keeping the ordering consistent with {@link String#equals(Object)}.
 */
public final class NaturalOrderComparator implements Comparator<String> {

  public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

  private NaturalOrderComparator() {}

  public static void sort(List<String> values) {
    values.sort(INSTANCE);
  }

  @Override
  public int compare(String left, String right) {
    int i = 0;
    int j = 0;
    while (i < left.length() && j < right.length()) {
      char l = left.charAt(i);
      char r = right.charAt(j);
      if (isDigit(l) && isDigit(r)) {
        int leftStart = skipZeros(left, i);
        int rightStart = skipZeros(right, j);
        i = endOfDigits(left, leftStart);
        j = endOfDigits(right, rightStart);
        int lengthDiff = (i - leftStart) - (j - rightStart);
        if (lengthDiff != 0) {
          return lengthDiff;
        }
        int digits = left.substring(leftStart, i).compareTo(right.substring(rightStart, j));
        if (digits != 0) {
          return digits;
        }
        continue;
      }
      if (l != r) {
        return Character.compare(l, r);
      }
      i++;
      j++;
    }
    int remaining = Integer.compare(left.length() - i, right.length() - j);
    return remaining != 0 ? remaining : left.compareTo(right);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static int skipZeros(String value, int from) {
    int index = from;
    while (index < value.length() - 1
        && value.charAt(index) == '0'
        && isDigit(value.charAt(index + 1))) {
      index++;
    }
    return index;
  }

  private static int endOfDigits(String value, int from) {
    int index = from;
    while (index < value.length() && isDigit(value.charAt(index))) {
      index++;
    }
    return index;
  }
}
