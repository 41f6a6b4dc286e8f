// ******************************************************************************
//
// Title:       Force Field X.
// Description: Force Field X - Software for Molecular Biophysics.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of Force Field X.
//
// Force Field X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Force Field X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Force Field X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package vtx.vasp.parsers;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scanning primitives for semi-structured text logs.
 *
 * <p>A marker is a pattern that may occur many times. For each occurrence a bounded context is
 * cut out of the text, either backwards to the previous occurrence or forwards line by line, and
 * handed to a field parser. All methods only read the text.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MarkerScanner {

  /** Prevent instantiation. */
  private MarkerScanner() {
  }

  /**
   * Start offsets of every occurrence of a marker.
   *
   * @param text the text to scan.
   * @param marker the marker pattern.
   * @return offsets in document order.
   */
  public static List<Integer> findAll(String text, Pattern marker) {
    List<Integer> offsets = new ArrayList<>();
    Matcher matcher = marker.matcher(text);
    while (matcher.find()) {
      offsets.add(matcher.start());
    }
    return offsets;
  }

  /**
   * A capture group of every occurrence of a pattern.
   *
   * @param text the text to scan.
   * @param pattern the pattern.
   * @param group the capture group.
   * @return the captured values in document order.
   */
  public static List<String> findAllGroups(String text, Pattern pattern, int group) {
    List<String> values = new ArrayList<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      values.add(matcher.group(group));
    }
    return values;
  }

  /**
   * The first occurrence of a pattern.
   *
   * @param text the text to scan.
   * @param pattern the pattern.
   * @param field the field name used if the pattern is absent.
   * @return a Matcher positioned on the first occurrence.
   * @throws FormatException if the pattern does not occur.
   */
  public static Matcher findFirst(String text, Pattern pattern, String field) {
    Matcher matcher = pattern.matcher(text);
    if (!matcher.find()) {
      throw FormatException.missing(field);
    }
    return matcher;
  }

  /**
   * For every marker occurrence, the text between the end of the previous occurrence (or the start
   * of the text) and the start of this occurrence.
   *
   * @param text the text to scan.
   * @param marker the marker pattern.
   * @return one context per occurrence.
   */
  public static List<String> backwardContexts(String text, Pattern marker) {
    List<String> contexts = new ArrayList<>();
    Matcher matcher = marker.matcher(text);
    int previous = 0;
    while (matcher.find()) {
      contexts.add(text.substring(previous, matcher.start()));
      previous = matcher.end();
    }
    return contexts;
  }

  /**
   * The last line of a context that contains an anchor.
   *
   * @param context the context.
   * @param anchor the literal anchor.
   * @return the line, starting at the anchor, or null if the anchor is absent.
   */
  public static String lastLineContaining(String context, String anchor) {
    int start = context.lastIndexOf(anchor);
    if (start < 0) {
      return null;
    }
    int end = context.indexOf('\n', start);
    return (end < 0) ? context.substring(start) : context.substring(start, end);
  }

  /**
   * A fixed number of lines following a marker.
   *
   * <p>The line that contains the offset is line 0.
   *
   * @param text the text.
   * @param offset an offset inside the marker line.
   * @param skip the number of lines to skip, counting the marker line.
   * @param count the number of lines to return.
   * @param field the field name used if the text ends early.
   * @return the lines, without line terminators.
   * @throws FormatException if fewer than count lines follow.
   */
  public static List<String> linesAfter(String text, int offset, int skip, int count,
      String field) {
    List<String> lines = new ArrayList<>(count);
    int position = skipLines(text, offset, skip);
    while (lines.size() < count) {
      if (position < 0 || position >= text.length()) {
        throw new FormatException(field,
            format("expected %d lines but found %d", count, lines.size()));
      }
      int end = lineEnd(text, position);
      lines.add(stripCarriageReturn(text.substring(position, end)));
      position = end + 1;
    }
    return lines;
  }

  /**
   * The lines following a marker up to, but not including, a sentinel line.
   *
   * <p>The line that contains the offset is line 0.
   *
   * @param text the text.
   * @param offset an offset inside the marker line.
   * @param skip the number of lines to skip, counting the marker line.
   * @param sentinel true for the line that terminates the section.
   * @param field the field name used if the sentinel is never found.
   * @return the lines, without line terminators.
   * @throws FormatException if the text ends before the sentinel.
   */
  public static List<String> linesUntil(String text, int offset, int skip,
      Predicate<String> sentinel, String field) {
    List<String> lines = new ArrayList<>();
    int position = skipLines(text, offset, skip);
    while (true) {
      if (position < 0 || position >= text.length()) {
        throw new FormatException(field, "the section is not terminated");
      }
      int end = lineEnd(text, position);
      String line = stripCarriageReturn(text.substring(position, end));
      if (sentinel.test(line)) {
        return lines;
      }
      lines.add(line);
      position = end + 1;
    }
  }

  /**
   * Offset of the first character of the line that is skip lines below the line containing
   * offset, or -1 if the text ends first.
   */
  private static int skipLines(String text, int offset, int skip) {
    int position = text.lastIndexOf('\n', offset - 1) + 1;
    for (int i = 0; i < skip; i++) {
      int end = text.indexOf('\n', position);
      if (end < 0) {
        return -1;
      }
      position = end + 1;
    }
    return position;
  }

  private static int lineEnd(String text, int position) {
    int end = text.indexOf('\n', position);
    return (end < 0) ? text.length() : end;
  }

  private static String stripCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
