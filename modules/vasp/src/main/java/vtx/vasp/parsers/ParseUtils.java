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

import vtx.utilities.StringUtils;

/**
 * Token conversion shared by the VASP filters. Every failure names the field being read.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ParseUtils {

  /** Prevent instantiation. */
  private ParseUtils() {
  }

  /**
   * Parse a floating point token.
   *
   * @param token the token.
   * @param field the field being read.
   * @return the value.
   * @throws TokenParseException if the token is not a number.
   */
  public static double parseDouble(String token, String field) {
    try {
      return Double.parseDouble(token);
    } catch (NumberFormatException e) {
      throw new TokenParseException(field, token, e);
    }
  }

  /**
   * Parse an integer token.
   *
   * @param token the token.
   * @param field the field being read.
   * @return the value.
   * @throws TokenParseException if the token is not an integer.
   */
  public static int parseInt(String token, String field) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new TokenParseException(field, token, e);
    }
  }

  /**
   * Parse a T/F flag; only the first character is significant.
   *
   * @param token the token.
   * @param field the field being read.
   * @return true for T, false for F.
   * @throws TokenParseException for anything else.
   */
  public static boolean parseFlag(String token, String field) {
    if (!token.isEmpty()) {
      char c = Character.toUpperCase(token.charAt(0));
      if (c == 'T') {
        return true;
      } else if (c == 'F') {
        return false;
      }
    }
    throw new TokenParseException(field, token, null);
  }

  /**
   * Parse the first n tokens of a line as floating point values.
   *
   * @param line the line.
   * @param n the number of values required.
   * @param field the field being read.
   * @return the values.
   * @throws FormatException if the line has fewer than n tokens.
   * @throws TokenParseException if a token is not a number.
   */
  public static double[] parseDoubles(String line, int n, String field) {
    return parseDoubles(line, 0, n, field);
  }

  /**
   * Parse n tokens of a line, starting at a token offset, as floating point values.
   *
   * @param line the line.
   * @param offset index of the first token to convert.
   * @param n the number of values required.
   * @param field the field being read.
   * @return the values.
   * @throws FormatException if the line has fewer than offset + n tokens.
   * @throws TokenParseException if a token is not a number.
   */
  public static double[] parseDoubles(String line, int offset, int n, String field) {
    String[] tokens = StringUtils.tokenize(line);
    if (tokens.length < offset + n) {
      throw new FormatException(field,
          format("expected %d columns but found %d in \"%s\"", offset + n, tokens.length,
              line.trim()));
    }
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = parseDouble(tokens[offset + i], field);
    }
    return values;
  }
}
