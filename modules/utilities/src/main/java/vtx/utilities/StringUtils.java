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
package vtx.utilities;

import static java.lang.String.format;

/**
 * String formatting and tokenizing helpers shared by the parsers and report writers.
 *
 * @author Michael Schnieders
 */
public final class StringUtils {

  private static final String[] EMPTY = new String[0];

  /** Prevent instantiation. */
  private StringUtils() {
  }

  /**
   * Split a line on runs of white space, ignoring leading and trailing white space.
   *
   * @param line the line to split.
   * @return the tokens, or an empty array for a blank line.
   */
  public static String[] tokenize(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return EMPTY;
    }
    return trimmed.split("\\s+");
  }

  /**
   * Prints a fixed-width decimal using String.format conventions, reducing the value if necessary
   * to fit within the width.
   *
   * @param val a double.
   * @param width a int.
   * @param prec a int.
   * @return a {@link java.lang.String} object.
   */
  public static String fwFpTrunc(double val, int width, int prec) {
    String str = format("%" + width + "." + prec + "f", val);
    if (str.length() > width) {
      StringBuilder sb;
      if (val < 0) {
        sb = new StringBuilder("-");
      } else {
        sb = new StringBuilder("9");
      }
      sb.append("9".repeat(Math.max(0, width - prec - 2)));
      sb.append(".");
      sb.append("9".repeat(prec));
      str = sb.toString();
    }
    return str;
  }

  /**
   * padRight
   *
   * @param s a {@link java.lang.String} object.
   * @param n a int.
   * @return a {@link java.lang.String} object.
   */
  public static String padRight(String s, int n) {
    return format("%-" + n + "s", s);
  }

  /**
   * padLeft
   *
   * @param s a {@link java.lang.String} object.
   * @param n a int.
   * @return a {@link java.lang.String} object.
   */
  public static String padLeft(String s, int n) {
    return format("%" + n + "s", s);
  }
}
