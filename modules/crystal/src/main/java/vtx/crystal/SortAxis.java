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
package vtx.crystal;

import static java.lang.String.format;

/**
 * Coordinates that atoms may be ordered by: the fractional axes A, B and C, or the cartesian axes
 * X, Y and Z.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum SortAxis {
  A(0, true), B(1, true), C(2, true), X(0, false), Y(1, false), Z(2, false);

  /** The coordinate component. */
  public final int component;
  /** True for a fractional axis, false for a cartesian axis. */
  public final boolean fractional;

  SortAxis(int component, boolean fractional) {
    this.component = component;
    this.fractional = fractional;
  }

  /**
   * Parse a priority list such as "ZA" (sort by cartesian Z, then by fractional A).
   *
   * @param axes the axis letters, case-insensitive.
   * @return the axes in priority order.
   * @throws IllegalArgumentException for an unknown axis letter or an empty list.
   */
  public static SortAxis[] parse(String axes) {
    if (axes == null || axes.isBlank()) {
      throw new IllegalArgumentException(" At least one sort axis is required.");
    }
    String trimmed = axes.trim().toUpperCase();
    SortAxis[] parsed = new SortAxis[trimmed.length()];
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      try {
        parsed[i] = SortAxis.valueOf(String.valueOf(c));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(format(" Unknown sort axis %s in %s.", c, axes), e);
      }
    }
    return parsed;
  }
}
