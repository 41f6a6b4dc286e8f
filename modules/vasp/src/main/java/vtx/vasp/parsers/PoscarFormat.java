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

/**
 * Options for writing a POSCAR, fixed for one export.
 *
 * <p>Defaults are given by {@link #DEFAULT}: fractional coordinates, freeze flags preserved and a
 * symbol tag appended to every atom line.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PoscarFormat {

  /** Fractional coordinates, freeze flags preserved, symbol tags added. */
  public static final PoscarFormat DEFAULT = new PoscarFormat(true, true, true);

  /** Write "Direct" (fractional) coordinates if true, "Cartesian" otherwise. */
  public final boolean fractional;
  /** Write the "Selective Dynamics" section when the structure has freeze flags. */
  public final boolean preserveConstraints;
  /** Append "! label-index  global-index" to every atom line. */
  public final boolean addSymbolTags;

  /**
   * Constructor for PoscarFormat.
   *
   * @param fractional write fractional coordinates.
   * @param preserveConstraints write freeze flags when present.
   * @param addSymbolTags tag every atom line with its species and indices.
   */
  public PoscarFormat(boolean fractional, boolean preserveConstraints, boolean addSymbolTags) {
    this.fractional = fractional;
    this.preserveConstraints = preserveConstraints;
    this.addSymbolTags = addSymbolTags;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" PoscarFormat(fractional=%s, preserveConstraints=%s, addSymbolTags=%s)",
        fractional, preserveConstraints, addSymbolTags);
  }
}
