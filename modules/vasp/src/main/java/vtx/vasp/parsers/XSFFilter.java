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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import vtx.utilities.ConsistencyException;

/**
 * The XSFFilter writes a periodic structure in the XCrySDen XSF format, with one vector (a force
 * or a mode displacement) attached to every atom.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class XSFFilter {

  private static final Logger logger = Logger.getLogger(XSFFilter.class.getName());

  /** Prevent instantiation. */
  private XSFFilter() {
  }

  /**
   * Write an XSF file.
   *
   * @param lattice the lattice vectors, one per row.
   * @param symbols the symbol of every atom.
   * @param positions cartesian positions.
   * @param vectors one vector per atom.
   * @param file the destination.
   * @throws IOException if the file cannot be written.
   */
  public static void writeFile(double[][] lattice, String[] symbols, double[][] positions,
      double[][] vectors, File file) throws IOException {
    FileUtils.writeStringToFile(file, formatCrystal(lattice, symbols, positions, vectors),
        StandardCharsets.UTF_8);
    logger.info(format(" Wrote %s", file.getPath()));
  }

  /**
   * Format a periodic structure as XSF.
   *
   * @param lattice the lattice vectors, one per row.
   * @param symbols the symbol of every atom.
   * @param positions cartesian positions.
   * @param vectors one vector per atom.
   * @return the XSF text.
   * @throws ConsistencyException if the arrays do not have one entry per atom.
   */
  public static String formatCrystal(double[][] lattice, String[] symbols, double[][] positions,
      double[][] vectors) {
    int n = symbols.length;
    if (positions.length != n || vectors.length != n) {
      throw new ConsistencyException(format(
          " XSF output requires one position and one vector for each of %d atoms.", n));
    }
    StringBuilder sb = new StringBuilder("CRYSTAL\nPRIMVEC\n");
    for (double[] row : lattice) {
      sb.append(format(" %15.10f %15.10f %15.10f\n", row[0], row[1], row[2]));
    }
    sb.append("PRIMCOORD\n");
    sb.append(format(" %d 1\n", n));
    for (int i = 0; i < n; i++) {
      double[] x = positions[i];
      double[] v = vectors[i];
      sb.append(format("%-3s %15.10f %15.10f %15.10f %15.10f %15.10f %15.10f\n", symbols[i],
          x[0], x[1], x[2], v[0], v[1], v[2]));
    }
    return sb.toString();
  }
}
