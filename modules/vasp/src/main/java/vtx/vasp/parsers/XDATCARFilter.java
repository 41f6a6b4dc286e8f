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
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import vtx.crystal.Structure;
import vtx.utilities.ConsistencyException;
import vtx.utilities.StringUtils;

/**
 * The XDATCARFilter writes a sequence of structures as a VASP XDATCAR trajectory: one header
 * taken from the first structure, then one block of fractional coordinates per step.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class XDATCARFilter {

  private static final Logger logger = Logger.getLogger(XDATCARFilter.class.getName());

  /** Prevent instantiation. */
  private XDATCARFilter() {
  }

  /**
   * Write an XDATCAR file.
   *
   * @param structures the steps, in order.
   * @param file the destination.
   * @throws IOException if the file cannot be written.
   */
  public static void writeFile(List<Structure> structures, File file) throws IOException {
    FileUtils.writeStringToFile(file, formatTrajectory(structures), StandardCharsets.UTF_8);
    logger.info(format(" Wrote %d steps to %s", structures.size(), file.getPath()));
  }

  /**
   * Format a sequence of structures as an XDATCAR.
   *
   * @param structures the steps, in order; all must share the species of the first.
   * @return the XDATCAR text.
   * @throws ConsistencyException if there are no steps or the species differ between steps.
   */
  public static String formatTrajectory(List<Structure> structures) {
    if (structures.isEmpty()) {
      throw new ConsistencyException(" An XDATCAR requires at least one step.");
    }
    Structure first = structures.get(0);
    String[] ionTypes = first.getIonTypes();
    int[] ionsPerType = first.getIonsPerType();

    StringBuilder sb = new StringBuilder();
    sb.append(first.getComment()).append('\n');
    sb.append(format("%19.14f\n", first.getCell().getScale()));
    for (double[] row : first.getCell().getLattice()) {
      sb.append(format(" %21.16f %21.16f %21.16f\n", row[0], row[1], row[2]));
    }
    for (String ionType : ionTypes) {
      sb.append(StringUtils.padLeft(ionType, 6));
    }
    sb.append('\n');
    for (int count : ionsPerType) {
      sb.append(format("%6d", count));
    }
    sb.append('\n');

    for (int step = 0; step < structures.size(); step++) {
      Structure structure = structures.get(step);
      if (!Arrays.equals(ionTypes, structure.getIonTypes())
          || !Arrays.equals(ionsPerType, structure.getIonsPerType())) {
        throw new ConsistencyException(format(
            " The species of step %d differ from those of the first step.", step + 1));
      }
      sb.append(format("Direct configuration=%6d\n", step + 1));
      for (double[] x : structure.getFractional()) {
        sb.append(format(" %19.16f %19.16f %19.16f\n", x[0], x[1], x[2]));
      }
    }
    return sb.toString();
  }
}
