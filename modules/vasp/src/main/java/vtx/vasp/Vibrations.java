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
package vtx.vasp;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;
import vtx.numerics.math.MatrixMath;
import vtx.utilities.ConsistencyException;
import vtx.utilities.IndexUtils;
import vtx.vasp.parsers.FormatException;
import vtx.vasp.parsers.XSFFilter;

/**
 * The vibrational modes of a run together with the reference structure they displace: the header
 * cell and the positions of the first ionic step.
 *
 * <p>Modes are addressed with 1-based indices.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Vibrations {

  private static final Logger logger = Logger.getLogger(Vibrations.class.getName());

  private final double[][] cell;
  private final String[] symbols;
  private final double[][] positions;
  private final List<VibrationalMode> modes;

  /**
   * Constructor for Vibrations.
   *
   * @param cell the lattice vectors, one per row.
   * @param symbols the symbol of every atom.
   * @param positions the reference cartesian positions.
   * @param modes the modes.
   */
  public Vibrations(double[][] cell, String[] symbols, double[][] positions,
      List<VibrationalMode> modes) {
    if (positions.length != symbols.length) {
      throw new ConsistencyException(format(
          " %d positions were given for %d atoms.", positions.length, symbols.length));
    }
    this.cell = MatrixMath.copyOf(cell);
    this.symbols = symbols.clone();
    this.positions = MatrixMath.copyOf(positions);
    this.modes = List.copyOf(modes);
  }

  /**
   * The vibrations of an Outcar.
   *
   * @param outcar the parsed OUTCAR.
   * @return the Vibrations.
   * @throws FormatException if the run did not compute vibrational modes.
   * @throws ConsistencyException if the run has no ionic step to take positions from.
   */
  public static Vibrations fromOutcar(Outcar outcar) {
    if (!outcar.hasVibrations()) {
      throw new FormatException("vibrations", "the OUTCAR contains no vibrational modes");
    }
    List<IonicIteration> iterations = outcar.getIonicIterations();
    if (iterations.isEmpty()) {
      throw new ConsistencyException(" The OUTCAR has no ionic step with reference positions.");
    }
    return new Vibrations(outcar.getCell(), outcar.getSymbols(),
        iterations.get(0).getPositions(), outcar.getVibrations());
  }

  /**
   * The number of modes.
   *
   * @return the number of modes.
   */
  public int size() {
    return modes.size();
  }

  /**
   * One mode.
   *
   * @param mode the 1-based mode index.
   * @return the VibrationalMode.
   * @throws vtx.utilities.IndexRangeException if the mode does not exist.
   */
  public VibrationalMode getMode(int mode) {
    return modes.get(IndexUtils.checkIndex(mode, modes.size(), "mode"));
  }

  /**
   * Write one mode as an XSF file named mode_####.xsf; the displacement field is attached to the
   * atoms of the reference structure.
   *
   * @param mode the 1-based mode index.
   * @param directory the output directory.
   * @return the file written.
   * @throws IOException if the file cannot be written.
   * @throws vtx.utilities.IndexRangeException if the mode does not exist.
   */
  public File saveAsXsf(int mode, File directory) throws IOException {
    VibrationalMode vibrationalMode = getMode(mode);
    File file = new File(directory, format("mode_%04d.xsf", mode));
    XSFFilter.writeFile(cell, symbols, positions, vibrationalMode.getDisplacements(), file);
    logger.fine(format(" Mode %d:%s", mode, vibrationalMode));
    return file;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" %4s %14s %9s\n", "Mode", "Freq (cm-1)",
        "Imaginary"));
    for (int i = 0; i < modes.size(); i++) {
      VibrationalMode mode = modes.get(i);
      sb.append(format(" %4d %14.6f %9s\n", i + 1, mode.getFrequency(),
          mode.isImaginary() ? "Yes" : "No"));
    }
    return sb.toString();
  }
}
