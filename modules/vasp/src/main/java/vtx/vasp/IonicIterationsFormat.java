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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.log10;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import vtx.numerics.math.MatrixMath;
import vtx.utilities.IndexUtils;

/**
 * Formats the progress of a relaxation or molecular dynamics run as a table with one row per ionic
 * step.
 *
 * <p>Force statistics ignore frozen components: a component whose freeze flag is false counts as
 * zero.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IonicIterationsFormat {

  /** Columns of the table, in output order. */
  public enum Column {
    /** Free energy TOTEN (eV). */
    TOTEN(" %11s", "TOTEN"),
    /** Energy without entropy, sigma to zero (eV). */
    TOTEN_Z(" %11s", "TOTEN_z"),
    /** Log10 of the absolute energy change from the previous step. */
    LOG10_DE(" %6s", "lgdE"),
    /** Average force magnitude (eV/A). */
    FAVG(" %6s", "Favg"),
    /** Largest force magnitude (eV/A). */
    FMAX(" %6s", "Fmax"),
    /** Cartesian axis of the largest component of the strongest force. */
    FMAX_AXIS(" %4s", "Fax"),
    /** 1-based index of the ion with the strongest force. */
    FMAX_INDEX(" %4s", "Fidx"),
    /** Number of electronic steps. */
    NSCF(" %4s", "Nscf"),
    /** Elapsed wall time (minutes). */
    TIME(" %7s", "Time"),
    /** Cell volume (A^3). */
    VOLUME(" %10s", "Volume"),
    /** Magnetic moment (muB); one column per component for non-collinear runs. */
    MAGMOM(" %7s", "Magmom");

    private final String headerFormat;
    private final String label;

    Column(String headerFormat, String label) {
      this.headerFormat = headerFormat;
      this.label = label;
    }

    String header() {
      return format(headerFormat, label);
    }
  }

  /** The columns printed by default. */
  public static final Set<Column> DEFAULT_COLUMNS = Collections.unmodifiableSet(EnumSet.of(
      Column.TOTEN_Z, Column.LOG10_DE, Column.FMAX, Column.NSCF, Column.TIME, Column.MAGMOM));

  private static final String[] MAGMOM_LABELS = {"Mag_x", "Mag_y", "Mag_z"};

  private static final String[] AXES = {"X", "Y", "Z"};

  private final List<IonicIteration> iterations;
  private final boolean[][] constraints;
  private final Set<Column> columns;
  /** Number of magnetic moment columns: 3 when any step reports a non-collinear moment. */
  private final int magmomWidth;

  /**
   * Constructor for IonicIterationsFormat.
   *
   * @param iterations the ionic steps.
   * @param constraints freeze flags (true means movable), or null if every ion is free.
   * @param columns the columns to print.
   */
  public IonicIterationsFormat(List<IonicIteration> iterations, boolean[][] constraints,
      Set<Column> columns) {
    this.iterations = List.copyOf(iterations);
    this.constraints = copyOf(constraints);
    this.columns = columns.isEmpty() ? EnumSet.noneOf(Column.class) : EnumSet.copyOf(columns);
    int width = 1;
    for (IonicIteration iteration : this.iterations) {
      double[] magmom = iteration.getMagmom();
      if (magmom != null) {
        width = Math.max(width, Math.min(magmom.length, MAGMOM_LABELS.length));
      }
    }
    magmomWidth = width;
  }

  private static boolean[][] copyOf(boolean[][] flags) {
    if (flags == null) {
      return null;
    }
    boolean[][] copy = new boolean[flags.length][];
    for (int i = 0; i < flags.length; i++) {
      copy[i] = flags[i].clone();
    }
    return copy;
  }

  /**
   * Table of an Outcar with the default columns.
   *
   * @param outcar the parsed OUTCAR.
   * @return the IonicIterationsFormat.
   */
  public static IonicIterationsFormat fromOutcar(Outcar outcar) {
    return fromOutcar(outcar, DEFAULT_COLUMNS);
  }

  /**
   * Table of an Outcar.
   *
   * @param outcar the parsed OUTCAR.
   * @param columns the columns to print.
   * @return the IonicIterationsFormat.
   */
  public static IonicIterationsFormat fromOutcar(Outcar outcar, Set<Column> columns) {
    return new IonicIterationsFormat(outcar.getIonicIterations(), outcar.getConstraints(),
        columns);
  }

  /**
   * The header line.
   *
   * @return the column labels.
   */
  public String header() {
    StringBuilder sb = new StringBuilder(format("%7s", "Step"));
    for (Column column : columns) {
      if (column == Column.MAGMOM && magmomWidth > 1) {
        for (int i = 0; i < magmomWidth; i++) {
          sb.append(format(" %7s", MAGMOM_LABELS[i]));
        }
      } else {
        sb.append(column.header());
      }
    }
    return sb.toString();
  }

  /**
   * Force magnitudes of one step with frozen components removed.
   *
   * @param iteration the ionic step.
   * @return one magnitude per ion.
   */
  public double[] forceMagnitudes(IonicIteration iteration) {
    double[][] forces = freeForces(iteration);
    double[] magnitudes = new double[forces.length];
    for (int i = 0; i < forces.length; i++) {
      double[] f = forces[i];
      magnitudes[i] = sqrt(f[0] * f[0] + f[1] * f[1] + f[2] * f[2]);
    }
    return magnitudes;
  }

  private double[][] freeForces(IonicIteration iteration) {
    double[][] forces = iteration.getForces();
    if (constraints != null) {
      for (int i = 0; i < forces.length && i < constraints.length; i++) {
        for (int j = 0; j < 3; j++) {
          if (!constraints[i][j]) {
            forces[i][j] = 0.0;
          }
        }
      }
    }
    return forces;
  }

  /**
   * One table row.
   *
   * @param step the 1-based step index.
   * @return the formatted row.
   * @throws vtx.utilities.IndexRangeException if the step is out of range.
   */
  public String row(int step) {
    IonicIteration iteration = iterations.get(IndexUtils.checkIndex(step, iterations.size(),
        "step"));
    StringBuilder sb = new StringBuilder(format("%7d", step));

    double[][] forces = freeForces(iteration);
    double[] magnitudes = forceMagnitudes(iteration);
    int maxIndex = 0;
    double sum = 0.0;
    for (int i = 0; i < magnitudes.length; i++) {
      sum += magnitudes[i];
      if (magnitudes[i] > magnitudes[maxIndex]) {
        maxIndex = i;
      }
    }
    double favg = (magnitudes.length == 0) ? 0.0 : sum / magnitudes.length;
    double fmax = (magnitudes.length == 0) ? 0.0 : magnitudes[maxIndex];

    for (Column column : columns) {
      switch (column) {
        case TOTEN:
          sb.append(format(" %11.5f", iteration.getToten()));
          break;
        case TOTEN_Z:
          sb.append(format(" %11.5f", iteration.getTotenZ()));
          break;
        case LOG10_DE:
          double de = iteration.getTotenZ();
          if (step > 1) {
            de -= iterations.get(step - 2).getTotenZ();
          }
          sb.append(format(" %6.2f", log10(abs(de))));
          break;
        case FAVG:
          sb.append(format(" %6.3f", favg));
          break;
        case FMAX:
          sb.append(format(" %6.3f", fmax));
          break;
        case FMAX_AXIS:
          sb.append(format(" %4s", (magnitudes.length == 0) ? "-" : AXES[largestComponent(
              forces[maxIndex])]));
          break;
        case FMAX_INDEX:
          sb.append(format(" %4d", maxIndex + 1));
          break;
        case NSCF:
          sb.append(format(" %4d", iteration.getNscf()));
          break;
        case TIME:
          sb.append(format(" %7.2f", iteration.getCputime() / 60.0));
          break;
        case VOLUME:
          sb.append(format(" %10.4f", abs(MatrixMath.mat3Determinant(iteration.getCell()))));
          break;
        case MAGMOM:
          double[] magmom = iteration.getMagmom();
          if (magmom == null) {
            sb.append(format(" %" + (8 * magmomWidth - 1) + "s", "NoMag"));
          } else {
            for (int i = 0; i < magmomWidth; i++) {
              if (i < magmom.length) {
                sb.append(format(" %7.3f", magmom[i]));
              } else {
                sb.append(format(" %7s", "-"));
              }
            }
          }
          break;
        default:
          break;
      }
    }
    return sb.toString();
  }

  private static int largestComponent(double[] f) {
    int axis = 0;
    for (int j = 1; j < 3; j++) {
      if (abs(f[j]) > abs(f[axis])) {
        axis = j;
      }
    }
    return axis;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(header()).append('\n');
    for (int step = 1; step <= iterations.size(); step++) {
      sb.append(row(step)).append('\n');
    }
    return sb.toString();
  }
}
