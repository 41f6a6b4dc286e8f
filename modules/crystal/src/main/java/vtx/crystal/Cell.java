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
import static org.apache.commons.math3.util.FastMath.acos;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toDegrees;
import static vtx.numerics.math.MatrixMath.batchTransform;
import static vtx.numerics.math.MatrixMath.mat3Determinant;
import static vtx.numerics.math.MatrixMath.mat3Inverse;
import static vtx.numerics.math.MatrixMath.mat3Scale;

import vtx.numerics.math.MatrixMath;

/**
 * The Cell class holds the three lattice vectors of a periodic structure, one per row, together
 * with a positive scale factor.
 *
 * <p>All coordinate conversions use the scaled lattice. Cartesian coordinates are row vectors
 * given by the fractional coordinates multiplied from the left onto the scaled lattice.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Cell {

  /** The lattice vectors as written, one per row. */
  private final double[][] lattice;
  /** The scale factor applied to the lattice (always positive). */
  private final double scale;
  /** Lattice vectors multiplied by the scale factor. */
  private final double[][] scaledLattice;
  /** Inverse of the scaled lattice, or null for a singular lattice. */
  private final double[][] inverse;

  /**
   * Create a Cell with unit scale.
   *
   * @param lattice the lattice vectors, one per row.
   */
  public Cell(double[][] lattice) {
    this(lattice, 1.0);
  }

  /**
   * Create a Cell.
   *
   * @param lattice the lattice vectors, one per row.
   * @param scale the scale factor.
   * @throws IllegalArgumentException if the lattice is not 3x3 or the scale is not positive.
   */
  public Cell(double[][] lattice, double scale) {
    if (lattice == null || lattice.length != 3) {
      throw new IllegalArgumentException(" A lattice requires three vectors.");
    }
    for (double[] row : lattice) {
      if (row.length != 3) {
        throw new IllegalArgumentException(" A lattice vector requires three components.");
      }
    }
    if (Double.isNaN(scale) || scale <= 0.0) {
      throw new IllegalArgumentException(format(" The lattice scale %f must be positive.", scale));
    }
    this.lattice = MatrixMath.copyOf(lattice);
    this.scale = scale;
    scaledLattice = mat3Scale(lattice, scale);
    inverse = mat3Inverse(scaledLattice);
  }

  /**
   * The lattice vectors as written (without the scale factor).
   *
   * @return a copy of the lattice.
   */
  public double[][] getLattice() {
    return MatrixMath.copyOf(lattice);
  }

  /**
   * The scale factor.
   *
   * @return the scale factor.
   */
  public double getScale() {
    return scale;
  }

  /**
   * The lattice vectors multiplied by the scale factor.
   *
   * @return a copy of the scaled lattice.
   */
  public double[][] getScaledLattice() {
    return MatrixMath.copyOf(scaledLattice);
  }

  /**
   * Volume of the scaled cell.
   *
   * @return the determinant of the scaled lattice.
   */
  public double getVolume() {
    return mat3Determinant(scaledLattice);
  }

  /**
   * Check if the lattice is singular.
   *
   * @return true if the scaled lattice cannot be inverted.
   */
  public boolean isSingular() {
    return inverse == null;
  }

  /**
   * Convert cartesian coordinates to fractional coordinates.
   *
   * @param cartesian Nx3 cartesian coordinates.
   * @return newly allocated Nx3 fractional coordinates.
   * @throws GeometryException if the lattice is singular.
   */
  public double[][] toFractional(double[][] cartesian) {
    checkInvertible();
    return batchTransform(cartesian, inverse);
  }

  /**
   * Require an invertible lattice.
   *
   * @throws GeometryException if the lattice is singular.
   */
  public void checkInvertible() {
    if (inverse == null) {
      throw new GeometryException(format(
          " The lattice is singular (volume %12.6e) and cannot be inverted.", getVolume()));
    }
  }

  /**
   * Convert fractional coordinates to cartesian coordinates.
   *
   * @param fractional Nx3 fractional coordinates.
   * @return newly allocated Nx3 cartesian coordinates.
   */
  public double[][] toCartesian(double[][] fractional) {
    return batchTransform(fractional, scaledLattice);
  }

  /**
   * Length of one scaled lattice vector.
   *
   * @param i the lattice vector (0, 1 or 2).
   * @return its length.
   */
  public double length(int i) {
    double[] v = scaledLattice[i];
    return sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
  }

  private double angle(int i, int j) {
    double[] u = scaledLattice[i];
    double[] v = scaledLattice[j];
    double dot = u[0] * v[0] + u[1] * v[1] + u[2] * v[2];
    return toDegrees(acos(dot / (length(i) * length(j))));
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("\n Lattice\n");
    sb.append(format("  A-axis:                              %8.3f\n", length(0)));
    sb.append(format("  B-axis:                              %8.3f\n", length(1)));
    sb.append(format("  C-axis:                              %8.3f\n", length(2)));
    sb.append(format("  Alpha:                               %8.3f\n", angle(1, 2)));
    sb.append(format("  Beta:                                %8.3f\n", angle(0, 2)));
    sb.append(format("  Gamma:                               %8.3f\n", angle(0, 1)));
    sb.append(format("  Volume:                              %8.3f", getVolume()));
    return sb.toString();
  }
}
