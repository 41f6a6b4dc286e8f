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
package vtx.numerics.math;

import static org.apache.commons.math3.util.FastMath.abs;

/**
 * The MatrixMath class is a small 3x3 matrix library for lattice algebra.
 *
 * <p>Lattice matrices store one lattice vector per row, so points are transformed as row vectors
 * multiplied from the left (p · M).
 *
 * <p>All methods are thread-safe and static.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MatrixMath {

  /**
   * Matrices with an absolute determinant below this value are treated as singular.
   */
  public static final double SINGULAR_TOLERANCE = 1.0e-5;

  private MatrixMath() {
    // Prevent instantiation.
  }

  /**
   * Calculate the determinant for a 3x3 matrix.
   *
   * @param m input matrix.
   * @return The determinant.
   */
  public static double mat3Determinant(double[][] m) {
    return m[0][0] * m[1][1] * m[2][2] - m[0][0] * m[1][2] * m[2][1]
        + m[0][1] * m[1][2] * m[2][0] - m[0][1] * m[1][0] * m[2][2]
        + m[0][2] * m[1][0] * m[2][1] - m[0][2] * m[1][1] * m[2][0];
  }

  /**
   * Check if a 3x3 matrix is singular.
   *
   * @param m input matrix.
   * @return true if |det(m)| is below {@link #SINGULAR_TOLERANCE}.
   */
  public static boolean mat3IsSingular(double[][] m) {
    return abs(mat3Determinant(m)) < SINGULAR_TOLERANCE;
  }

  /**
   * Compute the inverse of a 3x3 matrix. The result is returned in a newly allocated matrix.
   *
   * @param m The input 3x3 matrix.
   * @return the inverse of m, or null if m is singular.
   */
  public static double[][] mat3Inverse(double[][] m) {
    double det = mat3Determinant(m);
    if (abs(det) < SINGULAR_TOLERANCE) {
      return null;
    }
    double inverseDet = 1.0 / det;
    double[][] output = new double[3][3];
    output[0][0] = (m[1][1] * m[2][2] - m[1][2] * m[2][1]) * inverseDet;
    output[0][1] = (m[0][2] * m[2][1] - m[0][1] * m[2][2]) * inverseDet;
    output[0][2] = (m[0][1] * m[1][2] - m[0][2] * m[1][1]) * inverseDet;
    output[1][0] = (m[1][2] * m[2][0] - m[1][0] * m[2][2]) * inverseDet;
    output[1][1] = (m[0][0] * m[2][2] - m[0][2] * m[2][0]) * inverseDet;
    output[1][2] = (m[0][2] * m[1][0] - m[0][0] * m[1][2]) * inverseDet;
    output[2][0] = (m[1][0] * m[2][1] - m[1][1] * m[2][0]) * inverseDet;
    output[2][1] = (m[0][1] * m[2][0] - m[0][0] * m[2][1]) * inverseDet;
    output[2][2] = (m[0][0] * m[1][1] - m[0][1] * m[1][0]) * inverseDet;
    return output;
  }

  /**
   * Returns the transpose of a 3x3 Matrix m in newly allocated memory.
   *
   * @param m The input matrix.
   * @return An allocated 3x3 matrix with the transpose of m.
   */
  public static double[][] mat3Transpose(double[][] m) {
    double[][] output = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        output[j][i] = m[i][j];
      }
    }
    return output;
  }

  /**
   * Multiply every element of a 3x3 matrix by a scalar.
   *
   * @param m The input matrix.
   * @param scale The scale factor.
   * @return A newly allocated scaled matrix.
   */
  public static double[][] mat3Scale(double[][] m, double scale) {
    double[][] output = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        output[i][j] = m[i][j] * scale;
      }
    }
    return output;
  }

  /**
   * Multiply a 1x3 vector and 3x3 matrix. The output is returned in a newly allocated 1x3 vector.
   *
   * @param v input 1x3 vector.
   * @param m input 3x3 matrix.
   * @return Returns the output vector.
   */
  public static double[] vec3Mat3(double[] v, double[][] m) {
    double[] output = new double[3];
    output[0] = v[0] * m[0][0] + v[1] * m[1][0] + v[2] * m[2][0];
    output[1] = v[0] * m[0][1] + v[1] * m[1][1] + v[2] * m[2][1];
    output[2] = v[0] * m[0][2] + v[1] * m[1][2] + v[2] * m[2][2];
    return output;
  }

  /**
   * Transform an Nx3 array of row vectors by a 3x3 matrix (p · m for each row p).
   *
   * @param points the Nx3 input points; not modified.
   * @param m input 3x3 matrix.
   * @return a newly allocated Nx3 array.
   */
  public static double[][] batchTransform(double[][] points, double[][] m) {
    int n = points.length;
    double[][] output = new double[n][];
    for (int i = 0; i < n; i++) {
      output[i] = vec3Mat3(points[i], m);
    }
    return output;
  }

  /**
   * Deep copy of an array of rows.
   *
   * @param m the rows to copy, may be null.
   * @return a copy, or null if m is null.
   */
  public static double[][] copyOf(double[][] m) {
    if (m == null) {
      return null;
    }
    double[][] copy = new double[m.length][];
    for (int i = 0; i < m.length; i++) {
      copy[i] = m[i].clone();
    }
    return copy;
  }
}
