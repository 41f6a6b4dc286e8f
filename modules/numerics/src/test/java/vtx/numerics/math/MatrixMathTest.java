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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static vtx.numerics.math.MatrixMath.batchTransform;
import static vtx.numerics.math.MatrixMath.mat3Determinant;
import static vtx.numerics.math.MatrixMath.mat3Inverse;
import static vtx.numerics.math.MatrixMath.mat3IsSingular;
import static vtx.numerics.math.MatrixMath.mat3Transpose;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import vtx.utilities.VTXTest;

/**
 * Test the 3x3 lattice algebra on representative cells.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class MatrixMathTest extends VTXTest {

  private static final double tolerance = 1.0e-10;

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Orthorhombic", new double[][] {{6.0, 0.0, 0.0}, {0.0, 7.0, 0.0}, {0.0, 0.0, 8.0}}, 336.0},
        {"Hexagonal", new double[][] {{3.0, 0.0, 0.0}, {-1.5, 2.598076211353316, 0.0},
            {0.0, 0.0, 5.0}}, 38.97114317029974},
        {"Triclinic", new double[][] {{4.0, 0.1, 0.2}, {0.3, 5.0, 0.4}, {0.5, 0.6, 6.0}},
            118.416},
        {"Fcc primitive", new double[][] {{0.0, 2.0, 2.0}, {2.0, 0.0, 2.0}, {2.0, 2.0, 0.0}},
            16.0}
    });
  }

  private final String info;
  private final double[][] lattice;
  private final double volume;

  public MatrixMathTest(String info, double[][] lattice, double volume) {
    this.info = info;
    this.lattice = lattice;
    this.volume = volume;
  }

  @Test
  public void testDeterminant() {
    assertEquals(info, volume, mat3Determinant(lattice), 1.0e-8);
    assertFalse(info, mat3IsSingular(lattice));
  }

  @Test
  public void testInverse() {
    double[][] inverse = mat3Inverse(lattice);
    assertNotNull(info, inverse);
    // Rows of the lattice map to unit vectors.
    double[][] identity = batchTransform(lattice, inverse);
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        assertEquals(info, i == j ? 1.0 : 0.0, identity[i][j], tolerance);
      }
    }
  }

  @Test
  public void testTranspose() {
    double[][] t = mat3Transpose(lattice);
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        assertEquals(info, lattice[i][j], t[j][i], 0.0);
      }
    }
  }

  @Test
  public void testBatchTransformIsPure() {
    double[][] points = {{0.5, 0.5, 0.5}, {0.0, 0.25, 0.75}};
    double[][] copy = MatrixMath.copyOf(points);
    double[][] cart = batchTransform(points, lattice);
    assertEquals(2, cart.length);
    for (int i = 0; i < points.length; i++) {
      assertArrayEquals(info, copy[i], points[i], 0.0);
    }
    double[][] frac = batchTransform(cart, mat3Inverse(lattice));
    for (int i = 0; i < points.length; i++) {
      assertArrayEquals(info, points[i], frac[i], tolerance);
    }
  }

  @Test
  public void testSingular() {
    double[][] flat = {lattice[0].clone(), lattice[1].clone(), lattice[0].clone()};
    assertTrue(info, mat3IsSingular(flat));
    assertNull(info, mat3Inverse(flat));
  }
}
