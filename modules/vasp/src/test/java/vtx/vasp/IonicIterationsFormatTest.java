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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.EnumSet;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import vtx.utilities.IndexRangeException;
import vtx.utilities.VTXTest;
import vtx.vasp.IonicIterationsFormat.Column;

/**
 * Tests the relaxation progress table.
 *
 * @author Michael J. Schnieders
 */
public class IonicIterationsFormatTest extends VTXTest {

  private List<IonicIteration> iterations;

  @Before
  public void setUp() {
    double[][] cell = {{2.0, 0.0, 0.0}, {0.0, 3.0, 0.0}, {0.0, 0.0, 4.0}};
    double[][] positions = {{0.0, 0.0, 0.0}, {1.0, 1.0, 1.0}};
    IonicIteration first = new IonicIteration(7, -9.5, -10.0, 120.0, -1.0, null, positions,
        new double[][] {{3.0, 4.0, 0.0}, {0.0, 0.0, 1.0}}, cell);
    IonicIteration second = new IonicIteration(5, -9.51, -10.01, 60.0, -2.0,
        new double[] {1.5}, positions, new double[][] {{0.0, 0.0, 0.0}, {0.0, -2.0, 0.0}},
        cell);
    iterations = List.of(first, second);
  }

  @Test
  public void testDefaultTable() {
    IonicIterationsFormat table =
        new IonicIterationsFormat(iterations, null, IonicIterationsFormat.DEFAULT_COLUMNS);
    assertEquals("   Step     TOTEN_z   lgdE   Fmax Nscf    Time  Magmom", table.header());
    assertEquals("      1   -10.00000   1.00  5.000    7    2.00   NoMag", table.row(1));

    String[] second = table.row(2).trim().split("\\s+");
    assertEquals("2", second[0]);
    assertEquals(-2.0, Double.parseDouble(second[2]), 1.0e-6);
    assertEquals(2.0, Double.parseDouble(second[3]), 1.0e-6);
    assertEquals("5", second[4]);
    assertEquals("1.00", second[5]);
    assertEquals("1.500", second[6]);
    assertEquals(3, table.toString().split("\n").length);
  }

  @Test
  public void testFrozenComponentsAreIgnored() {
    boolean[][] constraints = {{true, false, true}, {true, true, true}};
    IonicIterationsFormat table = new IonicIterationsFormat(iterations, constraints,
        EnumSet.of(Column.FMAX, Column.FMAX_AXIS, Column.FMAX_INDEX));
    String[] row = table.row(1).trim().split("\\s+");
    assertEquals("3.000", row[1]);
    assertEquals("X", row[2]);
    assertEquals("1", row[3]);
  }

  @Test
  public void testOptionalColumns() {
    IonicIterationsFormat table = new IonicIterationsFormat(iterations, null,
        EnumSet.of(Column.TOTEN, Column.FMAX_AXIS, Column.FMAX_INDEX, Column.VOLUME));
    String[] row = table.row(1).trim().split("\\s+");
    assertEquals(-9.5, Double.parseDouble(row[1]), 1.0e-6);
    assertEquals("Y", row[2]);
    assertEquals("1", row[3]);
    assertEquals(24.0, Double.parseDouble(row[4]), 1.0e-6);
    assertEquals("2", table.row(2).trim().split("\\s+")[3]);
  }

  @Test
  public void testNoColumns() {
    IonicIterationsFormat table =
        new IonicIterationsFormat(iterations, null, EnumSet.noneOf(Column.class));
    assertEquals("      2", table.row(2));
    assertFalse(table.header().contains("Fmax"));
    assertTrue(table.header().contains("Step"));
  }

  @Test
  public void testStepOutOfRange() {
    IonicIterationsFormat table =
        new IonicIterationsFormat(iterations, null, IonicIterationsFormat.DEFAULT_COLUMNS);
    for (int step : new int[] {0, iterations.size() + 1}) {
      try {
        table.row(step);
        fail(" Step " + step + " should be out of range.");
      } catch (IndexRangeException e) {
        assertTrue(e.getMessage().contains("step"));
      }
    }
  }

  @Test
  public void testConstraintsAreCopied() {
    boolean[][] constraints = {{true, false, true}, {true, true, true}};
    IonicIterationsFormat table =
        new IonicIterationsFormat(iterations, constraints, EnumSet.of(Column.FMAX));
    constraints[0][1] = true;
    assertEquals("3.000", table.row(1).trim().split("\\s+")[1]);
  }

  @Test
  public void testNonCollinearMagmom() {
    double[][] cell = {{2.0, 0.0, 0.0}, {0.0, 3.0, 0.0}, {0.0, 0.0, 4.0}};
    double[][] positions = {{0.0, 0.0, 0.0}};
    double[][] forces = {{0.0, 0.0, 0.0}};
    IonicIteration magnetic = new IonicIteration(3, -1.0, -1.0, 10.0, 0.0,
        new double[] {0.1, 0.2, -0.3}, positions, forces, cell);
    IonicIteration quenched =
        new IonicIteration(3, -1.1, -1.1, 10.0, 0.0, null, positions, forces, cell);
    IonicIterationsFormat table = new IonicIterationsFormat(List.of(magnetic, quenched), null,
        EnumSet.of(Column.MAGMOM));
    assertEquals("   Step   Mag_x   Mag_y   Mag_z", table.header());
    assertEquals("      1   0.100   0.200  -0.300", table.row(1));
    assertEquals(table.header().length(), table.row(2).length());
    assertTrue(table.row(2).endsWith("NoMag"));
  }
}
