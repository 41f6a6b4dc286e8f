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

import static org.junit.Assert.assertEquals;

import java.util.List;
import org.junit.Test;
import vtx.crystal.Cell;
import vtx.crystal.Structure;
import vtx.utilities.ConsistencyException;
import vtx.utilities.VTXTest;

/**
 * Tests the XDATCAR and XSF writers.
 *
 * @author Michael J. Schnieders
 */
public class XDATCARFilterTest extends VTXTest {

  private static final Cell CUBE =
      new Cell(new double[][] {{2.0, 0.0, 0.0}, {0.0, 2.0, 0.0}, {0.0, 0.0, 2.0}});

  private static Structure structure(String[] types, int[] counts, double[][] frac) {
    return Structure.fromFractional("frame", CUBE, types, counts, frac, null);
  }

  @Test
  public void testFrames() {
    Structure a = structure(new String[] {"Si"}, new int[] {1}, new double[][] {{0.0, 0.0, 0.0}});
    Structure b = structure(new String[] {"Si"}, new int[] {1}, new double[][] {{0.5, 0.5, 0.5}});
    String[] lines = XDATCARFilter.formatTrajectory(List.of(a, b)).split("\n");
    assertEquals(11, lines.length);
    assertEquals("    Si", lines[5]);
    assertEquals("     1", lines[6]);
    assertEquals("Direct configuration=     2", lines[9]);
    assertEquals("  0.5000000000000000  0.5000000000000000  0.5000000000000000", lines[10]);
  }

  @Test(expected = ConsistencyException.class)
  public void testEmptyTrajectory() {
    XDATCARFilter.formatTrajectory(List.of());
  }

  @Test(expected = ConsistencyException.class)
  public void testSpeciesChange() {
    Structure a = structure(new String[] {"Si"}, new int[] {1}, new double[][] {{0.0, 0.0, 0.0}});
    Structure b = structure(new String[] {"Ge"}, new int[] {1}, new double[][] {{0.0, 0.0, 0.0}});
    XDATCARFilter.formatTrajectory(List.of(a, b));
  }

  @Test(expected = ConsistencyException.class)
  public void testXsfVectorMismatch() {
    XSFFilter.formatCrystal(CUBE.getScaledLattice(), new String[] {"Si", "Si"},
        new double[][] {{0.0, 0.0, 0.0}, {1.0, 1.0, 1.0}}, new double[][] {{0.0, 0.0, 0.0}});
  }
}
