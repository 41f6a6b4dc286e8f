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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Test;
import vtx.crystal.Structure;
import vtx.utilities.IndexRangeException;
import vtx.utilities.VTXTest;
import vtx.vasp.parsers.OutcarFilter;
import vtx.vasp.parsers.PoscarFilter;
import vtx.vasp.parsers.PoscarFormat;
import vtx.vasp.parsers.XDATCARFilter;

/**
 * Tests trajectory assembly and export.
 *
 * @author Michael J. Schnieders
 */
public class TrajectoryTest extends VTXTest {

  private static final double tolerance = 1.0e-10;

  private Outcar outcar;

  @Before
  public void setUp() throws IOException {
    outcar = new OutcarFilter(2).readFile(getResourceFile("vtx/vasp/outcars/OUTCAR.NH3"));
  }

  @Test
  public void testFromOutcar() {
    Trajectory trajectory = Trajectory.fromOutcar(outcar);
    assertEquals(3, trajectory.size());
    Structure second = trajectory.getStructure(2);
    assertEquals("Generated by VTX, ionic step 2", second.getComment());
    assertArrayEquals(new String[] {"H", "H", "H", "N"}, second.getSymbols());
    assertArrayEquals(new double[] {3.89220, 4.01520, 4.00000}, second.getCartesian()[0],
        tolerance);
    assertArrayEquals(new double[] {3.89220 / 6.0, 4.01520 / 7.0, 0.5},
        second.getFractional()[0], tolerance);
    assertArrayEquals(new double[] {-0.930834, -0.563415, 0.0}, trajectory.getForces(2)[0],
        0.0);
    assertFalse(second.hasConstraints());
  }

  @Test
  public void testConstraintsAreCarried() throws IOException {
    Structure poscar = PoscarFilter.readFile(getResourceFile("vtx/vasp/structures/POSCAR.NH3"));
    Trajectory trajectory =
        Trajectory.fromOutcar(outcar.withConstraints(poscar.getConstraints()));
    for (Structure structure : trajectory.getStructures()) {
      assertArrayEquals(poscar.getConstraints(), structure.getConstraints());
    }
  }

  @Test(expected = IndexRangeException.class)
  public void testStepOutOfRange() {
    Trajectory.fromOutcar(outcar).getStructure(4);
  }

  @Test
  public void testSaveAsXdatcar() throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    Trajectory trajectory = Trajectory.fromOutcar(outcar);
    File file = trajectory.saveAsXdatcar(dir);
    assertEquals(Trajectory.XDATCAR, file.getName());
    String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    assertEquals(text, XDATCARFilter.formatTrajectory(trajectory.getStructures()));
    String[] lines = text.split("\n");
    assertEquals("Generated by VTX, ionic step 1", lines[0]);
    assertEquals("Direct configuration=     1", lines[7]);
    assertEquals("Direct configuration=     3", lines[17]);
    // Header plus one marker and four atoms per step.
    assertEquals(7 + 3 * 5, lines.length);
  }

  @Test
  public void testSaveAsPoscars() throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    Trajectory trajectory = Trajectory.fromOutcar(outcar);
    List<File> files = trajectory.saveAsPoscars(new int[] {3, 1}, dir, PoscarFormat.DEFAULT);
    assertEquals(2, files.size());
    assertEquals("POSCAR_00003.vasp", files.get(0).getName());
    assertEquals("POSCAR_00001.vasp", files.get(1).getName());
    Structure third = PoscarFilter.readFile(files.get(0));
    assertArrayEquals(trajectory.getStructure(3).getCartesian()[0], third.getCartesian()[0],
        1.0e-12);
  }

  @Test
  public void testRangeIsCheckedBeforeWriting() throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    Trajectory trajectory = Trajectory.fromOutcar(outcar);
    try {
      trajectory.saveAsXsfs(new int[] {1, 9}, dir);
      fail(" Step 9 does not exist.");
    } catch (IndexRangeException e) {
      assertEquals(9, e.getIndex());
    }
    assertFalse(new File(dir, "step_0001.xsf").exists());
  }

  @Test
  public void testSaveAsXsf() throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    File file = Trajectory.fromOutcar(outcar).saveAsXsf(1, dir);
    assertEquals("step_0001.xsf", file.getName());
    String[] lines = FileUtils.readFileToString(file, StandardCharsets.UTF_8).split("\n");
    assertEquals("CRYSTAL", lines[0]);
    assertEquals("PRIMVEC", lines[1]);
    assertEquals("PRIMCOORD", lines[5]);
    assertEquals(" 4 1", lines[6]);
    assertTrue(lines[7].startsWith("H  "));
    String[] tokens = lines[7].trim().split("\\s+");
    assertEquals(7, tokens.length);
    assertEquals(3.8772, Double.parseDouble(tokens[1]), 1.0e-10);
    assertEquals(-0.438233, Double.parseDouble(tokens[4]), 1.0e-10);
    assertEquals(11, lines.length);
  }
}
