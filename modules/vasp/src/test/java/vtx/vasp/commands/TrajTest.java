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
package vtx.vasp.commands;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Test;
import vtx.crystal.Structure;
import vtx.utilities.VTXTest;
import vtx.vasp.parsers.PoscarFilter;

/**
 * Tests the Traj command.
 *
 * @author Michael J. Schnieders
 */
public class TrajTest extends VTXTest {

  private File dir;
  private String outcar;
  private String poscar;

  @Before
  public void copyRun() throws IOException {
    dir = registerTemporaryDirectory().toFile();
    File outcarFile = new File(dir, "OUTCAR");
    File poscarFile = new File(dir, "POSCAR");
    FileUtils.copyFile(getResourceFile("vtx/vasp/outcars/OUTCAR.NH3"), outcarFile);
    FileUtils.copyFile(getResourceFile("vtx/vasp/structures/POSCAR.NH3"), poscarFile);
    outcar = outcarFile.getPath();
    poscar = poscarFile.getPath();
  }

  @Test
  public void testSaveAll() throws IOException {
    File out = new File(dir, "frames");
    Traj traj = new Traj(new String[] {"-d", "-s", "-x", "-i", "0", "--save-in", out.getPath(),
        "-p", poscar, outcar});
    traj.run();
    assertEquals(7, traj.getWrittenFiles().size());
    assertTrue(new File(out, "XDATCAR").exists());
    assertTrue(new File(out, "POSCAR_00002.vasp").exists());
    assertTrue(new File(out, "step_0003.xsf").exists());

    Structure second = PoscarFilter.readFile(new File(out, "POSCAR_00002.vasp"));
    assertTrue(second.hasConstraints());
    assertArrayEquals(new boolean[] {false, false, false}, second.getConstraints()[2]);
  }

  @Test
  public void testDefaultSelectionIsLastStep() {
    Traj traj = new Traj(new String[] {"-s", "--save-in", dir.getPath(), "-p", poscar, outcar});
    traj.run();
    assertEquals(1, traj.getWrittenFiles().size());
    assertEquals("POSCAR_00003.vasp", traj.getWrittenFiles().get(0).getName());
  }

  @Test
  public void testFormatOptions() throws IOException {
    Traj traj = new Traj(new String[] {"-s", "-i", "1", "--cartesian",
        "--no-preserve-constraints", "--no-add-symbol-tags", "--save-in", dir.getPath(),
        "-p", poscar, outcar});
    traj.run();
    String text = FileUtils.readFileToString(traj.getWrittenFiles().get(0),
        StandardCharsets.UTF_8);
    assertTrue(text.contains("Cartesian"));
    assertFalse(text.contains("Selective"));
    assertFalse(text.contains("!"));
  }

  @Test
  public void testStepOutOfRange() {
    Traj traj = new Traj(new String[] {"-s", "-i", "9", "--save-in", dir.getPath(),
        "-p", poscar, outcar});
    traj.run();
    assertTrue(traj.getWrittenFiles().isEmpty());
  }

  @Test
  public void testNoOutputRequested() {
    Traj traj = new Traj(new String[] {outcar});
    traj.run();
    assertTrue(traj.getWrittenFiles().isEmpty());
  }
}
