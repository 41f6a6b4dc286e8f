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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.EnumSet;
import org.apache.commons.io.FileUtils;
import org.junit.Test;
import vtx.utilities.VTXTest;
import vtx.vasp.IonicIterationsFormat.Column;

/**
 * Tests the Rlx command.
 *
 * @author Michael J. Schnieders
 */
public class RlxTest extends VTXTest {

  private File copyRun(boolean withPoscar) throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    FileUtils.copyFile(getResourceFile("vtx/vasp/outcars/OUTCAR.NH3"), new File(dir, "OUTCAR"));
    if (withPoscar) {
      FileUtils.copyFile(getResourceFile("vtx/vasp/structures/POSCAR.NH3"),
          new File(dir, "POSCAR"));
    }
    return dir;
  }

  @Test
  public void testDefaultColumns() throws IOException {
    File dir = copyRun(true);
    Rlx rlx = new Rlx(new String[] {"-p", new File(dir, "POSCAR").getPath(),
        new File(dir, "OUTCAR").getPath()});
    rlx.run();
    String table = rlx.getTable();
    assertNotNull(table);
    String[] lines = table.split("\n");
    assertEquals(4, lines.length);
    assertTrue(lines[0].contains("TOTEN_z"));
    assertTrue(lines[1].contains("-19.26937"));
    assertTrue(lines[3].endsWith("NoMag"));
  }

  @Test
  public void testColumnOptions() {
    Rlx rlx = new Rlx(new String[] {"-e", "-a", "-x", "-i", "-v", "--no-fmax", "--no-totenz",
        "--no-lgde", "--no-magmom", "--no-nscf", "--no-time"});
    assertTrue(rlx.init());
    assertEquals(EnumSet.of(Column.TOTEN, Column.FAVG, Column.FMAX_AXIS,
        Column.FMAX_INDEX, Column.VOLUME), rlx.getColumns());
  }

  @Test
  public void testContcarFallback() throws IOException {
    File dir = copyRun(false);
    FileUtils.copyFile(getResourceFile("vtx/vasp/structures/POSCAR.NH3"),
        new File(dir, "CONTCAR"));
    Rlx rlx = new Rlx(new String[] {"-i", "-p", new File(dir, "POSCAR").getPath(),
        new File(dir, "OUTCAR").getPath()});
    rlx.run();
    // The third hydrogen is frozen, so the strongest free force moves to the second.
    String[] lastRow = rlx.getTable().split("\n")[3].trim().split("\\s+");
    assertEquals("2", lastRow[4]);
  }

  @Test
  public void testMissingPoscar() throws IOException {
    File dir = copyRun(false);
    Rlx rlx = new Rlx(new String[] {"-i", "-p", new File(dir, "POSCAR").getPath(),
        new File(dir, "OUTCAR").getPath()});
    rlx.run();
    String[] lastRow = rlx.getTable().split("\n")[3].trim().split("\\s+");
    assertEquals("3", lastRow[4]);
  }

  @Test
  public void testMissingOutcar() throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    Rlx rlx = new Rlx(new String[] {new File(dir, "OUTCAR").getPath()});
    rlx.run();
    assertNull(rlx.getTable());
  }

  @Test
  public void testHelp() {
    Rlx rlx = new Rlx(new String[] {"-h"});
    assertFalse(rlx.init());
    assertTrue(rlx.helpString().contains("--no-magmom"));
  }
}
