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
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.Test;
import vtx.utilities.IndexRangeException;
import vtx.utilities.VTXTest;
import vtx.vasp.parsers.FormatException;
import vtx.vasp.parsers.OutcarFilter;

/**
 * Tests the vibrational mode listing and export.
 *
 * @author Michael J. Schnieders
 */
public class VibrationsTest extends VTXTest {

  private Vibrations load() throws IOException {
    Outcar outcar = new OutcarFilter(2).readFile(getResourceFile("vtx/vasp/outcars/OUTCAR.NH3"));
    return Vibrations.fromOutcar(outcar);
  }

  @Test
  public void testListing() throws IOException {
    Vibrations vibrations = load();
    assertEquals(3, vibrations.size());
    String[] lines = vibrations.toString().split("\n");
    assertEquals(4, lines.length);
    assertTrue(lines[1].contains("3627.910256"));
    assertTrue(lines[1].endsWith("No"));
    assertTrue(lines[3].contains("0.752260"));
    assertTrue(lines[3].endsWith("Yes"));
  }

  @Test
  public void testSaveAsXsf() throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    File file = load().saveAsXsf(1, dir);
    assertEquals("mode_0001.xsf", file.getName());
    String[] lines = FileUtils.readFileToString(file, StandardCharsets.UTF_8).split("\n");
    String[] nitrogen = lines[10].trim().split("\\s+");
    assertEquals("N", nitrogen[0]);
    // Reference positions come from the first ionic step.
    assertEquals(3.5, Double.parseDouble(nitrogen[2]), 1.0e-10);
    assertEquals(0.1 / Math.sqrt(14.001), Double.parseDouble(nitrogen[6]), 1.0e-10);
  }

  @Test(expected = IndexRangeException.class)
  public void testModeOutOfRange() throws IOException {
    load().getMode(0);
  }

  @Test(expected = FormatException.class)
  public void testNoVibrations() {
    Outcar outcar = new Outcar(false, 1, 2, 1, 1, 4, 0.0,
        new double[][] {{1.0, 0.0, 0.0}, {0.0, 1.0, 0.0}, {0.0, 0.0, 1.0}}, new String[] {"H"},
        new int[] {1}, new double[] {1.0}, List.of(), null, null);
    Vibrations.fromOutcar(outcar);
  }
}
