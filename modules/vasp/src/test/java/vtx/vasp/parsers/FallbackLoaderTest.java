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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import vtx.crystal.Structure;
import vtx.utilities.ConsistencyException;
import vtx.utilities.VTXTest;

/**
 * Tests ordered fallback between loaders.
 *
 * @author Michael J. Schnieders
 */
public class FallbackLoaderTest extends VTXTest {

  @Test
  public void testFirstSuccessWins() throws IOException {
    List<String> tried = new ArrayList<>();
    String result = new FallbackLoader<String>()
        .add("first", () -> {
          tried.add("first");
          throw new FileNotFoundException("first");
        })
        .add("second", () -> {
          tried.add("second");
          return "second";
        })
        .add("third", () -> {
          tried.add("third");
          return "third";
        })
        .load();
    assertEquals("second", result);
    assertEquals(List.of("first", "second"), tried);
  }

  @Test
  public void testLastFailureIsThrown() throws IOException {
    IOException last = new IOException("last");
    try {
      new FallbackLoader<String>()
          .add("first", () -> {
            throw new ConsistencyException("first");
          })
          .add("second", () -> {
            throw last;
          })
          .load();
      fail(" Every loader failed.");
    } catch (IOException e) {
      assertSame(last, e);
    }
  }

  @Test(expected = ConsistencyException.class)
  public void testLastVTXFailureIsThrown() throws IOException {
    new FallbackLoader<String>()
        .add("first", () -> {
          throw new IOException("first");
        })
        .add("second", () -> {
          throw new ConsistencyException("second");
        })
        .load();
  }

  @Test(expected = IllegalStateException.class)
  public void testNoLoaders() throws IOException {
    new FallbackLoader<String>().load();
  }

  @Test
  public void testPoscarThenContcar() throws IOException {
    File dir = registerTemporaryDirectory().toFile();
    File contcar = getResourceFile("vtx/vasp/structures/POSCAR.NH3");
    Structure structure = new FallbackLoader<Structure>()
        .add("POSCAR", () -> PoscarFilter.readFile(new File(dir, "POSCAR")))
        .add("CONTCAR", () -> PoscarFilter.readFile(contcar))
        .load();
    assertEquals("NH3 in a box", structure.getComment());
  }
}
