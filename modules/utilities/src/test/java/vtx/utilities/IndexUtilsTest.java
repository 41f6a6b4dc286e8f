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
package vtx.utilities;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

/**
 * Tests selection of items by 1-based, negative and "all" indices.
 *
 * @author Michael J. Schnieders
 */
public class IndexUtilsTest extends VTXTest {

  @Test
  public void testPositiveIndices() {
    assertArrayEquals(new int[] {0, 2, 4}, IndexUtils.selectIndices(new int[] {1, 3, 5}, 5, "step"));
  }

  @Test
  public void testNegativeIndices() {
    assertArrayEquals(new int[] {4, 3}, IndexUtils.selectIndices(new int[] {-1, -2}, 5, "step"));
  }

  @Test
  public void testZeroSelectsAll() {
    assertArrayEquals(new int[] {0, 1, 2}, IndexUtils.selectIndices(new int[] {2, 0}, 3, "step"));
  }

  @Test
  public void testDuplicatesRemoved() {
    assertArrayEquals(new int[] {2, 0}, IndexUtils.selectIndices(new int[] {3, -1, 1}, 3, "mode"));
  }

  @Test(expected = IndexRangeException.class)
  public void testIndexTooLarge() {
    IndexUtils.selectIndices(new int[] {6}, 5, "step");
  }

  @Test(expected = IndexRangeException.class)
  public void testNegativeIndexTooSmall() {
    IndexUtils.selectIndices(new int[] {-6}, 5, "step");
  }

  @Test
  public void testCheckIndex() {
    assertEquals(0, IndexUtils.checkIndex(1, 2, "mode"));
    assertEquals(1, IndexUtils.checkIndex(2, 2, "mode"));
    try {
      IndexUtils.checkIndex(0, 2, "mode");
    } catch (IndexRangeException e) {
      assertEquals(0, e.getIndex());
      assertEquals(2, e.getLength());
      return;
    }
    throw new AssertionError(" Index 0 should be rejected.");
  }
}
