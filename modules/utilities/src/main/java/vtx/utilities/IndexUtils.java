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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Selection of items by user supplied index lists.
 *
 * <p>User indices are 1-based, a negative index counts back from the end (-1 is the last item)
 * and 0 selects every item.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class IndexUtils {

  /** Prevent instantiation. */
  private IndexUtils() {
  }

  /**
   * Convert user indices into distinct 0-based indices, preserving their order.
   *
   * @param indices the user indices.
   * @param length the number of selectable items.
   * @param what the kind of item, used in error messages.
   * @return 0-based indices.
   * @throws IndexRangeException if an index is larger than length or smaller than -length.
   */
  public static int[] selectIndices(int[] indices, int length, String what) {
    Set<Integer> selected = new LinkedHashSet<>();
    for (int index : indices) {
      if (index == 0) {
        int[] all = new int[length];
        for (int i = 0; i < length; i++) {
          all[i] = i;
        }
        return all;
      }
      if (index > length || index < -length) {
        throw new IndexRangeException(what, index, length);
      }
      selected.add(index > 0 ? index - 1 : length + index);
    }
    return selected.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Check a 1-based index against a sequence length.
   *
   * @param index the 1-based index.
   * @param length the number of items.
   * @param what the kind of item, used in error messages.
   * @return the corresponding 0-based index.
   * @throws IndexRangeException if index is not in [1, length].
   */
  public static int checkIndex(int index, int length, String what) {
    if (index < 1 || index > length) {
      throw new IndexRangeException(what, index, length);
    }
    return index - 1;
  }
}
