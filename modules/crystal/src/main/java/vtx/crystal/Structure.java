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
package vtx.crystal;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.apache.commons.lang3.ArrayUtils;
import vtx.numerics.math.MatrixMath;
import vtx.utilities.ConsistencyException;
import vtx.utilities.IndexRangeException;

/**
 * A periodic structure: a Cell, atoms grouped into contiguous species blocks, their cartesian and
 * fractional coordinates, and optional per-atom freeze flags.
 *
 * <p>Atom i belongs to the species whose block, given by the cumulative species counts, contains
 * i. Cartesian and fractional coordinates are always consistent with each other through the
 * Cell. Freeze flags follow the selective dynamics convention: true means the coordinate may
 * move, false means it is frozen.
 *
 * <p>Instances are immutable; every operation returns a new Structure.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Structure {

  private static final Logger logger = Logger.getLogger(Structure.class.getName());

  private final String comment;
  private final Cell cell;
  private final String[] ionTypes;
  private final int[] ionsPerType;
  private final double[][] cartesian;
  private final double[][] fractional;
  private final boolean[][] constraints;

  private Structure(String comment, Cell cell, String[] ionTypes, int[] ionsPerType,
      double[][] cartesian, double[][] fractional, boolean[][] constraints) {
    this.comment = (comment == null) ? "" : comment;
    this.cell = cell;
    this.ionTypes = ionTypes.clone();
    this.ionsPerType = ionsPerType.clone();
    this.cartesian = cartesian;
    this.fractional = fractional;
    this.constraints = copyOf(constraints);
    checkConsistency();
  }

  /**
   * Create a Structure from cartesian coordinates; fractional coordinates are derived from the
   * Cell.
   *
   * @param comment a one line description.
   * @param cell the Cell.
   * @param ionTypes the species labels, in block order.
   * @param ionsPerType the number of atoms of each species.
   * @param cartesian Nx3 cartesian coordinates.
   * @param constraints Nx3 freeze flags, or null.
   * @return the Structure.
   * @throws GeometryException if the Cell is singular.
   * @throws ConsistencyException if the atom counts disagree.
   */
  public static Structure fromCartesian(String comment, Cell cell, String[] ionTypes,
      int[] ionsPerType, double[][] cartesian, boolean[][] constraints) {
    double[][] cart = MatrixMath.copyOf(cartesian);
    return new Structure(comment, cell, ionTypes, ionsPerType, cart, cell.toFractional(cart),
        constraints);
  }

  /**
   * Create a Structure from fractional coordinates; cartesian coordinates are derived from the
   * Cell.
   *
   * @param comment a one line description.
   * @param cell the Cell.
   * @param ionTypes the species labels, in block order.
   * @param ionsPerType the number of atoms of each species.
   * @param fractional Nx3 fractional coordinates.
   * @param constraints Nx3 freeze flags, or null.
   * @return the Structure.
   * @throws GeometryException if the Cell is singular.
   * @throws ConsistencyException if the atom counts disagree.
   */
  public static Structure fromFractional(String comment, Cell cell, String[] ionTypes,
      int[] ionsPerType, double[][] fractional, boolean[][] constraints) {
    cell.checkInvertible();
    double[][] frac = MatrixMath.copyOf(fractional);
    return new Structure(comment, cell, ionTypes, ionsPerType, cell.toCartesian(frac), frac,
        constraints);
  }

  private void checkConsistency() {
    if (ionTypes.length != ionsPerType.length) {
      throw new ConsistencyException(format(
          " %d species labels were given for %d species counts.", ionTypes.length,
          ionsPerType.length));
    }
    int n = 0;
    for (int i = 0; i < ionsPerType.length; i++) {
      if (ionsPerType[i] <= 0) {
        throw new ConsistencyException(format(" Species %s has a non-positive count %d.",
            ionTypes[i], ionsPerType[i]));
      }
      n += ionsPerType[i];
    }
    if (cartesian.length != n || fractional.length != n) {
      throw new ConsistencyException(format(
          " The species counts sum to %d atoms, but %d positions were given.", n,
          cartesian.length));
    }
    for (double[] row : cartesian) {
      if (row.length != 3) {
        throw new ConsistencyException(" Each position requires three coordinates.");
      }
    }
    if (constraints != null) {
      if (constraints.length != n) {
        throw new ConsistencyException(format(
            " %d freeze flag rows were given for %d atoms.", constraints.length, n));
      }
      for (boolean[] row : constraints) {
        if (row.length != 3) {
          throw new ConsistencyException(" Each freeze flag row requires three flags.");
        }
      }
    }
  }

  /**
   * The comment line.
   *
   * @return the comment.
   */
  public String getComment() {
    return comment;
  }

  /**
   * The Cell.
   *
   * @return the Cell.
   */
  public Cell getCell() {
    return cell;
  }

  /**
   * The species labels, in block order.
   *
   * @return a copy of the labels.
   */
  public String[] getIonTypes() {
    return ionTypes.clone();
  }

  /**
   * The number of atoms of each species.
   *
   * @return a copy of the counts.
   */
  public int[] getIonsPerType() {
    return ionsPerType.clone();
  }

  /**
   * The total number of atoms.
   *
   * @return the sum of the species counts.
   */
  public int getNumberOfAtoms() {
    return cartesian.length;
  }

  /**
   * The species label of every atom.
   *
   * @return one label per atom.
   */
  public String[] getSymbols() {
    String[] symbols = new String[cartesian.length];
    int atom = 0;
    for (int i = 0; i < ionTypes.length; i++) {
      for (int j = 0; j < ionsPerType[i]; j++) {
        symbols[atom++] = ionTypes[i];
      }
    }
    return symbols;
  }

  /**
   * Cartesian coordinates.
   *
   * @return a copy of the Nx3 cartesian coordinates.
   */
  public double[][] getCartesian() {
    return MatrixMath.copyOf(cartesian);
  }

  /**
   * Fractional coordinates.
   *
   * @return a copy of the Nx3 fractional coordinates.
   */
  public double[][] getFractional() {
    return MatrixMath.copyOf(fractional);
  }

  /**
   * Check for freeze flags.
   *
   * @return true if this Structure carries freeze flags.
   */
  public boolean hasConstraints() {
    return constraints != null;
  }

  /**
   * Freeze flags.
   *
   * @return a copy of the Nx3 freeze flags, or null.
   */
  public boolean[][] getConstraints() {
    return copyOf(constraints);
  }

  /**
   * Volume of the Cell.
   *
   * @return the volume.
   */
  public double getVolume() {
    return cell.getVolume();
  }

  /**
   * Copy of this Structure with a new comment.
   *
   * @param comment the new comment.
   * @return a new Structure.
   */
  public Structure withComment(String comment) {
    return new Structure(comment, cell, ionTypes, ionsPerType, cartesian, fractional,
        constraints);
  }

  /**
   * Copy of this Structure with new freeze flags.
   *
   * @param constraints Nx3 freeze flags, or null to remove them.
   * @return a new Structure.
   * @throws ConsistencyException if the number of rows differs from the number of atoms.
   */
  public Structure withConstraints(boolean[][] constraints) {
    return new Structure(comment, cell, ionTypes, ionsPerType, cartesian, fractional,
        constraints);
  }

  /**
   * Split this Structure into the selected atoms and their complement.
   *
   * <p>Selected indices are sorted and duplicates removed, so both halves keep contiguous species
   * blocks in the original species order. Species without atoms in a half are dropped from it.
   *
   * @param indices 0-based atom indices.
   * @return two Structures: the selected atoms and the remaining atoms.
   * @throws IndexRangeException if an index is not a valid atom index.
   * @throws ConsistencyException if the selection is empty or contains every atom.
   */
  public Structure[] split(int[] indices) {
    int n = getNumberOfAtoms();
    TreeSet<Integer> selected = new TreeSet<>();
    for (int index : indices) {
      if (index < 0 || index >= n) {
        throw new IndexRangeException("atom", index, n);
      }
      selected.add(index);
    }
    if (selected.isEmpty()) {
      throw new ConsistencyException(" At least one atom must be selected to split a structure.");
    }
    if (selected.size() == n) {
      throw new ConsistencyException(
          " Every atom was selected; the complement of the split would be empty.");
    }

    int[] species = speciesOfAtoms();
    List<Integer> inside = new ArrayList<>(selected);
    List<Integer> outside = new ArrayList<>(n - selected.size());
    for (int i = 0; i < n; i++) {
      if (!selected.contains(i)) {
        outside.add(i);
      }
    }
    logger.fine(format(" Splitting %d atoms into %d selected and %d remaining.", n,
        inside.size(), outside.size()));
    return new Structure[] {subset(inside, species), subset(outside, species)};
  }

  /**
   * Build a Structure from a sorted list of atom indices.
   */
  private Structure subset(List<Integer> atoms, int[] species) {
    int m = atoms.size();
    int[] counts = new int[ionTypes.length];
    double[][] cart = new double[m][];
    double[][] frac = new double[m][];
    boolean[][] flags = (constraints == null) ? null : new boolean[m][];
    for (int k = 0; k < m; k++) {
      int atom = atoms.get(k);
      counts[species[atom]]++;
      cart[k] = cartesian[atom].clone();
      frac[k] = fractional[atom].clone();
      if (flags != null) {
        flags[k] = constraints[atom].clone();
      }
    }
    List<String> types = new ArrayList<>();
    List<Integer> typeCounts = new ArrayList<>();
    for (int i = 0; i < counts.length; i++) {
      if (counts[i] > 0) {
        types.add(ionTypes[i]);
        typeCounts.add(counts[i]);
      }
    }
    return new Structure(comment, cell, types.toArray(new String[0]),
        ArrayUtils.toPrimitive(typeCounts.toArray(new Integer[0])), cart, frac, flags);
  }

  /**
   * Stable sort of the atoms inside each species block by a composite coordinate key.
   *
   * <p>The first axis has the highest priority. Species blocks themselves are never reordered, and
   * one permutation is applied to cartesian coordinates, fractional coordinates and freeze flags.
   *
   * @param axes the sort axes in priority order.
   * @return a new, sorted Structure.
   */
  public Structure sortByAxes(SortAxis... axes) {
    if (axes == null || axes.length == 0) {
      throw new IllegalArgumentException(" At least one sort axis is required.");
    }
    Comparator<Integer> comparator = null;
    for (SortAxis axis : axes) {
      double[][] keys = axis.fractional ? fractional : cartesian;
      Comparator<Integer> next = Comparator.comparingDouble(i -> keys[i][axis.component]);
      comparator = (comparator == null) ? next : comparator.thenComparing(next);
    }

    int n = getNumberOfAtoms();
    Integer[] permutation = new Integer[n];
    for (int i = 0; i < n; i++) {
      permutation[i] = i;
    }
    int start = 0;
    for (int count : ionsPerType) {
      // Arrays.sort on objects is a stable merge sort.
      Arrays.sort(permutation, start, start + count, comparator);
      start += count;
    }

    double[][] cart = new double[n][];
    double[][] frac = new double[n][];
    boolean[][] flags = (constraints == null) ? null : new boolean[n][];
    for (int i = 0; i < n; i++) {
      int from = permutation[i];
      cart[i] = cartesian[from].clone();
      frac[i] = fractional[from].clone();
      if (flags != null) {
        flags[i] = constraints[from].clone();
      }
    }
    return new Structure(comment, cell, ionTypes, ionsPerType, cart, frac, flags);
  }

  /**
   * The species index of every atom.
   */
  private int[] speciesOfAtoms() {
    int[] species = new int[getNumberOfAtoms()];
    int atom = 0;
    for (int i = 0; i < ionsPerType.length; i++) {
      for (int j = 0; j < ionsPerType[i]; j++) {
        species[atom++] = i;
      }
    }
    return species;
  }

  private static boolean[][] copyOf(boolean[][] flags) {
    if (flags == null) {
      return null;
    }
    boolean[][] copy = new boolean[flags.length][];
    for (int i = 0; i < flags.length; i++) {
      copy[i] = flags[i].clone();
    }
    return copy;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" %s\n", comment));
    sb.append(format("  Atoms:                               %8d\n", getNumberOfAtoms()));
    for (int i = 0; i < ionTypes.length; i++) {
      sb.append(format("   %-6s                              %8d\n", ionTypes[i], ionsPerType[i]));
    }
    sb.append(format("  Selective dynamics:                  %8s", hasConstraints()));
    sb.append(cell);
    return sb.toString();
  }
}
