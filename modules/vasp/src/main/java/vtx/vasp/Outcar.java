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

import static java.lang.String.format;

import java.util.List;
import vtx.numerics.math.MatrixMath;
import vtx.utilities.ConsistencyException;

/**
 * Everything extracted from one OUTCAR: global run parameters, the header cell and species, the
 * ionic steps in order, and the vibrational modes when the run computed them.
 *
 * <p>Every per-step sequence has been validated to have one entry per ionic step.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Outcar {

  private final boolean lsorbit;
  private final int ispin;
  private final int ibrion;
  private final int nions;
  private final int nkpts;
  private final int nbands;
  private final double efermi;
  private final double[][] cell;
  private final String[] ionTypes;
  private final int[] ionsPerType;
  private final double[] ionMasses;
  private final List<IonicIteration> ionicIterations;
  private final List<VibrationalMode> vibrations;
  private final boolean[][] constraints;

  /**
   * Constructor for Outcar.
   *
   * @param lsorbit true for a spin-orbit coupled run.
   * @param ispin 1 for non spin polarized, 2 for spin polarized runs.
   * @param ibrion the ionic update algorithm.
   * @param nions the number of ions.
   * @param nkpts the number of k-points.
   * @param nbands the number of bands.
   * @param efermi the Fermi energy (eV).
   * @param cell the header lattice vectors, one per row.
   * @param ionTypes the species labels.
   * @param ionsPerType the number of ions of each species.
   * @param ionMasses the mass of every ion.
   * @param ionicIterations the ionic steps in order.
   * @param vibrations the vibrational modes, or null if none were computed.
   * @param constraints freeze flags for every ion, or null.
   */
  public Outcar(boolean lsorbit, int ispin, int ibrion, int nions, int nkpts, int nbands,
      double efermi, double[][] cell, String[] ionTypes, int[] ionsPerType, double[] ionMasses,
      List<IonicIteration> ionicIterations, List<VibrationalMode> vibrations,
      boolean[][] constraints) {
    this.lsorbit = lsorbit;
    this.ispin = ispin;
    this.ibrion = ibrion;
    this.nions = nions;
    this.nkpts = nkpts;
    this.nbands = nbands;
    this.efermi = efermi;
    this.cell = MatrixMath.copyOf(cell);
    this.ionTypes = ionTypes.clone();
    this.ionsPerType = ionsPerType.clone();
    this.ionMasses = ionMasses.clone();
    this.ionicIterations = List.copyOf(ionicIterations);
    this.vibrations = (vibrations == null) ? null : List.copyOf(vibrations);
    if (constraints != null && constraints.length != nions) {
      throw new ConsistencyException(format(
          " %d freeze flag rows were given for %d ions.", constraints.length, nions));
    }
    this.constraints = copyOf(constraints);
  }

  /**
   * Copy of this Outcar with freeze flags, usually read from the POSCAR of the run.
   *
   * @param constraints freeze flags for every ion, or null.
   * @return a new Outcar.
   * @throws ConsistencyException if the number of rows differs from the number of ions.
   */
  public Outcar withConstraints(boolean[][] constraints) {
    return new Outcar(lsorbit, ispin, ibrion, nions, nkpts, nbands, efermi, cell, ionTypes,
        ionsPerType, ionMasses, ionicIterations, vibrations, constraints);
  }

  public boolean isLsorbit() {
    return lsorbit;
  }

  public int getIspin() {
    return ispin;
  }

  public int getIbrion() {
    return ibrion;
  }

  public int getNions() {
    return nions;
  }

  public int getNkpts() {
    return nkpts;
  }

  public int getNbands() {
    return nbands;
  }

  public double getEfermi() {
    return efermi;
  }

  public double[][] getCell() {
    return MatrixMath.copyOf(cell);
  }

  public String[] getIonTypes() {
    return ionTypes.clone();
  }

  public int[] getIonsPerType() {
    return ionsPerType.clone();
  }

  /**
   * The mass of every ion.
   *
   * @return one mass per ion.
   */
  public double[] getIonMasses() {
    return ionMasses.clone();
  }

  /**
   * The species label of every ion.
   *
   * @return one label per ion.
   */
  public String[] getSymbols() {
    String[] symbols = new String[nions];
    int atom = 0;
    for (int i = 0; i < ionTypes.length; i++) {
      for (int j = 0; j < ionsPerType[i]; j++) {
        symbols[atom++] = ionTypes[i];
      }
    }
    return symbols;
  }

  /**
   * The ionic steps in order.
   *
   * @return an unmodifiable list.
   */
  public List<IonicIteration> getIonicIterations() {
    return ionicIterations;
  }

  /**
   * Check for vibrational modes.
   *
   * @return true if the run computed vibrational modes.
   */
  public boolean hasVibrations() {
    return vibrations != null;
  }

  /**
   * The vibrational modes.
   *
   * @return an unmodifiable list, or null if the run did not compute vibrations.
   */
  public List<VibrationalMode> getVibrations() {
    return vibrations;
  }

  /**
   * Freeze flags.
   *
   * @return a copy of the flags, or null.
   */
  public boolean[][] getConstraints() {
    return copyOf(constraints);
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
    StringBuilder sb = new StringBuilder("\n OUTCAR\n");
    sb.append(format("  Ions:                                %8d\n", nions));
    for (int i = 0; i < ionTypes.length; i++) {
      sb.append(format("   %-6s                              %8d\n", ionTypes[i], ionsPerType[i]));
    }
    sb.append(format("  ISPIN:                               %8d\n", ispin));
    sb.append(format("  LSORBIT:                             %8s\n", lsorbit));
    sb.append(format("  IBRION:                              %8d\n", ibrion));
    sb.append(format("  K-points:                            %8d\n", nkpts));
    sb.append(format("  Bands:                               %8d\n", nbands));
    sb.append(format("  E-fermi:                             %8.4f\n", efermi));
    sb.append(format("  Ionic steps:                         %8d\n", ionicIterations.size()));
    sb.append(format("  Vibrational modes:                   %8d",
        (vibrations == null) ? 0 : vibrations.size()));
    return sb.toString();
  }

}
