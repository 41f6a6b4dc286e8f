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

import java.util.Arrays;
import vtx.numerics.math.MatrixMath;

/**
 * The result of one ionic step: energies, electronic iteration count, timing, pressure, optional
 * magnetic moment, the positions and forces of every ion, and the cell of the step.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IonicIteration {

  private final int nscf;
  private final double toten;
  private final double totenZ;
  private final double cputime;
  private final double stress;
  private final double[] magmom;
  private final double[][] positions;
  private final double[][] forces;
  private final double[][] cell;

  /**
   * Constructor for IonicIteration.
   *
   * @param nscf the number of electronic (self-consistent) iterations of the step.
   * @param toten free energy TOTEN (eV).
   * @param totenZ energy extrapolated to sigma 0 (eV).
   * @param cputime wall time of the step (s).
   * @param stress external pressure (kB).
   * @param magmom the magnetic moment (1 or 3 components), or null.
   * @param positions cartesian positions (one row per ion).
   * @param forces forces (one row per ion).
   * @param cell the lattice vectors of the step, one per row.
   */
  public IonicIteration(int nscf, double toten, double totenZ, double cputime, double stress,
      double[] magmom, double[][] positions, double[][] forces, double[][] cell) {
    this.nscf = nscf;
    this.toten = toten;
    this.totenZ = totenZ;
    this.cputime = cputime;
    this.stress = stress;
    this.magmom = (magmom == null) ? null : magmom.clone();
    this.positions = MatrixMath.copyOf(positions);
    this.forces = MatrixMath.copyOf(forces);
    this.cell = MatrixMath.copyOf(cell);
  }

  public int getNscf() {
    return nscf;
  }

  public double getToten() {
    return toten;
  }

  public double getTotenZ() {
    return totenZ;
  }

  public double getCputime() {
    return cputime;
  }

  public double getStress() {
    return stress;
  }

  /**
   * The magnetic moment.
   *
   * @return a copy of the moment, or null for a non-magnetic calculation.
   */
  public double[] getMagmom() {
    return (magmom == null) ? null : magmom.clone();
  }

  public double[][] getPositions() {
    return MatrixMath.copyOf(positions);
  }

  public double[][] getForces() {
    return MatrixMath.copyOf(forces);
  }

  public double[][] getCell() {
    return MatrixMath.copyOf(cell);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" TOTEN %16.8f TOTEN_z %16.8f nscf %4d time %10.4f pressure %8.2f magmom %s",
        toten, totenZ, nscf, cputime, stress,
        (magmom == null) ? "none" : Arrays.toString(magmom));
  }
}
