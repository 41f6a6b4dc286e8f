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

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import vtx.utilities.VTXException;
import vtx.vasp.IonicIterationsFormat;
import vtx.vasp.IonicIterationsFormat.Column;
import vtx.vasp.Outcar;
import vtx.vasp.cli.VaspCommand;

/**
 * Track the progress of a relaxation or molecular dynamics run.
 *
 * <p>Usage:
 *
 * <p>vtx Rlx [options] [OUTCAR]
 */
@Command(name = "Rlx", description = " Track the energy, forces and magnetic moment of each ionic"
    + " step. Freeze flags are read from the POSCAR.")
public class Rlx extends VaspCommand {

  @Option(names = {"-p", "--poscar"}, paramLabel = "POSCAR",
      description = "POSCAR with selective dynamics flags.")
  private File poscar = new File("POSCAR");

  @Option(names = {"-e", "--toten"}, description = "Print TOTEN in eV.")
  private boolean toten = false;

  @Option(names = {"-a", "--favg"}, description = "Print the average force in eV/A.")
  private boolean favg = false;

  @Option(names = {"-x", "--fmaxis"},
      description = "Print the axis of the largest component of the strongest force.")
  private boolean fmaxAxis = false;

  @Option(names = {"-i", "--fmidx"},
      description = "Print the index of the ion with the strongest force, starting from 1.")
  private boolean fmaxIndex = false;

  @Option(names = {"-v", "--volume"}, description = "Print the cell volume in A^3.")
  private boolean volume = false;

  @Option(names = {"--no-fmax"}, description = "Do not print the maximum force.")
  private boolean noFmax = false;

  @Option(names = {"--no-totenz"}, description = "Do not print the energy without entropy.")
  private boolean noTotenZ = false;

  @Option(names = {"--no-lgde"}, description = "Do not print log10 of the energy change.")
  private boolean noLog10dE = false;

  @Option(names = {"--no-magmom"}, description = "Do not print the magnetic moment.")
  private boolean noMagmom = false;

  @Option(names = {"--no-nscf"}, description = "Do not print the number of SCF steps.")
  private boolean noNscf = false;

  @Option(names = {"--no-time"}, description = "Do not print the time of each step in minutes.")
  private boolean noTime = false;

  @Parameters(arity = "0..1", paramLabel = "OUTCAR", description = "The OUTCAR to read.")
  private File outcarFile = new File("OUTCAR");

  private String table;

  public Rlx(String[] args) {
    super(args);
  }

  /**
   * The formatted table of the last run.
   *
   * @return the table, or null.
   */
  public String getTable() {
    return table;
  }

  /**
   * The columns selected on the command line.
   *
   * @return the columns.
   */
  public Set<Column> getColumns() {
    Set<Column> columns = EnumSet.noneOf(Column.class);
    if (toten) {
      columns.add(Column.TOTEN);
    }
    if (!noTotenZ) {
      columns.add(Column.TOTEN_Z);
    }
    if (!noLog10dE) {
      columns.add(Column.LOG10_DE);
    }
    if (favg) {
      columns.add(Column.FAVG);
    }
    if (!noFmax) {
      columns.add(Column.FMAX);
    }
    if (fmaxAxis) {
      columns.add(Column.FMAX_AXIS);
    }
    if (fmaxIndex) {
      columns.add(Column.FMAX_INDEX);
    }
    if (!noNscf) {
      columns.add(Column.NSCF);
    }
    if (!noTime) {
      columns.add(Column.TIME);
    }
    if (volume) {
      columns.add(Column.VOLUME);
    }
    if (!noMagmom) {
      columns.add(Column.MAGMOM);
    }
    return columns;
  }

  @Override
  public Rlx run() {
    if (!init()) {
      return this;
    }
    try {
      Outcar outcar = readOutcar(outcarFile, poscar);
      table = IonicIterationsFormat.fromOutcar(outcar, getColumns()).toString();
      logger.info(format("\n%s", table));
    } catch (IOException | VTXException e) {
      logger.severe(format(" Rlx failed for %s: %s", outcarFile.getPath(), e.getMessage()));
    }
    return this;
  }
}
