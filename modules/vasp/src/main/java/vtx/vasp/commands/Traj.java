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
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import vtx.utilities.VTXException;
import vtx.vasp.Outcar;
import vtx.vasp.Trajectory;
import vtx.vasp.cli.SelectionOptions;
import vtx.vasp.cli.VaspCommand;
import vtx.vasp.parsers.PoscarFormat;

/**
 * Export the structures of an ionic run.
 *
 * <p>Usage:
 *
 * <p>vtx Traj [options] [OUTCAR]
 */
@Command(name = "Traj", description = " Export the structures visited by a relaxation or"
    + " molecular dynamics run as XDATCAR, POSCAR or XSF files.")
public class Traj extends VaspCommand {

  @Mixin
  private SelectionOptions selectionOptions = new SelectionOptions();

  @Option(names = {"-p", "--poscar"}, paramLabel = "POSCAR",
      description = "POSCAR with selective dynamics flags.")
  private File poscar = new File("POSCAR");

  @Option(names = {"-d", "--save-as-xdatcar"}, description = "Save the whole trajectory as XDATCAR.")
  private boolean xdatcar = false;

  @Option(names = {"-s", "--save-as-poscar"}, description = "Save the selected steps as POSCARs.")
  private boolean poscars = false;

  @Option(names = {"-x", "--save-as-xsf"},
      description = "Save the selected steps, with forces, as XSF files.")
  private boolean xsfs = false;

  @Option(names = {"--cartesian"}, description = "Write POSCARs in cartesian coordinates.")
  private boolean cartesian = false;

  @Option(names = {"--no-preserve-constraints"},
      description = "Do not write selective dynamics flags.")
  private boolean noPreserveConstraints = false;

  @Option(names = {"--no-add-symbol-tags"},
      description = "Do not write species tags after each atom.")
  private boolean noAddSymbolTags = false;

  @Parameters(arity = "0..1", paramLabel = "OUTCAR", description = "The OUTCAR to read.")
  private File outcarFile = new File("OUTCAR");

  private final List<File> written = new ArrayList<>();

  public Traj(String[] args) {
    super(args);
  }

  /**
   * Files written by the last run.
   *
   * @return the files.
   */
  public List<File> getWrittenFiles() {
    return written;
  }

  @Override
  public Traj run() {
    if (!init()) {
      return this;
    }
    if (!xdatcar && !poscars && !xsfs) {
      logger.warning(" No output was requested; use -d, -s or -x.");
      return this;
    }
    try {
      Outcar outcar = readOutcar(outcarFile, poscar);
      Trajectory trajectory = Trajectory.fromOutcar(outcar);
      logger.info(format(" The trajectory has %d steps.", trajectory.size()));
      File directory = selectionOptions.getSaveDirectory();
      if (xdatcar) {
        written.add(trajectory.saveAsXdatcar(directory));
      }
      if (poscars || xsfs) {
        int[] steps = selectionOptions.getIndices(trajectory.size(), "step");
        if (poscars) {
          PoscarFormat poscarFormat =
              new PoscarFormat(!cartesian, !noPreserveConstraints, !noAddSymbolTags);
          written.addAll(trajectory.saveAsPoscars(steps, directory, poscarFormat));
        }
        if (xsfs) {
          written.addAll(trajectory.saveAsXsfs(steps, directory));
        }
      }
    } catch (IOException | VTXException e) {
      logger.severe(format(" Traj failed for %s: %s", outcarFile.getPath(), e.getMessage()));
    }
    return this;
  }
}
