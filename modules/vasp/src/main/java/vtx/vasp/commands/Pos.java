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
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import vtx.crystal.SortAxis;
import vtx.crystal.Structure;
import vtx.utilities.IndexUtils;
import vtx.utilities.VTXCommand;
import vtx.utilities.VTXException;
import vtx.vasp.parsers.PoscarFilter;
import vtx.vasp.parsers.PoscarFormat;

/**
 * Convert, sort or split a POSCAR.
 *
 * <p>Usage:
 *
 * <p>vtx Pos [options] [POSCAR]
 */
@Command(name = "Pos", description = " Convert, sort or split a POSCAR.")
public class Pos extends VTXCommand {

  @Option(names = {"-i", "--select-indices"}, split = ",", paramLabel = "1",
      description = "Atoms to select for splitting, starting from 1. Negative values count from "
          + "the end; 0 selects all.")
  private int[] indices = {};

  @Option(names = {"-a", "--a-name"}, paramLabel = "POSCAR_A",
      description = "POSCAR written with the selected atoms.")
  private File aName = new File("POSCAR_A");

  @Option(names = {"-b", "--b-name"}, paramLabel = "POSCAR_B",
      description = "POSCAR written with the remaining atoms.")
  private File bName = new File("POSCAR_B");

  @Option(names = {"-s", "--split"}, description = "Split the POSCAR by the selected atoms.")
  private boolean split = false;

  @Option(names = {"--convert"}, description = "Rewrite the POSCAR with the output options.")
  private boolean convert = false;

  @Option(names = {"--converted"}, paramLabel = "POSCAR_new",
      description = "Path of the converted or sorted POSCAR.")
  private File converted = new File("POSCAR_new");

  @Option(names = {"--sort"}, paramLabel = "ZA",
      description = "Sort atoms within each species by these axes in priority order; a, b, c are"
          + " fractional and x, y, z cartesian.")
  private String sort = null;

  @Option(names = {"-c", "--cartesian"}, description = "Write cartesian coordinates.")
  private boolean cartesian = false;

  @Option(names = {"--no-preserve-constraints"},
      description = "Do not write selective dynamics flags.")
  private boolean noPreserveConstraints = false;

  @Option(names = {"--no-add-symbol-tags"},
      description = "Do not write species tags after each atom.")
  private boolean noAddSymbolTags = false;

  @Parameters(arity = "0..1", paramLabel = "POSCAR", description = "The POSCAR to read.")
  private File poscarFile = new File("POSCAR");

  private final List<File> written = new ArrayList<>();

  public Pos(String[] args) {
    super(args);
  }

  public List<File> getWrittenFiles() {
    return written;
  }

  @Override
  public Pos run() {
    if (!init()) {
      return this;
    }
    if (!split && !convert && sort == null) {
      logger.warning(" No operation was requested; use --convert, --sort or -s.");
      return this;
    }
    try {
      logger.info(format("\n Reading %s", poscarFile.getPath()));
      Structure structure = PoscarFilter.readFile(poscarFile);
      PoscarFormat poscarFormat =
          new PoscarFormat(!cartesian, !noPreserveConstraints, !noAddSymbolTags);

      if (sort != null) {
        structure = structure.sortByAxes(SortAxis.parse(sort));
      }
      if (convert || (sort != null && !split)) {
        PoscarFilter.writeFile(structure, converted, poscarFormat);
        written.add(converted);
      }
      if (split) {
        int[] atoms = IndexUtils.selectIndices(indices, structure.getNumberOfAtoms(), "atom");
        Structure[] halves = structure.split(atoms);
        PoscarFilter.writeFile(
            halves[0].withComment("Generated by VTX, POSCAR with selected atoms"), aName,
            poscarFormat);
        PoscarFilter.writeFile(halves[1].withComment("Generated by VTX, POSCAR complement"),
            bName, poscarFormat);
        written.add(aName);
        written.add(bName);
      }
    } catch (IOException | VTXException | IllegalArgumentException e) {
      logger.severe(format(" Pos failed for %s: %s", poscarFile.getPath(), e.getMessage()));
    }
    return this;
  }
}
