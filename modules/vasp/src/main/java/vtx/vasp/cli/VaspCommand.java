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
package vtx.vasp.cli;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import org.apache.commons.configuration2.CompositeConfiguration;
import vtx.crystal.Structure;
import vtx.utilities.PropertyUtils;
import vtx.utilities.VTXCommand;
import vtx.utilities.VTXException;
import vtx.vasp.Outcar;
import vtx.vasp.parsers.FallbackLoader;
import vtx.vasp.parsers.OutcarFilter;
import vtx.vasp.parsers.PoscarFilter;

/**
 * Base class for commands that read VASP output.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class VaspCommand extends VTXCommand {

  /** Structure file read after the given POSCAR when looking for freeze flags. */
  public static final String CONTCAR = "CONTCAR";

  /**
   * Properties loaded for the most recent input file.
   */
  protected CompositeConfiguration properties;

  /**
   * Create a VaspCommand using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public VaspCommand(String[] args) {
    super(args);
  }

  /**
   * Read an OUTCAR, using the properties found next to it.
   *
   * @param outcarFile the OUTCAR.
   * @return the parsed Outcar.
   * @throws IOException if the file cannot be read.
   */
  public Outcar readOutcar(File outcarFile) throws IOException {
    properties = PropertyUtils.loadProperties(outcarFile);
    logger.info(format("\n Parsing %s", outcarFile.getPath()));
    Outcar outcar = new OutcarFilter(properties).readFile(outcarFile);
    logger.fine(outcar.toString());
    return outcar;
  }

  /**
   * Read an OUTCAR and attach freeze flags from a POSCAR, falling back to the CONTCAR in the same
   * directory. A missing or unreadable structure file only produces a warning.
   *
   * @param outcarFile the OUTCAR.
   * @param poscarFile the POSCAR holding selective dynamics flags.
   * @return the parsed Outcar.
   * @throws IOException if the OUTCAR cannot be read.
   */
  public Outcar readOutcar(File outcarFile, File poscarFile) throws IOException {
    Outcar outcar = readOutcar(outcarFile);
    File contcarFile = new File(poscarFile.getAbsoluteFile().getParentFile(), CONTCAR);
    FallbackLoader<Structure> loader = new FallbackLoader<Structure>()
        .add(poscarFile.getPath(), () -> PoscarFilter.readFile(poscarFile))
        .add(contcarFile.getPath(), () -> PoscarFilter.readFile(contcarFile));
    Structure structure;
    try {
      structure = loader.load();
    } catch (IOException | VTXException e) {
      logger.warning(format(" Reading constraints from %s failed: %s", poscarFile.getPath(),
          e.getMessage()));
      return outcar;
    }
    if (structure.hasConstraints()) {
      try {
        return outcar.withConstraints(structure.getConstraints());
      } catch (VTXException e) {
        logger.warning(format(" Constraints of %s do not match the OUTCAR: %s",
            poscarFile.getPath(), e.getMessage()));
      }
    }
    return outcar;
  }
}
