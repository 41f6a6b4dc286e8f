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

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import vtx.crystal.Cell;
import vtx.crystal.Structure;
import vtx.numerics.math.MatrixMath;
import vtx.utilities.ConsistencyException;
import vtx.utilities.IndexUtils;
import vtx.vasp.parsers.PoscarFilter;
import vtx.vasp.parsers.PoscarFormat;
import vtx.vasp.parsers.XDATCARFilter;
import vtx.vasp.parsers.XSFFilter;

/**
 * The structures visited by an ionic run, one per step, each with its own cell, positions and
 * forces.
 *
 * <p>Steps are addressed with 1-based indices.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Trajectory {

  private static final Logger logger = Logger.getLogger(Trajectory.class.getName());

  /** Name of the trajectory file written by {@link #saveAsXdatcar(File)}. */
  public static final String XDATCAR = "XDATCAR";

  private final List<Structure> structures;
  private final List<double[][]> forces;

  /**
   * Constructor for Trajectory.
   *
   * @param structures one Structure per step.
   * @param forces the forces of every step.
   * @throws ConsistencyException if the lists differ in length.
   */
  public Trajectory(List<Structure> structures, List<double[][]> forces) {
    if (structures.size() != forces.size()) {
      throw new ConsistencyException(format(
          " %d structures were given with %d force blocks.", structures.size(), forces.size()));
    }
    this.structures = List.copyOf(structures);
    List<double[][]> copies = new ArrayList<>(forces.size());
    for (double[][] f : forces) {
      copies.add(MatrixMath.copyOf(f));
    }
    this.forces = copies;
  }

  /**
   * Build the trajectory of an Outcar. Every step uses its own cell; freeze flags of the Outcar,
   * if any, are attached to every step.
   *
   * @param outcar the parsed OUTCAR.
   * @return the Trajectory.
   */
  public static Trajectory fromOutcar(Outcar outcar) {
    String[] ionTypes = outcar.getIonTypes();
    int[] ionsPerType = outcar.getIonsPerType();
    boolean[][] constraints = outcar.getConstraints();
    List<IonicIteration> iterations = outcar.getIonicIterations();
    List<Structure> structures = new ArrayList<>(iterations.size());
    List<double[][]> forces = new ArrayList<>(iterations.size());
    for (int i = 0; i < iterations.size(); i++) {
      IonicIteration iteration = iterations.get(i);
      String comment = format("Generated by VTX, ionic step %d", i + 1);
      structures.add(Structure.fromCartesian(comment, new Cell(iteration.getCell()), ionTypes,
          ionsPerType, iteration.getPositions(), constraints));
      forces.add(iteration.getForces());
    }
    logger.fine(format(" Assembled a trajectory of %d steps.", structures.size()));
    return new Trajectory(structures, forces);
  }

  /**
   * The number of steps.
   *
   * @return the number of steps.
   */
  public int size() {
    return structures.size();
  }

  /**
   * All steps in order.
   *
   * @return an unmodifiable list.
   */
  public List<Structure> getStructures() {
    return structures;
  }

  /**
   * One step.
   *
   * @param step the 1-based step index.
   * @return the Structure of the step.
   * @throws vtx.utilities.IndexRangeException if the step does not exist.
   */
  public Structure getStructure(int step) {
    return structures.get(IndexUtils.checkIndex(step, structures.size(), "step"));
  }

  /**
   * The forces of one step.
   *
   * @param step the 1-based step index.
   * @return a copy of the forces.
   * @throws vtx.utilities.IndexRangeException if the step does not exist.
   */
  public double[][] getForces(int step) {
    return MatrixMath.copyOf(forces.get(IndexUtils.checkIndex(step, forces.size(), "step")));
  }

  /**
   * Write every step to directory/XDATCAR.
   *
   * @param directory the output directory.
   * @return the file written.
   * @throws IOException if the file cannot be written.
   */
  public File saveAsXdatcar(File directory) throws IOException {
    File file = new File(directory, XDATCAR);
    XDATCARFilter.writeFile(structures, file);
    return file;
  }

  /**
   * Write one step as a POSCAR named POSCAR_#####.vasp.
   *
   * @param step the 1-based step index.
   * @param directory the output directory.
   * @param poscarFormat the output options.
   * @return the file written.
   * @throws IOException if the file cannot be written.
   * @throws vtx.utilities.IndexRangeException if the step does not exist.
   */
  public File saveAsPoscar(int step, File directory, PoscarFormat poscarFormat)
      throws IOException {
    Structure structure = getStructure(step);
    File file = new File(directory, format("POSCAR_%05d.vasp", step));
    PoscarFilter.writeFile(structure, file, poscarFormat);
    return file;
  }

  /**
   * Write one step, with its forces, as an XSF file named step_####.xsf.
   *
   * @param step the 1-based step index.
   * @param directory the output directory.
   * @return the file written.
   * @throws IOException if the file cannot be written.
   * @throws vtx.utilities.IndexRangeException if the step does not exist.
   */
  public File saveAsXsf(int step, File directory) throws IOException {
    Structure structure = getStructure(step);
    File file = new File(directory, format("step_%04d.xsf", step));
    XSFFilter.writeFile(structure.getCell().getScaledLattice(), structure.getSymbols(),
        structure.getCartesian(), getForces(step), file);
    return file;
  }

  /**
   * Write several steps as POSCARs. Files are independent and written in parallel.
   *
   * @param steps 1-based step indices.
   * @param directory the output directory.
   * @param poscarFormat the output options.
   * @return the files written, in the order of steps.
   * @throws IOException if a file cannot be written.
   */
  public List<File> saveAsPoscars(int[] steps, File directory, PoscarFormat poscarFormat)
      throws IOException {
    checkSteps(steps);
    try {
      return Arrays.stream(steps).parallel().mapToObj(step -> {
        try {
          return saveAsPoscar(step, directory, poscarFormat);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }).collect(Collectors.toList());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  /**
   * Write several steps as XSF files. Files are independent and written in parallel.
   *
   * @param steps 1-based step indices.
   * @param directory the output directory.
   * @return the files written, in the order of steps.
   * @throws IOException if a file cannot be written.
   */
  public List<File> saveAsXsfs(int[] steps, File directory) throws IOException {
    checkSteps(steps);
    try {
      return Arrays.stream(steps).parallel().mapToObj(step -> {
        try {
          return saveAsXsf(step, directory);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }).collect(Collectors.toList());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  /**
   * Range errors are raised before any file is written.
   */
  private void checkSteps(int[] steps) {
    for (int step : steps) {
      IndexUtils.checkIndex(step, structures.size(), "step");
    }
  }
}
