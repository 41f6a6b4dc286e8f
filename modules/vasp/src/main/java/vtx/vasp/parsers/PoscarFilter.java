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
package vtx.vasp.parsers;

import static java.lang.String.format;
import static vtx.vasp.parsers.ParseUtils.parseDouble;
import static vtx.vasp.parsers.ParseUtils.parseFlag;
import static vtx.vasp.parsers.ParseUtils.parseInt;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import vtx.crystal.Cell;
import vtx.crystal.Structure;
import vtx.utilities.ConsistencyException;
import vtx.utilities.StringUtils;

/**
 * The PoscarFilter reads and writes the VASP POSCAR/CONTCAR structure format.
 *
 * <p>Layout: a comment line, the scale factor, three lattice vectors, species labels, species
 * counts, an optional "Selective dynamics" line, the coordinate type ("Direct" or "Cartesian")
 * and one line per atom. Cartesian coordinates in the file are multiplied by the scale factor.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PoscarFilter {

  private static final Logger logger = Logger.getLogger(PoscarFilter.class.getName());

  /** Prevent instantiation. */
  private PoscarFilter() {
  }

  /**
   * Read a POSCAR file.
   *
   * @param file the POSCAR.
   * @return the Structure.
   * @throws IOException if the file cannot be read.
   */
  public static Structure readFile(File file) throws IOException {
    logger.fine(format(" Reading %s", file.getPath()));
    return parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
  }

  /**
   * Write a POSCAR file.
   *
   * @param structure the Structure to write.
   * @param file the destination.
   * @param poscarFormat the output options.
   * @throws IOException if the file cannot be written.
   */
  public static void writeFile(Structure structure, File file, PoscarFormat poscarFormat)
      throws IOException {
    FileUtils.writeStringToFile(file, formatStructure(structure, poscarFormat),
        StandardCharsets.UTF_8);
    logger.info(format(" Wrote %s", file.getPath()));
  }

  /**
   * Parse the text of a POSCAR.
   *
   * @param text the POSCAR content.
   * @return the Structure.
   * @throws FormatException if a section is missing or malformed.
   * @throws TokenParseException if a numeric or flag token cannot be converted.
   * @throws ConsistencyException if the number of atom lines differs from the species counts.
   * @throws vtx.crystal.GeometryException if the lattice is singular.
   */
  public static Structure parse(String text) {
    String[] lines = text.split("\\r?\\n", -1);

    String comment = line(lines, 0, "comment").trim();

    String[] tokens = StringUtils.tokenize(line(lines, 1, "scale"));
    if (tokens.length == 0) {
      throw new FormatException("scale", "the scale factor is missing");
    }
    double scale = parseDouble(tokens[0], "scale");
    if (Double.isNaN(scale) || scale <= 0.0) {
      throw new FormatException("scale", format("invalid scale %s", tokens[0]));
    }

    double[][] lattice = new double[3][3];
    for (int i = 0; i < 3; i++) {
      tokens = StringUtils.tokenize(line(lines, 2 + i, "cell"));
      if (tokens.length < 3) {
        throw new FormatException("cell",
            format("incomplete cell: lattice vector %d has %d components", i + 1, tokens.length));
      }
      for (int j = 0; j < 3; j++) {
        lattice[i][j] = parseDouble(tokens[j], "cell");
      }
    }

    String[] ionTypes = StringUtils.tokenize(line(lines, 5, "species"));
    if (ionTypes.length == 0 || isInteger(ionTypes[0])) {
      throw new FormatException("species", "species labels are missing");
    }
    tokens = StringUtils.tokenize(line(lines, 6, "species counts"));
    if (tokens.length != ionTypes.length) {
      throw new FormatException("species counts",
          format("%d counts were given for %d species", tokens.length, ionTypes.length));
    }
    int[] ionsPerType = new int[tokens.length];
    int nAtoms = 0;
    for (int i = 0; i < tokens.length; i++) {
      ionsPerType[i] = parseInt(tokens[i], "species counts");
      if (ionsPerType[i] <= 0) {
        throw new FormatException("species counts",
            format("species %s has a non-positive count %d", ionTypes[i], ionsPerType[i]));
      }
      nAtoms += ionsPerType[i];
    }

    int index = 7;
    boolean selective = false;
    String mode = line(lines, index, "coordinate type").trim();
    if (!mode.isEmpty() && Character.toUpperCase(mode.charAt(0)) == 'S') {
      selective = true;
      index++;
      mode = line(lines, index, "coordinate type").trim();
    }
    boolean cartesian;
    char type = mode.isEmpty() ? ' ' : Character.toUpperCase(mode.charAt(0));
    if (type == 'C' || type == 'K') {
      cartesian = true;
    } else if (type == 'D') {
      cartesian = false;
    } else {
      throw new FormatException("coordinate type",
          format("unrecognized coordinate type \"%s\"", mode));
    }
    index++;

    double[][] coordinates = new double[nAtoms][3];
    boolean[][] constraints = selective ? new boolean[nAtoms][3] : null;
    for (int i = 0; i < nAtoms; i++) {
      int lineNumber = index + i;
      if (lineNumber >= lines.length || lines[lineNumber].isBlank()) {
        throw new ConsistencyException(format(
            " %d atoms were declared by the species counts, but %d positions were found.",
            nAtoms, i));
      }
      tokens = StringUtils.tokenize(lines[lineNumber]);
      int required = selective ? 6 : 3;
      if (tokens.length < required) {
        throw new FormatException("positions",
            format("atom %d requires %d columns but has %d", i + 1, required, tokens.length));
      }
      for (int j = 0; j < 3; j++) {
        coordinates[i][j] = parseDouble(tokens[j], "positions");
        if (selective) {
          constraints[i][j] = parseFlag(tokens[3 + j], "selective dynamics");
        }
      }
    }
    int next = index + nAtoms;
    if (next < lines.length && looksLikePosition(lines[next])) {
      throw new ConsistencyException(format(
          " %d atoms were declared by the species counts, but more positions were found.",
          nAtoms));
    }

    Cell cell = new Cell(lattice, scale);
    if (cartesian) {
      for (double[] row : coordinates) {
        for (int j = 0; j < 3; j++) {
          row[j] *= scale;
        }
      }
      return Structure.fromCartesian(comment, cell, ionTypes, ionsPerType, coordinates,
          constraints);
    }
    return Structure.fromFractional(comment, cell, ionTypes, ionsPerType, coordinates,
        constraints);
  }

  /**
   * Format a Structure as a POSCAR.
   *
   * @param structure the Structure.
   * @param poscarFormat the output options.
   * @return the POSCAR text.
   */
  public static String formatStructure(Structure structure, PoscarFormat poscarFormat) {
    Cell cell = structure.getCell();
    double scale = cell.getScale();
    String[] ionTypes = structure.getIonTypes();
    int[] ionsPerType = structure.getIonsPerType();

    StringBuilder sb = new StringBuilder();
    sb.append(structure.getComment()).append('\n');
    sb.append(format("%19.14f\n", scale));
    for (double[] row : cell.getLattice()) {
      sb.append(format(" %21.16f %21.16f %21.16f\n", row[0], row[1], row[2]));
    }
    for (String ionType : ionTypes) {
      sb.append(StringUtils.padLeft(ionType, 6));
    }
    sb.append('\n');
    for (int count : ionsPerType) {
      sb.append(format("%6d", count));
    }
    sb.append('\n');

    boolean[][] constraints = structure.getConstraints();
    boolean writeFlags = poscarFormat.preserveConstraints && constraints != null;
    if (writeFlags) {
      sb.append("Selective Dynamics\n");
    }

    double[][] coordinates;
    if (poscarFormat.fractional) {
      sb.append("Direct\n");
      coordinates = structure.getFractional();
    } else {
      sb.append("Cartesian\n");
      coordinates = structure.getCartesian();
      for (double[] row : coordinates) {
        for (int j = 0; j < 3; j++) {
          row[j] /= scale;
        }
      }
    }

    int atom = 0;
    for (int i = 0; i < ionTypes.length; i++) {
      for (int k = 1; k <= ionsPerType[i]; k++) {
        double[] x = coordinates[atom];
        sb.append(format(" %20.16f %20.16f %20.16f", x[0], x[1], x[2]));
        if (writeFlags) {
          boolean[] f = constraints[atom];
          sb.append(format(" %s %s %s", flag(f[0]), flag(f[1]), flag(f[2])));
        }
        if (poscarFormat.addSymbolTags) {
          sb.append(format(" ! %s-%03d %4d", ionTypes[i], k, atom + 1));
        }
        sb.append('\n');
        atom++;
      }
    }
    return sb.toString();
  }

  private static String line(String[] lines, int index, String field) {
    if (index >= lines.length) {
      throw new FormatException(field, format("unexpected end of file at line %d", index + 1));
    }
    return lines[index];
  }

  private static String flag(boolean flag) {
    return flag ? "T" : "F";
  }

  private static boolean isInteger(String token) {
    try {
      Integer.parseInt(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean looksLikePosition(String line) {
    String[] tokens = StringUtils.tokenize(line);
    if (tokens.length < 3) {
      return false;
    }
    for (int i = 0; i < 3; i++) {
      try {
        Double.parseDouble(tokens[i]);
      } catch (NumberFormatException e) {
        return false;
      }
    }
    return true;
  }
}
