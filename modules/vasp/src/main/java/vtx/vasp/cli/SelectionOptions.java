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
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import picocli.CommandLine.Option;
import vtx.utilities.IndexUtils;

/**
 * Represents command line options for commands that export selected steps or modes.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SelectionOptions {

  private static final Logger logger = Logger.getLogger(SelectionOptions.class.getName());

  /**
   * -i or --select-indices 1-based indices; negative values count from the end and 0 selects all.
   */
  @Option(names = {"-i", "--select-indices"}, split = ",", paramLabel = "-1",
      description = "Indices to export, starting from 1. Negative values count from the end; "
          + "0 selects all.")
  private int[] indices = {-1};

  /**
   * --save-in Directory to write the exported files to.
   */
  @Option(names = {"--save-in"}, paramLabel = ".",
      description = "Directory to write the exported files to.")
  private File saveIn = new File(".");

  /**
   * Resolve the selection to distinct 1-based indices.
   *
   * @param length the number of selectable items.
   * @param what the kind of item, used in error messages.
   * @return 1-based indices.
   * @throws vtx.utilities.IndexRangeException if an index is out of range.
   */
  public int[] getIndices(int length, String what) {
    int[] selected = IndexUtils.selectIndices(indices, length, what);
    for (int i = 0; i < selected.length; i++) {
      selected[i]++;
    }
    return selected;
  }

  /**
   * The output directory, created if necessary.
   *
   * @return the directory.
   * @throws IOException if the directory cannot be created.
   */
  public File getSaveDirectory() throws IOException {
    FileUtils.forceMkdir(saveIn);
    logger.fine(format(" Saving to %s", saveIn.getPath()));
    return saveIn;
  }
}
