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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import vtx.utilities.VTXException;

/**
 * An ordered list of loaders for the same data, tried in sequence. The first result wins; if
 * every loader fails, the failure of the last one is rethrown.
 *
 * @param <T> the type of the loaded data.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class FallbackLoader<T> {

  private static final Logger logger = Logger.getLogger(FallbackLoader.class.getName());

  /**
   * A loader that may fail with an I/O or VTX exception.
   *
   * @param <T> the type of the loaded data.
   */
  @FunctionalInterface
  public interface Loader<T> {

    /**
     * Load the data.
     *
     * @return the data.
     * @throws IOException if a file cannot be read.
     */
    T load() throws IOException;
  }

  private final List<String> names = new ArrayList<>();
  private final List<Loader<T>> loaders = new ArrayList<>();

  /**
   * Append a loader.
   *
   * @param name a description of the source (e.g. a file name).
   * @param loader the loader.
   * @return this FallbackLoader.
   */
  public FallbackLoader<T> add(String name, Loader<T> loader) {
    names.add(name);
    loaders.add(loader);
    return this;
  }

  /**
   * Try every loader in order.
   *
   * @return the result of the first loader that succeeds.
   * @throws IOException if the last loader failed with an IOException.
   * @throws VTXException if the last loader failed with a VTXException.
   * @throws IllegalStateException if no loaders were added.
   */
  public T load() throws IOException {
    if (loaders.isEmpty()) {
      throw new IllegalStateException(" No loaders were added.");
    }
    IOException lastIO = null;
    VTXException lastVTX = null;
    for (int i = 0; i < loaders.size(); i++) {
      try {
        T result = loaders.get(i).load();
        logger.fine(format(" Loaded %s.", names.get(i)));
        return result;
      } catch (IOException e) {
        logger.fine(format(" Could not load %s: %s", names.get(i), e));
        lastIO = e;
        lastVTX = null;
      } catch (VTXException e) {
        logger.fine(format(" Could not load %s: %s", names.get(i), e.getMessage()));
        lastVTX = e;
        lastIO = null;
      }
    }
    if (lastVTX != null) {
      throw lastVTX;
    }
    throw lastIO;
  }
}
