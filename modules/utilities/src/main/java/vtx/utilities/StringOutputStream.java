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
package vtx.utilities;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * A PrintStream that collects its output into a String, used to capture command usage text.
 *
 * @author Michael J. Schnieders
 */
public class StringOutputStream extends PrintStream {

  private final ByteArrayOutputStream baos;
  private final Charset charset;

  /**
   * Collect output using UTF-8.
   *
   * @param baos the backing byte stream.
   */
  public StringOutputStream(ByteArrayOutputStream baos) {
    this(baos, StandardCharsets.UTF_8);
  }

  /**
   * Collect output using the given Charset.
   *
   * @param baos the backing byte stream.
   * @param charset the Charset used to encode and decode the text.
   */
  public StringOutputStream(ByteArrayOutputStream baos, Charset charset) {
    super(baos, true, charset);
    this.baos = baos;
    this.charset = charset;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return baos.toString(charset);
  }
}
