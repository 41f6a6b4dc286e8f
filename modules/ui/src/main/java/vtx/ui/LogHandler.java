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
package vtx.ui;

import java.io.PrintStream;
import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * The default ConsoleHandler publishes logging to System.err. This class publishes to System.out,
 * except SEVERE records which go to System.err.
 *
 * <p>The formatter used reduces verbosity relative to the default SimpleFormatter.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LogHandler extends Handler {

  private final PrintStream out;
  private final PrintStream err;

  /**
   * If true, we have received a Record at the Level.SEVERE.
   */
  private boolean fatal = false;

  /**
   * Construct the VTX Log Handler on System.out and System.err.
   *
   * @param debug true to use the full SimpleFormatter layout for every record.
   */
  public LogHandler(boolean debug) {
    this(System.out, System.err, debug);
  }

  /**
   * Construct the VTX Log Handler on the given streams.
   *
   * @param out destination of records below SEVERE.
   * @param err destination of SEVERE records.
   * @param debug true to use the full SimpleFormatter layout for every record.
   */
  public LogHandler(PrintStream out, PrintStream err, boolean debug) {
    this.out = out;
    this.err = err;
    setLevel(Level.ALL);
    setFormatter(new LogFormatter(debug));
  }

  /**
   * Check for a SEVERE record.
   *
   * @return true if a SEVERE record has been published.
   */
  public boolean isFatal() {
    return fatal;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Flush, but do not close System.out.
   */
  @Override
  public void close() {
    flush();
  }

  /** {@inheritDoc} */
  @Override
  public void flush() {
    out.flush();
    err.flush();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void publish(LogRecord record) {
    if (!isLoggable(record)) {
      return;
    }

    String msg;
    try {
      msg = getFormatter().format(record);
    } catch (Exception e) {
      reportError(null, e, ErrorManager.FORMAT_FAILURE);
      return;
    }

    try {
      if (record.getLevel() == Level.SEVERE) {
        fatal = true;
        err.println(msg);
        Throwable throwable = record.getThrown();
        if (throwable != null) {
          err.printf(" %s%n", throwable);
        }
        err.flush();
      } else {
        out.println(msg);
      }
    } catch (Exception e) {
      reportError(null, e, ErrorManager.WRITE_FAILURE);
    }
  }
}
