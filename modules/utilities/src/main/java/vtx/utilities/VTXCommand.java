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

import static java.lang.String.format;
import static picocli.CommandLine.usage;

import java.io.ByteArrayOutputStream;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Base VTX Command class.
 *
 * @author Michael J. Schnieders
 */
public abstract class VTXCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(VTXCommand.class.getName());

  /**
   * Package searched for Commands referenced by their short name.
   */
  public static final String COMMAND_PACKAGE = "vtx.vasp.commands.";

  /**
   * ANSI colors are used for help text only when the terminal supports them.
   */
  public final Ansi color = Ansi.AUTO;

  /**
   * The array of args passed into the Command.
   */
  public String[] args;

  /**
   * Parse Result.
   */
  public ParseResult parseResult = null;

  /**
   * -V or --version Prints the VTX version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the VTX version and exit.")
  public boolean version;

  /**
   * -h or --help Prints a help message.
   */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * Create a VTX Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public VTXCommand(String[] args) {
    this.args = (args == null) ? new String[0] : args;
  }

  /**
   * Use the ClassLoader to find the requested Command.
   *
   * @param name Name of the Command to load (e.g., Traj or vtx.vasp.commands.Traj).
   * @return The Command, if found, or null.
   */
  public static Class<? extends VTXCommand> getCommand(String name) {
    ClassLoader loader = VTXCommand.class.getClassLoader();
    Class<?> command;
    try {
      command = loader.loadClass(name);
    } catch (ClassNotFoundException e) {
      try {
        command = loader.loadClass(COMMAND_PACKAGE + name);
      } catch (ClassNotFoundException e2) {
        logger.warning(format(" %s was not found.", name));
        return null;
      }
    }
    if (!VTXCommand.class.isAssignableFrom(command)) {
      logger.warning(format(" %s is not a VTX Command.", name));
      return null;
    }
    return command.asSubclass(VTXCommand.class);
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    StringOutputStream sos = new StringOutputStream(new ByteArrayOutputStream());
    usage(this, sos, color);
    return " " + sos;
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --save-in) are"
              + " only preceded by one dash.");
      throw uae;
    }

    // Print help info exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    return !version;
  }

  /**
   * Execute this Command.
   *
   * @return The current VTXCommand.
   */
  public VTXCommand run() {
    logger.info(helpString());
    return this;
  }
}
