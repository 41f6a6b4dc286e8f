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
package vtx;

import static java.lang.String.format;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.lang3.time.StopWatch;
import vtx.ui.LogHandler;
import vtx.utilities.VTXCommand;

/**
 * The Main class is the entry point to the command line interface of VTX.
 *
 * <p>Usage: vtx [-Dkey=value ...] &lt;Command&gt; [options]
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  /** Commands listed by the help message. */
  static final String[] COMMANDS = {"Rlx", "Traj", "Vib", "Pos"};

  /** The handler installed on the "vtx" logger. */
  private static LogHandler logHandler;

  /** Prevent instantiation. */
  private Main() {
  }

  /**
   * Main entry point.
   *
   * @param args the command line arguments.
   */
  public static void main(String[] args) {
    int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Process -D properties, start logging and run the requested Command.
   *
   * @param args the command line arguments.
   * @return the exit status: 0 on success, 1 if the command failed or was not found.
   */
  public static int run(String[] args) {
    List<String> argList = processProperties(args);
    startLogging();

    if (argList.isEmpty()) {
      commandLineInterfaceHelp();
      return 0;
    }

    String name = argList.get(0);
    String[] commandArgs = argList.subList(1, argList.size()).toArray(new String[0]);
    Class<? extends VTXCommand> commandClass = VTXCommand.getCommand(name);
    if (commandClass == null) {
      commandLineInterfaceHelp();
      return 1;
    }

    StopWatch stopWatch = StopWatch.createStarted();
    try {
      VTXCommand command = commandClass.getConstructor(String[].class)
          .newInstance((Object) commandArgs);
      command.run();
    } catch (InvocationTargetException e) {
      logger.log(Level.SEVERE, format(" %s could not be created.", name), e.getCause());
      return 1;
    } catch (ReflectiveOperationException e) {
      logger.log(Level.SEVERE, format(" %s could not be created.", name), e);
      return 1;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, format(" %s failed.", name), e);
      return 1;
    }
    stopWatch.stop();
    logger.info(format("\n %s completed in %8.3f sec.", name, stopWatch.getTime() * 1.0e-3));
    return logHandler.isFatal() ? 1 : 0;
  }

  /**
   * Set every -Dkey=value argument as a system property and return the remaining arguments.
   */
  static List<String> processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        if (arg.contains("=")) {
          int equalsPosition = arg.indexOf("=");
          System.setProperty(arg.substring(0, equalsPosition), arg.substring(equalsPosition + 1));
        } else if (!arg.isEmpty()) {
          System.setProperty(arg, "");
        }
      } else {
        newArgs.add(arg);
      }
    }
    return newArgs;
  }

  /** Replace the default console handler with the VTX handler. */
  private static void startLogging() {
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    Logger vtxLogger = Logger.getLogger("vtx");
    for (Handler handler : vtxLogger.getHandlers()) {
      vtxLogger.removeHandler(handler);
    }

    // Retrieve the log level from the vtx.log system property.
    String logLevel = System.getProperty("vtx.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (IllegalArgumentException e) {
      level = Level.INFO;
    }

    logHandler = new LogHandler(level.intValue() < Level.INFO.intValue());
    logHandler.setLevel(level);
    vtxLogger.addHandler(logHandler);
    vtxLogger.setLevel(level);
    vtxLogger.setUseParentHandlers(false);
  }

  /** Print the available commands. */
  private static void commandLineInterfaceHelp() {
    StringBuilder sb = new StringBuilder("\n Usage: vtx [-Dkey=value ...] <Command> [-h] [options]\n");
    sb.append("\n Commands:\n");
    for (String command : COMMANDS) {
      sb.append(format("  %s\n", command));
    }
    logger.info(sb.toString());
  }

  /** For tests: the installed handler. */
  static LogHandler getLogHandler() {
    return logHandler;
  }
}
