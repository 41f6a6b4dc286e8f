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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * Loads the layered VTX configuration.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PropertyUtils {

  private static final Logger logger = Logger.getLogger(PropertyUtils.class.getName());

  /** Name of the environment variable that points to a system wide property file. */
  public static final String ENVIRONMENT_VARIABLE = "VTX_PROPERTIES";

  /** Prevent instantiation. */
  private PropertyUtils() {
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   *
   * <p>1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   *
   * <p>2.) Structure specific properties (for example OUTCAR.properties next to OUTCAR)
   *
   * <p>3.) User specific properties (~/.vtx/vtx.properties)
   *
   * <p>4.) System wide properties (file defined by environment variable VTX_PROPERTIES)
   *
   * @param file the input file the properties are being loaded for, or null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @since 1.0
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File structurePropFile = new File(basename + ".properties");
      if (structurePropFile.canRead()) {
        PropertiesConfiguration structureConfiguration = readPropertyFile(structurePropFile);
        if (structureConfiguration != null) {
          structureConfiguration.setHeader(
              "Structure properties from (" + structurePropFile.getPath() + ").");
          properties.addConfiguration(structureConfiguration);
          try {
            properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.FINE, " Could not resolve {0}.", structurePropFile);
          }
        }
      }
    }

    String filename = System.getProperty("user.home") + File.separator + ".vtx/vtx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration userConfiguration = readPropertyFile(userPropFile);
      if (userConfiguration != null) {
        userConfiguration.setHeader("VTX user property file (" + filename + ").");
        properties.addConfiguration(userConfiguration);
      }
    }

    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        PropertiesConfiguration envConfiguration = readPropertyFile(systemPropFile);
        if (envConfiguration != null) {
          envConfiguration.setHeader(
              "Environment variable " + ENVIRONMENT_VARIABLE + " (" + filename + ").");
          properties.addConfiguration(envConfiguration);
        }
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read one property file.
   *
   * @param propertyFile the file to read.
   * @return the configuration, or null if the file could not be parsed.
   */
  private static PropertiesConfiguration readPropertyFile(File propertyFile) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propertyFile.getPath());
      return null;
    }
  }
}
