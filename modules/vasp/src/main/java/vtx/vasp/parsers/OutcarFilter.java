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
import static org.apache.commons.math3.util.FastMath.sqrt;
import static vtx.vasp.parsers.ParseUtils.parseDouble;
import static vtx.vasp.parsers.ParseUtils.parseDoubles;
import static vtx.vasp.parsers.ParseUtils.parseInt;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.time.StopWatch;
import vtx.utilities.ConsistencyException;
import vtx.utilities.StringUtils;
import vtx.utilities.VTXException;
import vtx.vasp.IonicIteration;
import vtx.vasp.Outcar;
import vtx.vasp.VibrationalMode;

/**
 * The OutcarFilter extracts an {@link Outcar} from the text log of a VASP run.
 *
 * <p>Global parameters are read from the first occurrence of their marker. Per-step quantities
 * are read from every occurrence of their marker, and the ionic steps are assembled by zipping
 * the sequences after checking that all of them have the same length. Every field is extracted
 * by an independent task reading the same immutable text.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class OutcarFilter {

  private static final Logger logger = Logger.getLogger(OutcarFilter.class.getName());

  /** Property that sets the number of extraction threads. */
  public static final String THREADS_PROPERTY = "outcar-threads";

  private static final Pattern ISPIN = Pattern.compile("ISPIN\\s*=\\s*(\\d+)");
  private static final Pattern LSORBIT = Pattern.compile("LSORBIT\\s*=\\s*([TF])");
  private static final Pattern IBRION = Pattern.compile("IBRION\\s*=\\s*(-?\\d+)");
  private static final Pattern NIONS = Pattern.compile("NIONS\\s*=\\s*(\\d+)");
  private static final Pattern NKPTS_NBANDS =
      Pattern.compile("NKPTS\\s*=\\s*(\\d+).*NBANDS\\s*=\\s*(\\d+)");
  private static final Pattern EFERMI = Pattern.compile("E-fermi\\s*:\\s*(\\S+)");
  private static final Pattern IONS_PER_TYPE = Pattern.compile("(?m)ions per type\\s*=(.*)$");
  private static final Pattern POTCAR = Pattern.compile("(?m)^[ \\t]*POTCAR:(.*)$");
  private static final Pattern POMASS = Pattern.compile("POMASS\\s*=\\s*(\\S+);\\s*ZVAL");
  private static final Pattern LATTICE = Pattern.compile("direct lattice vectors");
  private static final Pattern TOTEN = Pattern.compile("free  energy   TOTEN\\s*=\\s*(\\S+) eV");
  private static final Pattern TOTEN_Z = Pattern.compile(
      "energy  without entropy=\\s*(\\S+)\\s+energy\\(sigma->0\\)\\s*=\\s*(\\S+)");
  private static final Pattern CPUTIME =
      Pattern.compile("LOOP\\+:\\s+cpu time\\s+\\S+\\s+real time\\s+(\\S+)");
  private static final Pattern PRESSURE = Pattern.compile("external pressure =\\s*(\\S+) kB");
  private static final Pattern ITERATION = Pattern.compile("Iteration\\s*\\d+\\(\\s*(\\d+)\\)");
  private static final Pattern POSITION = Pattern.compile("(?m)^ POSITION");
  private static final Pattern DOF = Pattern.compile("Degrees of freedom DOF\\s*=\\s*(\\d+)");
  private static final Pattern MODE = Pattern.compile(
      "(?m)^[ \\t]*\\d+ (f  |f/i)=.*?2PiTHz\\s+(\\S+) cm-1");

  private final int threads;

  /**
   * Create an OutcarFilter that uses one thread per available processor.
   */
  public OutcarFilter() {
    this(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Create an OutcarFilter configured by the "outcar-threads" property.
   *
   * @param properties the configuration.
   */
  public OutcarFilter(CompositeConfiguration properties) {
    this(properties.getInt(THREADS_PROPERTY, Runtime.getRuntime().availableProcessors()));
  }

  /**
   * Create an OutcarFilter.
   *
   * @param threads the number of extraction threads (at least 1).
   */
  public OutcarFilter(int threads) {
    this.threads = Math.max(1, threads);
  }

  /**
   * Read and parse an OUTCAR file.
   *
   * @param file the OUTCAR.
   * @return the parsed Outcar.
   * @throws IOException if the file cannot be read.
   */
  public Outcar readFile(File file) throws IOException {
    logger.info(format(" Reading %s", file.getPath()));
    String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    return parse(text);
  }

  /**
   * Parse the text of an OUTCAR.
   *
   * @param text the complete log.
   * @return the parsed Outcar.
   * @throws FormatException if a required field is missing or malformed.
   * @throws TokenParseException if a numeric token cannot be converted.
   * @throws ConsistencyException if the per-step sequences disagree in length.
   */
  public Outcar parse(String text) {
    StopWatch stopWatch = StopWatch.createStarted();
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      Future<Boolean> lsorbitTask = executor.submit(() -> parseLsorbit(text));
      Future<Integer> ispinTask = executor.submit(() -> parseIspin(text));
      Future<Integer> ibrionTask = executor.submit(() -> parseIbrion(text));
      Future<Integer> nionsTask = executor.submit(() -> parseNions(text));
      Future<int[]> nkptsNbandsTask = executor.submit(() -> parseNkptsNbands(text));
      Future<Double> efermiTask = executor.submit(() -> parseEfermi(text));
      Future<double[][]> cellTask = executor.submit(() -> parseCell(text));
      Future<int[]> ionsPerTypeTask = executor.submit(() -> parseIonsPerType(text));
      Future<String[]> ionTypesTask = executor.submit(() -> parseIonTypes(text));
      Future<double[]> massesTask = executor.submit(() -> parseSpeciesMasses(text));
      Future<List<Double>> totenTask = executor.submit(() -> parseToten(text));
      Future<List<Double>> totenZTask = executor.submit(() -> parseTotenZ(text));
      Future<List<Double>> cputimeTask = executor.submit(() -> parseCputime(text));
      Future<List<Double>> stressTask = executor.submit(() -> parseStress(text));
      Future<List<Integer>> nscfTask = executor.submit(() -> parseNscfs(text));
      Future<List<double[]>> magmomTask = executor.submit(() -> parseMagmoms(text));
      Future<List<double[][][]>> posForceTask =
          executor.submit(() -> parsePositionsAndForces(text));
      Future<List<double[][]>> stepCellsTask = executor.submit(() -> parseStepCells(text));
      Future<List<VibrationalMode>> vibrationsTask = executor.submit(() -> parseVibrations(text));

      boolean lsorbit = join(lsorbitTask);
      int ispin = join(ispinTask);
      int ibrion = join(ibrionTask);
      int nions = join(nionsTask);
      int[] nkptsNbands = join(nkptsNbandsTask);
      double efermi = join(efermiTask);
      double[][] cell = join(cellTask);
      int[] ionsPerType = join(ionsPerTypeTask);
      String[] ionTypes = join(ionTypesTask);
      double[] speciesMasses = join(massesTask);
      List<Double> toten = join(totenTask);
      List<Double> totenZ = join(totenZTask);
      List<Double> cputime = join(cputimeTask);
      List<Double> stress = join(stressTask);
      List<Integer> nscf = join(nscfTask);
      List<double[]> magmom = join(magmomTask);
      List<double[][][]> posForce = join(posForceTask);
      List<double[][]> stepCells = join(stepCellsTask);
      List<VibrationalMode> vibrations = join(vibrationsTask);

      // Species.
      checkSpecies(nions, ionTypes, ionsPerType, speciesMasses);
      double[] masses = broadcastMasses(speciesMasses, ionsPerType);

      // Per-step sequences are checked against the energy sequence.
      int nSteps = toten.size();
      checkLength("TOTEN_z", totenZ.size(), nSteps);
      checkLength("cpu time", cputime.size(), nSteps);
      checkLength("external pressure", stress.size(), nSteps);
      checkLength("Iteration", nscf.size(), nSteps);
      checkLength("magnetization", magmom.size(), nSteps);
      checkLength("POSITION", posForce.size(), nSteps);
      checkLength("direct lattice vectors", stepCells.size(), nSteps);
      for (int i = 0; i < nSteps; i++) {
        int rows = posForce.get(i)[0].length;
        if (rows != nions) {
          throw new ConsistencyException(format(
              " The POSITION block of step %d has %d rows for %d ions.", i + 1, rows, nions));
        }
      }

      List<IonicIteration> ionicIterations = new ArrayList<>(nSteps);
      for (int i = 0; i < nSteps; i++) {
        double[][][] pf = posForce.get(i);
        ionicIterations.add(new IonicIteration(nscf.get(i), toten.get(i), totenZ.get(i),
            cputime.get(i), stress.get(i), magmom.get(i), pf[0], pf[1], stepCells.get(i)));
      }

      if (vibrations != null) {
        vibrations = divideByMass(vibrations, masses);
      }

      Outcar outcar = new Outcar(lsorbit, ispin, ibrion, nions, nkptsNbands[0], nkptsNbands[1],
          efermi, cell, ionTypes, ionsPerType, masses, ionicIterations, vibrations, null);
      stopWatch.stop();
      logger.info(format(" Parsed %d ionic steps and %d vibrational modes for %d ions.", nSteps,
          (vibrations == null) ? 0 : vibrations.size(), nions));
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(outcar.toString());
        logger.fine(format(" OUTCAR extraction with %d threads: %8.3f (sec)", threads,
            stopWatch.getTime() * 1.0e-3));
      }
      return outcar;
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Wait for an extraction task. Failures of the task are rethrown unchanged.
   */
  private static <T> T join(Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new VTXException(" OUTCAR extraction was interrupted.", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new VTXException(" OUTCAR extraction failed.", cause);
    }
  }

  private static void checkLength(String field, int found, int expected) {
    if (found != expected) {
      throw new ConsistencyException(format(
          " Inconsistent step count for %s: %d found, but %d energies were parsed.", field, found,
          expected));
    }
  }

  private static void checkSpecies(int nions, String[] ionTypes, int[] ionsPerType,
      double[] masses) {
    if (ionTypes.length != ionsPerType.length) {
      throw new ConsistencyException(format(
          " %d POTCAR species were found for %d species counts.", ionTypes.length,
          ionsPerType.length));
    }
    if (masses.length != ionsPerType.length) {
      throw new ConsistencyException(format(
          " %d POMASS entries were found for %d species.", masses.length, ionsPerType.length));
    }
    int sum = Arrays.stream(ionsPerType).sum();
    if (sum != nions) {
      throw new ConsistencyException(format(
          " The ions per type sum to %d, but NIONS is %d.", sum, nions));
    }
  }

  /**
   * Expand per-species masses to one mass per ion.
   *
   * @param speciesMasses one mass per species.
   * @param ionsPerType the number of ions of each species.
   * @return one mass per ion.
   */
  public static double[] broadcastMasses(double[] speciesMasses, int[] ionsPerType) {
    double[] masses = new double[Arrays.stream(ionsPerType).sum()];
    int atom = 0;
    for (int i = 0; i < ionsPerType.length; i++) {
      for (int j = 0; j < ionsPerType[i]; j++) {
        masses[atom++] = speciesMasses[i];
      }
    }
    return masses;
  }

  public static boolean parseLsorbit(String text) {
    return "T".equals(MarkerScanner.findFirst(text, LSORBIT, "LSORBIT").group(1));
  }

  public static int parseIspin(String text) {
    return parseInt(MarkerScanner.findFirst(text, ISPIN, "ISPIN").group(1), "ISPIN");
  }

  public static int parseIbrion(String text) {
    return parseInt(MarkerScanner.findFirst(text, IBRION, "IBRION").group(1), "IBRION");
  }

  public static int parseNions(String text) {
    return parseInt(MarkerScanner.findFirst(text, NIONS, "NIONS").group(1), "NIONS");
  }

  /**
   * The number of k-points and bands.
   *
   * @param text the log.
   * @return {NKPTS, NBANDS}.
   */
  public static int[] parseNkptsNbands(String text) {
    Matcher matcher = MarkerScanner.findFirst(text, NKPTS_NBANDS, "NKPTS");
    return new int[] {parseInt(matcher.group(1), "NKPTS"), parseInt(matcher.group(2), "NBANDS")};
  }

  public static double parseEfermi(String text) {
    return parseDouble(MarkerScanner.findFirst(text, EFERMI, "E-fermi").group(1), "E-fermi");
  }

  /**
   * The header cell: the first "direct lattice vectors" block.
   *
   * @param text the log.
   * @return the lattice vectors, one per row.
   */
  public static double[][] parseCell(String text) {
    Matcher matcher = MarkerScanner.findFirst(text, LATTICE, "direct lattice vectors");
    return parseLattice(text, matcher.start());
  }

  /**
   * The cell of every ionic step: every "direct lattice vectors" block after the first.
   *
   * @param text the log.
   * @return one cell per step.
   */
  public static List<double[][]> parseStepCells(String text) {
    List<Integer> offsets = MarkerScanner.findAll(text, LATTICE);
    List<double[][]> cells = new ArrayList<>();
    for (int i = 1; i < offsets.size(); i++) {
      cells.add(parseLattice(text, offsets.get(i)));
    }
    return cells;
  }

  private static double[][] parseLattice(String text, int offset) {
    String field = "direct lattice vectors";
    List<String> lines = MarkerScanner.linesAfter(text, offset, 1, 3, field);
    double[][] lattice = new double[3][];
    for (int i = 0; i < 3; i++) {
      lattice[i] = parseDoubles(lines.get(i), 3, field);
    }
    return lattice;
  }

  public static int[] parseIonsPerType(String text) {
    String field = "ions per type";
    String[] tokens =
        StringUtils.tokenize(MarkerScanner.findFirst(text, IONS_PER_TYPE, field).group(1));
    if (tokens.length == 0) {
      throw new FormatException(field, "no species counts were found");
    }
    int[] counts = new int[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      counts[i] = parseInt(tokens[i], field);
    }
    return counts;
  }

  /**
   * Species labels from the POTCAR lines. Each POTCAR is listed twice, so only the first half is
   * kept, and a suffix such as "_pv" is removed from the label.
   *
   * @param text the log.
   * @return the species labels.
   */
  public static String[] parseIonTypes(String text) {
    List<String> lines = MarkerScanner.findAllGroups(text, POTCAR, 1);
    if (lines.isEmpty()) {
      throw FormatException.missing("POTCAR");
    }
    int n = lines.size() / 2;
    if (n == 0 || lines.size() % 2 != 0) {
      throw new FormatException("POTCAR",
          format("expected each POTCAR to be listed twice, but found %d lines", lines.size()));
    }
    String[] types = new String[n];
    for (int i = 0; i < n; i++) {
      String[] tokens = StringUtils.tokenize(lines.get(i));
      if (tokens.length < 2) {
        throw new FormatException("POTCAR", format("no species in \"%s\"", lines.get(i).trim()));
      }
      String label = tokens[1];
      int underscore = label.indexOf('_');
      types[i] = (underscore > 0) ? label.substring(0, underscore) : label;
    }
    return types;
  }

  /**
   * One mass per species, from the "POMASS = m; ZVAL" lines.
   *
   * @param text the log.
   * @return the species masses.
   */
  public static double[] parseSpeciesMasses(String text) {
    List<String> values = MarkerScanner.findAllGroups(text, POMASS, 1);
    if (values.isEmpty()) {
      throw FormatException.missing("POMASS");
    }
    return values.stream().mapToDouble(v -> parseDouble(v, "POMASS")).toArray();
  }

  public static List<Double> parseToten(String text) {
    return parseDoubleSequence(text, TOTEN, 1, "TOTEN");
  }

  public static List<Double> parseTotenZ(String text) {
    return parseDoubleSequence(text, TOTEN_Z, 2, "TOTEN_z");
  }

  public static List<Double> parseCputime(String text) {
    return parseDoubleSequence(text, CPUTIME, 1, "cpu time");
  }

  public static List<Double> parseStress(String text) {
    return parseDoubleSequence(text, PRESSURE, 1, "external pressure");
  }

  private static List<Double> parseDoubleSequence(String text, Pattern pattern, int group,
      String field) {
    List<Double> values = new ArrayList<>();
    for (String value : MarkerScanner.findAllGroups(text, pattern, group)) {
      values.add(parseDouble(value, field));
    }
    return values;
  }

  /**
   * The electronic iteration count of every ionic step: the last "Iteration N( M)" before each
   * free energy marker.
   *
   * @param text the log.
   * @return one count per ionic step.
   */
  public static List<Integer> parseNscfs(String text) {
    List<Integer> nscfs = new ArrayList<>();
    for (String context : MarkerScanner.backwardContexts(text, TOTEN)) {
      Matcher matcher = ITERATION.matcher(context);
      String last = null;
      while (matcher.find()) {
        last = matcher.group(1);
      }
      if (last == null) {
        throw new FormatException("Iteration",
            format("no electronic iteration precedes ionic step %d", nscfs.size() + 1));
      }
      nscfs.add(parseInt(last, "Iteration"));
    }
    return nscfs;
  }

  /**
   * The magnetic moment of every ionic step, from the last "number of electron" line before each
   * free energy marker. Entries are null for non-magnetic runs.
   *
   * @param text the log.
   * @return one moment (1 or 3 components, or null) per ionic step.
   */
  public static List<double[]> parseMagmoms(String text) {
    List<double[]> magmoms = new ArrayList<>();
    for (String context : MarkerScanner.backwardContexts(text, TOTEN)) {
      magmoms.add(parseMagmom(MarkerScanner.lastLineContaining(context, "number of electron")));
    }
    return magmoms;
  }

  private static double[] parseMagmom(String line) {
    if (line == null) {
      return null;
    }
    String[] tokens = StringUtils.tokenize(line);
    int start = Arrays.asList(tokens).indexOf("magnetization") + 1;
    if (start == 0 || start == tokens.length) {
      return null;
    }
    double[] magmom = new double[tokens.length - start];
    for (int i = 0; i < magmom.length; i++) {
      magmom[i] = parseDouble(tokens[start + i], "magnetization");
    }
    return magmom;
  }

  /**
   * Positions and forces of every ionic step.
   *
   * @param text the log.
   * @return for every step, {positions, forces}.
   */
  public static List<double[][][]> parsePositionsAndForces(String text) {
    String field = "POSITION";
    List<double[][][]> blocks = new ArrayList<>();
    for (int offset : MarkerScanner.findAll(text, POSITION)) {
      List<String> lines =
          MarkerScanner.linesUntil(text, offset, 2, line -> line.startsWith(" ----"), field);
      int n = lines.size();
      double[][] positions = new double[n][];
      double[][] forces = new double[n][];
      for (int i = 0; i < n; i++) {
        double[] row = parseDoubles(lines.get(i), 6, field);
        positions[i] = Arrays.copyOfRange(row, 0, 3);
        forces[i] = Arrays.copyOfRange(row, 3, 6);
      }
      blocks.add(new double[][][] {positions, forces});
    }
    return blocks;
  }

  /**
   * The vibrational modes, before division by the ion masses.
   *
   * <p>Modes are only present when the "Degrees of freedom DOF" marker exists. Exactly DOF mode
   * headers are taken from the start of the text, in document order.
   *
   * @param text the log.
   * @return the modes, or null if the run did not compute vibrations.
   */
  public static List<VibrationalMode> parseVibrations(String text) {
    Matcher dofMatcher = DOF.matcher(text);
    if (!dofMatcher.find()) {
      return null;
    }
    int dof = parseInt(dofMatcher.group(1), "DOF");
    if (dof == 0) {
      return null;
    }
    int nions = parseNions(text);
    String field = "vibrations";
    List<VibrationalMode> modes = new ArrayList<>(dof);
    Matcher matcher = MODE.matcher(text);
    while (modes.size() < dof && matcher.find()) {
      boolean imaginary = "f/i".equals(matcher.group(1));
      double frequency = parseDouble(matcher.group(2), field);
      List<String> lines = MarkerScanner.linesAfter(text, matcher.start(), 2, nions, field);
      double[][] displacements = new double[nions][];
      for (int i = 0; i < nions; i++) {
        displacements[i] = parseDoubles(lines.get(i), 3, 3, field);
      }
      modes.add(new VibrationalMode(frequency, imaginary, displacements));
    }
    if (modes.size() < dof) {
      throw new FormatException(field,
          format("%d degrees of freedom but only %d modes were found", dof, modes.size()));
    }
    return modes;
  }

  /**
   * Divide every displacement component by the square root of the mass of its ion.
   *
   * @param modes the modes to scale.
   * @param masses the mass of every ion.
   * @return new, mass weighted modes.
   */
  public static List<VibrationalMode> divideByMass(List<VibrationalMode> modes,
      double[] masses) {
    List<VibrationalMode> weighted = new ArrayList<>(modes.size());
    for (VibrationalMode mode : modes) {
      double[][] displacements = mode.getDisplacements();
      if (displacements.length != masses.length) {
        throw new ConsistencyException(format(
            " A vibrational mode has %d displacements for %d ions.", displacements.length,
            masses.length));
      }
      for (int i = 0; i < displacements.length; i++) {
        double s = sqrt(masses[i]);
        for (int j = 0; j < 3; j++) {
          displacements[i][j] /= s;
        }
      }
      weighted.add(new VibrationalMode(mode.getFrequency(), mode.isImaginary(), displacements));
    }
    return weighted;
  }
}
