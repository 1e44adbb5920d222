/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import loci.formats.FormatException;
import loci.formats.FormatTools;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line tool for converting Hyperion .mcd files to OME-TIFF.
 * One OME-TIFF is written per acquisition.
 */
public class Converter implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  /** TIFF tile dimensions must be a multiple of this value. */
  private static final int TILE_MULTIPLE = 16;

  private volatile Path inputPath;
  private volatile Path outputPath;

  private volatile Float fillValue = null;
  private volatile Charset encoding = ReaderOptions.DEFAULT_ENCODING;
  private volatile List<String> acquisitionIds = new ArrayList<String>();

  private volatile int tileWidth = 512;
  private volatile int tileHeight = 512;
  private volatile OutputCompression compressionType = OutputCompression.raw;

  private volatile boolean summary = false;
  private volatile boolean individualTiffs = false;
  private volatile boolean overwrite = false;

  private volatile String logLevel = "WARN";
  private volatile boolean progressBars = false;
  private volatile boolean printVersion = false;
  private volatile boolean help = false;

  private IProgressListener progressListener;

  /** Paths of every OME-TIFF written by the most recent conversion. */
  private final List<Path> writtenFiles = new ArrayList<Path>();

  // Option setters

  /**
   * @param input path to the input .mcd file
   */
  @Parameters(
    index = "0",
    arity = "1",
    description = ".mcd file to convert",
    defaultValue = Option.NULL_VALUE
  )
  public void setInputPath(String input) {
    inputPath = input == null ? null : Paths.get(input);
  }

  /**
   * @param output path to the output directory
   */
  @Parameters(
    index = "1",
    arity = "1",
    description = "directory in which to write one OME-TIFF per acquisition",
    defaultValue = Option.NULL_VALUE
  )
  public void setOutputPath(String output) {
    outputPath = output == null ? null : Paths.get(output);
  }

  /**
   * Set the value used for pixels with no data. By default, missing
   * data causes the conversion to fail.
   *
   * @param fill fill value, or null
   */
  @Option(
    names = {"-f", "--fill-missing"},
    description = "Value to use for missing pixels. If not specified, " +
      "conversion fails when an acquisition is missing data",
    defaultValue = Option.NULL_VALUE
  )
  public void setFillValue(Float fill) {
    fillValue = fill;
  }

  /**
   * @param charset encoding of the XML metadata stored in the .mcd file
   */
  @Option(
    names = {"-e", "--encoding"},
    description = "Text encoding of the .mcd XML metadata " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "UTF-16LE"
  )
  public void setEncoding(Charset charset) {
    if (charset != null) {
      encoding = charset;
    }
  }

  /**
   * Define a subset of acquisitions to convert.
   *
   * @param ids acquisition ID list
   */
  @Option(
    names = {"-a", "--acquisitions"},
    arity = "0..1",
    split = ",",
    description = "Comma-separated list of acquisition IDs to convert " +
      "(default: all)",
    defaultValue = Option.NULL_VALUE
  )
  public void setAcquisitionIds(List<String> ids) {
    if (ids != null) {
      acquisitionIds = ids;
    }
    else {
      acquisitionIds = new ArrayList<String>();
    }
  }

  /**
   * Set the maximum tile width for output.
   *
   * @param width tile width
   */
  @Option(
    names = {"-w", "--tile-width"},
    description = "Maximum tile width (default: ${DEFAULT-VALUE})",
    defaultValue = "512"
  )
  public void setTileWidth(int width) {
    if (width > 0 && width % TILE_MULTIPLE == 0) {
      tileWidth = width;
    }
    else {
      LOGGER.warn("Ignoring invalid tile width: {}", width);
    }
  }

  /**
   * Set the maximum tile height for output.
   *
   * @param height tile height
   */
  @Option(
    names = {"-h", "--tile-height"},
    description = "Maximum tile height (default: ${DEFAULT-VALUE})",
    defaultValue = "512"
  )
  public void setTileHeight(int height) {
    if (height > 0 && height % TILE_MULTIPLE == 0) {
      tileHeight = height;
    }
    else {
      LOGGER.warn("Ignoring invalid tile height: {}", height);
    }
  }

  /**
   * Set the compression type for the output TIFFs.
   *
   * @param compression compression type
   */
  @Option(
    names = {"-c", "--compression"},
    description = "Compression type for output TIFFs " +
      "(${COMPLETION-CANDIDATES}; default: ${DEFAULT-VALUE})",
    defaultValue = "raw"
  )
  public void setCompression(OutputCompression compression) {
    if (compression != null) {
      compressionType = compression;
    }
  }

  /**
   * @param writeSummary true if a channel summary should be written
   *                     next to each OME-TIFF
   */
  @Option(
    names = "--summary",
    description = "Write an MCD Viewer style channel summary " +
      "for each acquisition",
    defaultValue = "false"
  )
  public void setSummary(boolean writeSummary) {
    summary = writeSummary;
  }

  /**
   * @param writeIndividual true if each channel should also be written
   *                        to a separate TIFF
   */
  @Option(
    names = "--individual-tiffs",
    description = "Also write each channel as a separate TIFF, " +
      "in a directory per acquisition",
    defaultValue = "false"
  )
  public void setIndividualTiffs(boolean writeIndividual) {
    individualTiffs = writeIndividual;
  }

  /**
   * @param replace true if existing output files should be replaced
   */
  @Option(
    names = "--overwrite",
    description = "Overwrite existing output files",
    defaultValue = "false"
  )
  public void setOverwrite(boolean replace) {
    overwrite = replace;
  }

  /**
   * Set the slf4j logging level. Defaults to "WARN".
   *
   * @param level logging level
   */
  @Option(
    names = {"--log-level", "--debug"},
    arity = "0..1",
    description = "Change logging level; valid values are " +
      "OFF, ERROR, WARN, INFO, DEBUG, TRACE and ALL. " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "WARN",
    fallbackValue = "DEBUG"
  )
  public void setLogLevel(String level) {
    if (level != null) {
      logLevel = level;
    }
  }

  /**
   * Configure whether or not progress bars are shown during conversion.
   * Progress bars are turned off by default.
   *
   * @param useProgressBars whether or not to show progress bars
   */
  @Option(
    names = {"-p", "--progress"},
    description = "Print progress bars during conversion",
    defaultValue = "false"
  )
  public void setProgressBars(boolean useProgressBars) {
    progressBars = useProgressBars;
  }

  /**
   * Configure whether to print version information and exit
   * without converting.
   *
   * @param versionOnly whether or not to print version information and exit
   */
  @Option(
    names = "--version",
    description = "Print version information and exit",
    help = true,
    defaultValue = "false"
  )
  public void setPrintVersionOnly(boolean versionOnly) {
    printVersion = versionOnly;
  }

  /**
   * Configure whether to print help and exit without converting.
   *
   * @param helpOnly whether or not to print help and exit
   */
  @Option(
    names = "--help",
    description = "Print usage information and exit",
    usageHelp = true,
    defaultValue = "false"
  )
  public void setHelp(boolean helpOnly) {
    help = helpOnly;
  }

  // Option getters

  public Path getInputPath() {
    return inputPath;
  }

  public Path getOutputPath() {
    return outputPath;
  }

  public Float getFillValue() {
    return fillValue;
  }

  public Charset getEncoding() {
    return encoding;
  }

  public List<String> getAcquisitionIds() {
    return acquisitionIds;
  }

  public int getTileWidth() {
    return tileWidth;
  }

  public int getTileHeight() {
    return tileHeight;
  }

  public OutputCompression getCompression() {
    return compressionType;
  }

  public boolean getSummary() {
    return summary;
  }

  public boolean getIndividualTiffs() {
    return individualTiffs;
  }

  public boolean getOverwrite() {
    return overwrite;
  }

  public String getLogLevel() {
    return logLevel;
  }

  /**
   * @return every OME-TIFF written by the last call to {@link #convert()}
   */
  public List<Path> getWrittenFiles() {
    return writtenFiles;
  }

  // Conversion methods

  /**
   * @return 0 if conversion completed without error,
   *         -1 if conversion was not performed
   * @throws Exception on most conversion errors
   */
  @Override
  public Integer call() throws Exception {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logLevel));

    if (help) {
      return -1;
    }

    if (printVersion) {
      String version = Optional.ofNullable(
        this.getClass().getPackage().getImplementationVersion()
        ).orElse("development");
      System.out.println("Version = " + version);
      System.out.println("Bio-Formats version = " + FormatTools.VERSION);
      return -1;
    }

    if (inputPath == null) {
      throw new IllegalArgumentException("Input path not specified");
    }
    if (outputPath == null) {
      throw new IllegalArgumentException("Output path not specified");
    }
    if (!Files.exists(inputPath)) {
      throw new IllegalArgumentException(
        "Input file " + inputPath + " does not exist");
    }
    if (Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
      throw new IllegalArgumentException(
        "Output path " + outputPath + " is not a directory");
    }

    if (progressBars) {
      setProgressListener(new ProgressBarListener(logLevel));
    }

    convert();
    return 0;
  }

  /**
   * Convert every selected acquisition according to the specified
   * command line arguments.
   *
   * @throws FormatException if the input cannot be read or an image
   *                         cannot be written
   * @throws IOException if a file cannot be read or written
   */
  public void convert() throws FormatException, IOException {
    writtenFiles.clear();
    Files.createDirectories(outputPath);

    ReaderOptions options = new ReaderOptions()
      .setFillValue(fillValue)
      .setEncoding(encoding)
      .setAcquisitionIds(acquisitionIds);

    OMETiffEmitter emitter = new OMETiffEmitter();
    emitter.setTileSize(tileWidth, tileHeight);
    emitter.setCompression(compressionType);
    emitter.setOverwrite(overwrite);
    emitter.setProgressListener(getProgressListener());

    try (MCDFile mcd = MCDFile.open(inputPath, options)) {
      List<Acquisition> acquisitions = mcd.getSelectedAcquisitions();
      LOGGER.info("Converting {} of {} acquisitions from {}",
        acquisitions.size(), mcd.getCatalog().getAcquisitions().size(),
        inputPath);
      getProgressListener().notifyStart(acquisitions.size());

      MCDFile.RasterIterator rasters = mcd.iterator();
      while (rasters.hasNext()) {
        int index = rasters.nextIndex();
        Acquisition acquisition = acquisitions.get(index);
        Raster raster = nextRaster(rasters);
        getProgressListener().notifyAcquisitionStart(
          index, acquisition.getId(), raster.getSizeC());

        Slf4JStopWatch t0 = stopWatch();
        writtenFiles.add(emitter.writeOMETiff(raster, outputPath));
        if (summary) {
          SummaryWriter.write(raster, outputPath, overwrite);
        }
        if (individualTiffs) {
          emitter.writeIndividualTiffs(raster, outputPath);
        }
        t0.stop("writeAcquisition");
        getProgressListener().notifyAcquisitionEnd(index);
      }
    }
  }

  /**
   * Unwrap the checked exception from a failed read, so that callers
   * see the original format or I/O error.
   */
  private static Raster nextRaster(MCDFile.RasterIterator rasters)
    throws FormatException, IOException
  {
    try {
      return rasters.next();
    }
    catch (McdReadException e) {
      LOGGER.error(e.getMessage());
      Throwable cause = e.getCause();
      if (cause instanceof FormatException) {
        throw (FormatException) cause;
      }
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      throw e;
    }
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

  /**
   * Set a listener for conversion progress events.
   * Intended to be used to show a status bar.
   *
   * @param listener a progress event listener
   */
  public void setProgressListener(IProgressListener listener) {
    progressListener = listener;
  }

  /**
   * Get the current listener for conversion progress events.
   * If no listener was set, a no-op listener is returned.
   *
   * @return the current progress listener
   */
  public IProgressListener getProgressListener() {
    if (progressListener == null) {
      setProgressListener(new NoOpProgressListener());
    }
    return progressListener;
  }

  /**
   * Perform file conversion as specified by command line arguments.
   * @param args command line arguments
   */
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Converter()).execute(args);
    System.exit(exitCode);
  }

}
