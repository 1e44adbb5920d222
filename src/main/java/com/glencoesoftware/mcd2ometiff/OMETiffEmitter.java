/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import loci.common.services.DependencyException;
import loci.common.services.ServiceException;
import loci.common.services.ServiceFactory;
import loci.formats.FormatException;
import loci.formats.FormatTools;
import loci.formats.MetadataTools;
import loci.formats.MissingLibraryException;
import loci.formats.meta.IMetadata;
import loci.formats.out.OMETiffWriter;
import loci.formats.out.TiffWriter;
import loci.formats.services.OMEXMLService;
import loci.formats.services.OMEXMLServiceImpl;
import ome.units.UNITS;
import ome.units.quantity.Length;
import ome.xml.model.primitives.PositiveInteger;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes rasters as multi-channel OME-TIFF files, or as one TIFF
 * file per channel. Each channel is stored as a separate 32-bit float plane.
 */
public class OMETiffEmitter {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(OMETiffEmitter.class);

  /** Suffix of multi-channel output files. */
  public static final String OME_TIFF_SUFFIX = ".ome.tiff";

  /** Suffix of single channel output files. */
  public static final String TIFF_SUFFIX = ".tiff";

  /** Physical pixel size in microns; IMC ablation spots are 1 micron. */
  private static final double PHYSICAL_SIZE = 1.0;

  private static final String DIMENSION_ORDER = "XYZCT";

  /** Acquisition attribute copied to the OME Image description. */
  private static final String DESCRIPTION = "Description";

  private static final Pattern INVALID_FILE_NAME_CHARS =
    Pattern.compile("[/\\\\:*?\"<>|\\p{Cntrl}]");

  /** Total pixel bytes above which BigTIFF is written. */
  private static final long BIG_TIFF_THRESHOLD = 2L * 1024 * 1024 * 1024;

  private int tileWidth = 512;
  private int tileHeight = 512;
  private OutputCompression compression = OutputCompression.raw;
  private boolean overwrite = false;
  private IProgressListener progressListener;

  /**
   * @param width maximum tile width
   * @param height maximum tile height
   */
  public void setTileSize(int width, int height) {
    tileWidth = width;
    tileHeight = height;
  }

  public int getTileWidth() {
    return tileWidth;
  }

  public int getTileHeight() {
    return tileHeight;
  }

  /**
   * @param type compression type for all written files
   */
  public void setCompression(OutputCompression type) {
    compression = type;
  }

  public OutputCompression getCompression() {
    return compression;
  }

  /**
   * @param replace true if existing output files should be replaced
   */
  public void setOverwrite(boolean replace) {
    overwrite = replace;
  }

  /**
   * Set a listener for plane writing events.
   *
   * @param listener a progress event listener
   */
  public void setProgressListener(IProgressListener listener) {
    progressListener = listener;
  }

  /**
   * @return the current progress listener, or a no-op listener if none
   */
  public IProgressListener getProgressListener() {
    if (progressListener == null) {
      setProgressListener(new NoOpProgressListener());
    }
    return progressListener;
  }

  /**
   * Write all channels of a raster to "{raster name}.ome.tiff".
   *
   * @param raster image to write
   * @param outputDirectory directory in which to create the file
   * @return path to the written file
   * @throws FormatException if the image cannot be written
   * @throws IOException if the file cannot be created
   */
  public Path writeOMETiff(Raster raster, Path outputDirectory)
    throws FormatException, IOException
  {
    Path output =
      outputDirectory.resolve(toFileName(raster.getName()) + OME_TIFF_SUFFIX);
    prepareOutput(output);

    IMetadata metadata = createMetadata();
    populateMetadata(metadata, raster.getName(), raster,
      raster.getChannelNames());
    String description = raster.getAttributes().get(DESCRIPTION);
    if (description != null && !description.isEmpty()) {
      metadata.setImageDescription(description, 0);
    }

    Slf4JStopWatch t0 = stopWatch();
    try (OMETiffWriter writer = new OMETiffWriter()) {
      configureWriter(writer, metadata, raster);
      writer.setId(output.toString());
      for (int c=0; c<raster.getSizeC(); c++) {
        getProgressListener().notifyPlaneStart(c);
        writer.saveBytes(c, raster.getPlaneBytes(c, true));
        getProgressListener().notifyPlaneEnd(c);
      }
    }
    t0.stop("writeOMETiff");
    LOGGER.info("Wrote {} channels to {}", raster.getSizeC(), output);
    return output;
  }

  /**
   * Write each channel of a raster to "{channel name}.tiff" in a
   * directory named after the raster.
   *
   * @param raster image to write
   * @param outputDirectory directory in which to create the
   *                        per-raster directory
   * @return paths to the written files, in channel order
   * @throws FormatException if an image cannot be written
   * @throws IOException if a file cannot be created
   */
  public List<Path> writeIndividualTiffs(Raster raster, Path outputDirectory)
    throws FormatException, IOException
  {
    Path directory = outputDirectory.resolve(toFileName(raster.getName()));
    Files.createDirectories(directory);

    List<Path> paths = new ArrayList<Path>();
    for (int c=0; c<raster.getSizeC(); c++) {
      String channel = raster.getChannelNames().get(c);
      Path output = directory.resolve(toFileName(channel) + TIFF_SUFFIX);
      prepareOutput(output);

      IMetadata metadata = createMetadata();
      List<String> names = new ArrayList<String>();
      names.add(channel);
      populateMetadata(metadata, channel, raster, names);

      try (TiffWriter writer = new TiffWriter()) {
        configureWriter(writer, metadata, raster);
        writer.setId(output.toString());
        writer.saveBytes(0, raster.getPlaneBytes(c, true));
      }
      LOGGER.debug("Wrote channel {} to {}", channel, output);
      paths.add(output);
    }
    return paths;
  }

  /**
   * Convert an image or channel name to a file name.
   * Names come from the .mcd metadata, so path separators and characters
   * that are invalid in file names are replaced with "_".
   *
   * @param name image or channel name
   * @return a single path component derived from the name
   */
  static String toFileName(String name) {
    return INVALID_FILE_NAME_CHARS.matcher(name).replaceAll("_");
  }

  // -- Helper methods --

  private void prepareOutput(Path output) throws IOException {
    prepareOutput(output, overwrite);
  }

  /**
   * Make an output path ready for writing.
   *
   * @param output file about to be written
   * @param overwrite true if an existing file may be replaced
   * @throws IllegalArgumentException if the file exists and overwrite is false
   * @throws IOException if the file cannot be deleted, or its parent
   *                     directory cannot be created
   */
  static void prepareOutput(Path output, boolean overwrite)
    throws IOException
  {
    if (Files.exists(output)) {
      if (!overwrite) {
        throw new IllegalArgumentException(
          "Output file " + output + " already exists");
      }
      // the TIFF writers append to existing files
      LOGGER.warn("Overwriting output file {}", output);
      Files.delete(output);
    }
    Path parent = output.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }

  private void configureWriter(TiffWriter writer, IMetadata metadata,
    Raster raster)
    throws FormatException
  {
    writer.setMetadataRetrieve(metadata);
    writer.setCompression(compression.toString());
    writer.setInterleaved(false);
    writer.setWriteSequentially(true);
    long planeBytes = (long) raster.getSizeX() * raster.getSizeY() *
      FormatTools.getBytesPerPixel(FormatTools.FLOAT);
    if (planeBytes * raster.getSizeC() >= BIG_TIFF_THRESHOLD) {
      writer.setBigTiff(true);
    }
    // small images are written as a single strip
    if (raster.getSizeX() > tileWidth || raster.getSizeY() > tileHeight) {
      writer.setTileSizeX(tileWidth);
      writer.setTileSizeY(tileHeight);
    }
  }

  private void populateMetadata(IMetadata metadata, String imageName,
    Raster raster, List<String> channelNames)
  {
    MetadataTools.populateMetadata(metadata, 0, imageName, true,
      DIMENSION_ORDER, FormatTools.getPixelTypeString(FormatTools.FLOAT),
      raster.getSizeX(), raster.getSizeY(), 1, channelNames.size(), 1, 1);
    for (int c=0; c<channelNames.size(); c++) {
      metadata.setChannelID(MetadataTools.createLSID("Channel", 0, c), 0, c);
      metadata.setChannelSamplesPerPixel(new PositiveInteger(1), 0, c);
      metadata.setChannelName(channelNames.get(c), 0, c);
    }
    metadata.setPixelsPhysicalSizeX(
      new Length(PHYSICAL_SIZE, UNITS.MICROMETER), 0);
    metadata.setPixelsPhysicalSizeY(
      new Length(PHYSICAL_SIZE, UNITS.MICROMETER), 0);
  }

  private OMEXMLService getService() throws FormatException {
    try {
      ServiceFactory factory = new ServiceFactory();
      return factory.getInstance(OMEXMLService.class);
    }
    catch (DependencyException de) {
      throw new MissingLibraryException(OMEXMLServiceImpl.NO_OME_XML_MSG, de);
    }
  }

  /**
   * @return an empty IMetadata object for metadata transport.
   * @throws FormatException
   */
  private IMetadata createMetadata() throws FormatException {
    try {
      return getService().createOMEXMLMetadata();
    }
    catch (ServiceException se) {
      throw new FormatException(se);
    }
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
