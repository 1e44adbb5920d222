/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.univocity.parsers.tsv.TsvWriter;
import com.univocity.parsers.tsv.TsvWriterSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an MCD Viewer style summary of an exported image: one
 * tab-separated row per channel with the page index in the OME-TIFF,
 * channel name, channel label and value range.
 * Some analysis software expects this file next to the exported image.
 */
public final class SummaryWriter {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(SummaryWriter.class);

  /** Suffix appended to the raster name. */
  public static final String SUFFIX = "_summary.txt";

  static final String[] HEADERS =
    {"Page", "Channel", "Label", "MinValue", "MaxValue"};

  private SummaryWriter() {
  }

  /**
   * Write the summary for a raster to "{raster name}_summary.txt".
   * An existing summary file is never replaced.
   *
   * @param raster exported image
   * @param outputDirectory directory in which to create the file
   * @return path to the summary file
   * @throws IOException if the file cannot be written
   */
  public static Path write(Raster raster, Path outputDirectory)
    throws IOException
  {
    return write(raster, outputDirectory, false);
  }

  /**
   * Write the summary for a raster to "{raster name}_summary.txt".
   *
   * @param raster exported image
   * @param outputDirectory directory in which to create the file
   * @param overwrite true if an existing summary file may be replaced
   * @return path to the summary file
   * @throws IllegalArgumentException if the file exists and overwrite
   *                                  is false
   * @throws IOException if the file cannot be written
   */
  public static Path write(Raster raster, Path outputDirectory,
    boolean overwrite)
    throws IOException
  {
    Path output = outputDirectory.resolve(
      OMETiffEmitter.toFileName(raster.getName()) + SUFFIX);
    OMETiffEmitter.prepareOutput(output, overwrite);
    TsvWriterSettings settings = new TsvWriterSettings();
    settings.getFormat().setLineSeparator("\n");
    try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      TsvWriter writer = new TsvWriter(out, settings);
      writer.writeHeaders(HEADERS);
      for (int c=0; c<raster.getSizeC(); c++) {
        String[] nameAndLabel =
          splitChannelName(raster.getChannelNames().get(c));
        writer.writeRow(String.valueOf(c), nameAndLabel[0], nameAndLabel[1],
          String.valueOf(raster.getMinimum(c)),
          String.valueOf(raster.getMaximum(c)));
      }
      writer.flush();
    }
    LOGGER.debug("Wrote summary to {}", output);
    return output;
  }

  /**
   * Split a display name into channel name and label at the first "_".
   *
   * @param displayName channel display name
   * @return {name, label}; label is empty if there is no "_"
   */
  static String[] splitChannelName(String displayName) {
    int split = displayName.indexOf('_');
    if (split < 0) {
      return new String[] {displayName, ""};
    }
    return new String[] {
      displayName.substring(0, split), displayName.substring(split + 1)};
  }

}
