/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.glencoesoftware.mcd2ometiff.Converter;
import com.glencoesoftware.mcd2ometiff.IProgressListener;
import com.glencoesoftware.mcd2ometiff.OutputCompression;
import loci.common.DataTools;
import loci.common.LogbackTools;
import loci.common.services.ServiceFactory;
import loci.formats.FormatTools;
import loci.formats.IFormatReader;
import loci.formats.in.OMETiffReader;
import loci.formats.in.TiffReader;
import loci.formats.meta.IMetadata;
import loci.formats.services.OMEXMLService;
import ome.units.UNITS;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import picocli.CommandLine;

public class ConverterTest {

  Path input;
  Path output;
  Converter converter;

  /**
   * Set logging to warn before all methods.
   *
   * @param tmp temporary directory for input and output files
   */
  @BeforeEach
  public void setup(@TempDir Path tmp) throws Exception {
    input = tmp.resolve("sample.mcd");
    output = tmp.resolve("output");
    LogbackTools.setRootLevel("warn");
  }

  /**
   * Run the Converter and return its exit code.
   *
   * @param listener progress listener, or null
   * @param additionalArgs CLI arguments as needed beyond "input output"
   * @return value returned by {@link Converter#call()}
   */
  Integer assertTool(IProgressListener listener, String...additionalArgs)
    throws IOException
  {
    List<String> args = new ArrayList<String>();
    for (String arg : additionalArgs) {
      args.add(arg);
    }
    args.add(input.toString());
    args.add(output.toString());
    try {
      converter = new Converter();
      if (listener != null) {
        converter.setProgressListener(listener);
      }
      return CommandLine.call(converter, args.toArray(new String[]{}));
    }
    catch (RuntimeException rt) {
      throw rt;
    }
    catch (Throwable t) {
      throw new RuntimeException(t);
    }
  }

  Integer assertTool(String...additionalArgs) throws IOException {
    return assertTool(null, additionalArgs);
  }

  /**
   * Test converting a single acquisition with default options.
   */
  @Test
  public void testDefaultConversion() throws Exception {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(6, 4, 3));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool());
    Path ometiff = output.resolve("sample_1.ome.tiff");
    assertTrue(Files.exists(ometiff));
    assertEquals(Arrays.asList(ometiff), converter.getWrittenFiles());
    assertFalse(Files.exists(output.resolve("sample_1_summary.txt")));
    assertFalse(Files.exists(output.resolve("sample_1")));

    IMetadata metadata = createMetadata();
    try (OMETiffReader reader = new OMETiffReader()) {
      reader.setMetadataStore(metadata);
      reader.setId(ometiff.toString());
      assertEquals(1, reader.getSeriesCount());
      assertEquals(6, reader.getSizeX());
      assertEquals(4, reader.getSizeY());
      assertEquals(1, reader.getSizeZ());
      assertEquals(3, reader.getSizeC());
      assertEquals(1, reader.getSizeT());
      assertEquals(FormatTools.FLOAT, reader.getPixelType());
      assertEquals("XYZCT", reader.getDimensionOrder());

      assertEquals("sample_1", metadata.getImageName(0));
      assertEquals("ROI_1", metadata.getImageDescription(0));
      assertEquals("C1_L1", metadata.getChannelName(0, 0));
      assertEquals("C2_L2", metadata.getChannelName(0, 1));
      assertEquals("C3_L3", metadata.getChannelName(0, 2));
      assertEquals(1.0, metadata.getPixelsPhysicalSizeX(0).value(
        UNITS.MICROMETER).doubleValue(), 0.0);
      assertEquals(1.0, metadata.getPixelsPhysicalSizeY(0).value(
        UNITS.MICROMETER).doubleValue(), 0.0);

      for (int c=0; c<3; c++) {
        assertPlane(reader, c, 6, 4);
      }
    }
  }

  /**
   * Test that every acquisition is converted, and that progress is
   * reported for each channel plane.
   */
  @Test
  public void testMultipleAcquisitions() throws Exception {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(3, 3, 2));
    fixture.addAcquisition("2", MCDFixture.grid(4, 2, 5));
    fixture.write(input.getParent(), input.getFileName().toString());

    TestProgressListener listener = new TestProgressListener();
    assertEquals(0, assertTool(listener));
    assertTrue(Files.exists(output.resolve("sample_1.ome.tiff")));
    assertTrue(Files.exists(output.resolve("sample_2.ome.tiff")));

    assertEquals(2, listener.getTotalAcquisitionCount());
    assertEquals(Arrays.asList("1", "2"), listener.getStartedIds());
    assertArrayEquals(new Integer[] {2, 5}, listener.getPlaneCounts());
  }

  /**
   * Test converting a subset of acquisitions.
   */
  @Test
  public void testAcquisitionSubset() throws Exception {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(3, 3, 1));
    fixture.addAcquisition("2", MCDFixture.grid(3, 3, 1));
    fixture.addAcquisition("3", MCDFixture.grid(3, 3, 1));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool("--acquisitions", "1,3"));
    assertTrue(Files.exists(output.resolve("sample_1.ome.tiff")));
    assertFalse(Files.exists(output.resolve("sample_2.ome.tiff")));
    assertTrue(Files.exists(output.resolve("sample_3.ome.tiff")));
    assertEquals(Arrays.asList("1", "3"), converter.getAcquisitionIds());
  }

  /**
   * Test writing the per-channel summary table.
   */
  @Test
  public void testSummary() throws Exception {
    MCDFixture fixture = new MCDFixture();
    MCDFixture.Acquisition acq =
      fixture.addAcquisition("1", MCDFixture.grid(2, 2, 2));
    acq.channels.get(1).label = null;
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool("--summary"));
    Path summary = output.resolve("sample_1_summary.txt");
    List<String> lines = Files.readAllLines(summary, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertEquals("Page\tChannel\tLabel\tMinValue\tMaxValue", lines.get(0));

    String[] first = lines.get(1).split("\t", -1);
    assertEquals("0", first[0]);
    assertEquals("C1", first[1]);
    assertEquals("L1", first[2]);
    assertEquals(MCDFixture.value(0, 0, 0), Float.parseFloat(first[3]));
    assertEquals(MCDFixture.value(1, 1, 0), Float.parseFloat(first[4]));

    String[] second = lines.get(2).split("\t", -1);
    assertEquals("1", second[0]);
    assertEquals("C2", second[1]);
    assertEquals("", second[2]);
  }

  /**
   * Test writing one TIFF per channel.
   */
  @Test
  public void testIndividualTiffs() throws Exception {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(5, 3, 2));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool("--individual-tiffs"));
    assertTrue(Files.exists(output.resolve("sample_1.ome.tiff")));
    for (int c=0; c<2; c++) {
      String name = "C" + (c + 1) + "_L" + (c + 1) + ".tiff";
      Path tiff = output.resolve("sample_1").resolve(name);
      assertTrue(Files.exists(tiff));
      try (TiffReader reader = new TiffReader()) {
        reader.setId(tiff.toString());
        assertEquals(5, reader.getSizeX());
        assertEquals(3, reader.getSizeY());
        assertEquals(FormatTools.FLOAT, reader.getPixelType());
        float[] plane = readPlane(reader, 0);
        for (int y=0; y<3; y++) {
          for (int x=0; x<5; x++) {
            assertEquals(MCDFixture.value(x, y, c), plane[y * 5 + x]);
          }
        }
      }
    }
  }

  /**
   * Test that missing data fails by default and is filled on request.
   */
  @Test
  public void testFillMissing() throws Exception {
    float[][] records = MCDFixture.grid(4, 4, 1);
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", Arrays.copyOf(records, records.length - 3));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertThrows(CommandLine.ExecutionException.class, () -> {
      assertTool();
    });

    assertEquals(0, assertTool("--fill-missing=-1", "--overwrite"));
    assertEquals(Float.valueOf(-1f), converter.getFillValue());
    try (OMETiffReader reader = new OMETiffReader()) {
      reader.setId(output.resolve("sample_1.ome.tiff").toString());
      assertEquals(4, reader.getSizeX());
      assertEquals(4, reader.getSizeY());
      float[] plane = readPlane(reader, 0);
      assertEquals(MCDFixture.value(0, 3, 0), plane[12]);
      assertEquals(-1f, plane[13]);
      assertEquals(-1f, plane[15]);
    }
  }

  /**
   * Test tiled output with each compression type.
   *
   * @param compression output compression
   */
  @ParameterizedTest
  @EnumSource(OutputCompression.class)
  public void testTilesAndCompression(OutputCompression compression)
    throws Exception
  {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(40, 20, 2));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool("--tile-width", "16", "--tile-height", "16",
      "--compression", compression.name()));
    assertEquals(16, converter.getTileWidth());
    assertEquals(compression, converter.getCompression());

    try (OMETiffReader reader = new OMETiffReader()) {
      reader.setId(output.resolve("sample_1.ome.tiff").toString());
      assertEquals(16, reader.getOptimalTileWidth());
      assertEquals(16, reader.getOptimalTileHeight());
      for (int c=0; c<2; c++) {
        assertPlane(reader, c, 40, 20);
      }
    }
  }

  /**
   * Test that tile sizes that are not multiples of 16 are ignored.
   */
  @Test
  public void testInvalidTileSize() throws Exception {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(2, 2, 1));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool("--tile-width", "100", "--tile-height", "0"));
    assertEquals(512, converter.getTileWidth());
    assertEquals(512, converter.getTileHeight());
  }

  /**
   * Test that existing output is only replaced with --overwrite.
   */
  @Test
  public void testOverwrite() throws Exception {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(3, 2, 1));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool());
    assertThrows(CommandLine.ExecutionException.class, () -> {
      assertTool();
    });
    assertEquals(0, assertTool("--overwrite"));

    try (OMETiffReader reader = new OMETiffReader()) {
      reader.setId(output.resolve("sample_1.ome.tiff").toString());
      assertEquals(1, reader.getImageCount());
      assertPlane(reader, 0, 3, 2);
    }
  }

  /**
   * Test that an existing summary file is only replaced with --overwrite.
   */
  @Test
  public void testSummaryOverwrite() throws Exception {
    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(2, 2, 1));
    fixture.write(input.getParent(), input.getFileName().toString());

    Path summary = output.resolve("sample_1_summary.txt");
    Files.createDirectories(output);
    Files.write(summary, "keep".getBytes(StandardCharsets.UTF_8));

    assertThrows(CommandLine.ExecutionException.class, () -> {
      assertTool("--summary");
    });
    assertEquals(Arrays.asList("keep"),
      Files.readAllLines(summary, StandardCharsets.UTF_8));

    assertEquals(0, assertTool("--summary", "--overwrite"));
    List<String> lines = Files.readAllLines(summary, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertEquals("Page\tChannel\tLabel\tMinValue\tMaxValue", lines.get(0));
  }

  /**
   * Test that channel and acquisition names cannot place files outside
   * the output directory.
   */
  @Test
  public void testUnsafeNames() throws Exception {
    MCDFixture fixture = new MCDFixture();
    MCDFixture.Acquisition acq =
      fixture.addAcquisition("../1", MCDFixture.grid(2, 2, 2));
    acq.channels.get(0).name = "../../escape";
    acq.channels.get(0).label = null;
    acq.channels.get(1).name = "a\\b";
    fixture.write(input.getParent(), input.getFileName().toString());

    assertEquals(0, assertTool("--individual-tiffs", "--summary"));
    Path parent = output.getParent();
    assertFalse(Files.exists(parent.resolve("escape.tiff")));
    assertFalse(Files.exists(output.resolve("sample_..")));

    Path ometiff = output.resolve("sample_.._1.ome.tiff");
    assertTrue(Files.exists(ometiff));
    assertTrue(Files.exists(output.resolve("sample_.._1_summary.txt")));
    Path directory = output.resolve("sample_.._1");
    assertTrue(Files.exists(directory.resolve(".._.._escape.tiff")));
    assertTrue(Files.exists(directory.resolve("a_b_L2.tiff")));

    // the original names are kept in the metadata
    IMetadata metadata = createMetadata();
    try (OMETiffReader reader = new OMETiffReader()) {
      reader.setMetadataStore(metadata);
      reader.setId(ometiff.toString());
      assertEquals("sample_../1", metadata.getImageName(0));
      assertEquals("../../escape", metadata.getChannelName(0, 0));
      assertEquals("a\\b_L2", metadata.getChannelName(0, 1));
    }
  }

  /**
   * Test reading a footer written in a different encoding.
   */
  @Test
  public void testEncoding() throws Exception {
    MCDFixture fixture = new MCDFixture().setEncoding(StandardCharsets.UTF_8);
    fixture.addAcquisition("1", MCDFixture.grid(2, 2, 1));
    fixture.write(input.getParent(), input.getFileName().toString());

    assertThrows(CommandLine.ExecutionException.class, () -> {
      assertTool();
    });
    assertEquals(0, assertTool("--encoding", "UTF-8"));
    assertEquals(StandardCharsets.UTF_8, converter.getEncoding());
    assertTrue(Files.exists(output.resolve("sample_1.ome.tiff")));
  }

  /**
   * Test that invalid paths are rejected.
   */
  @Test
  public void testInvalidPaths() throws Exception {
    assertThrows(CommandLine.ExecutionException.class, () -> {
      assertTool();
    });

    MCDFixture fixture = new MCDFixture();
    fixture.addAcquisition("1", MCDFixture.grid(2, 2, 1));
    fixture.write(input.getParent(), input.getFileName().toString());
    Files.write(output, new byte[1]);
    assertThrows(CommandLine.ExecutionException.class, () -> {
      assertTool();
    });
  }

  /**
   * Test that --version and --help do not convert anything.
   */
  @Test
  public void testNoConversion() throws Exception {
    assertEquals(-1, assertTool("--version"));
    assertFalse(Files.exists(output));
    // usage help is printed by picocli without calling the converter
    assertTool("--help");
    assertFalse(Files.exists(output));
  }

  // -- Helper methods --

  private static IMetadata createMetadata() throws Exception {
    ServiceFactory factory = new ServiceFactory();
    OMEXMLService service = factory.getInstance(OMEXMLService.class);
    return service.createOMEXMLMetadata();
  }

  private static float[] readPlane(IFormatReader reader, int no)
    throws Exception
  {
    byte[] bytes = reader.openBytes(no);
    return (float[]) DataTools.makeDataArray(
      bytes, 4, true, reader.isLittleEndian());
  }

  private static void assertPlane(IFormatReader reader, int c,
    int sizeX, int sizeY)
    throws Exception
  {
    float[] plane = readPlane(reader, reader.getIndex(0, c, 0));
    for (int y=0; y<sizeY; y++) {
      for (int x=0; x<sizeX; x++) {
        assertEquals(MCDFixture.value(x, y, c), plane[y * sizeX + x]);
      }
    }
  }

}
