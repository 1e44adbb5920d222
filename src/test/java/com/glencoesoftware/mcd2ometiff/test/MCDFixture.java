/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds artificial .mcd files: a binary header, raw float records for
 * each acquisition, and a trailing MCDPublic XML document.
 * The header contains a decoy copy of the XML root element, so that
 * only a reverse search finds the real footer.
 */
public class MCDFixture {

  /** Channel definition as written to the XML. */
  public static class Channel {
    public String name;
    public String label;
    public int order;

    public Channel(String name, String label, int order) {
      this.name = name;
      this.label = label;
      this.order = order;
    }
  }

  /** Acquisition definition and raw records. */
  public static class Acquisition {
    public String id;
    public String dataFormat = "Float";
    public int valueBytes = 4;

    /** Records as (X, Y, Z, C1, ..., CN). */
    public float[][] records;

    /** Channels in the order they are written to the XML. */
    public List<Channel> channels = new ArrayList<Channel>();

    /** Added to the DataEndOffset written to the XML. */
    public int endOffsetAdjustment = 0;

    /** Acquisition with no pixel data. */
    public boolean empty = false;
  }

  private final List<Acquisition> acquisitions = new ArrayList<Acquisition>();
  private Charset encoding = StandardCharsets.UTF_16LE;
  private boolean coordinateChannels = true;

  /**
   * @param charset encoding used for the XML footer and the decoy marker
   * @return this
   */
  public MCDFixture setEncoding(Charset charset) {
    encoding = charset;
    return this;
  }

  /**
   * @param include true if X, Y and Z channels should be written to the XML
   * @return this
   */
  public MCDFixture setCoordinateChannels(boolean include) {
    coordinateChannels = include;
    return this;
  }

  /**
   * Add an acquisition whose channels are named C1, C2, ... with labels
   * L1, L2, ... and order numbers matching their column.
   *
   * @param id acquisition ID
   * @param records records as (X, Y, Z, C1, ..., CN)
   * @return the new acquisition, for further customization
   */
  public Acquisition addAcquisition(String id, float[][] records) {
    Acquisition acq = new Acquisition();
    acq.id = id;
    acq.records = records;
    int channelCount = records.length == 0 ? 0 : records[0].length - 3;
    for (int c=0; c<channelCount; c++) {
      acq.channels.add(new Channel("C" + (c + 1), "L" + (c + 1), c + 3));
    }
    acquisitions.add(acq);
    return acq;
  }

  /**
   * @return the complete file contents
   */
  public byte[] build() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    // fake header, including a decoy root element
    out.write(new byte[] {(byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff});
    out.write("CytofShared.MCDHeader".getBytes(StandardCharsets.US_ASCII));
    out.write("<MCDPublic decoy=\"true\">".getBytes(encoding));
    while (out.size() % 4 != 0) {
      out.write(0);
    }

    long[][] offsets = new long[acquisitions.size()][2];
    for (int a=0; a<acquisitions.size(); a++) {
      Acquisition acq = acquisitions.get(a);
      offsets[a][0] = out.size();
      if (!acq.empty) {
        out.write(encodeRecords(acq.records));
      }
      offsets[a][1] = out.size() + acq.endOffsetAdjustment;
      if (acq.endOffsetAdjustment > 0) {
        out.write(new byte[acq.endOffsetAdjustment]);
      }
    }

    out.write(buildXML(offsets).getBytes(encoding));
    return out.toByteArray();
  }

  /**
   * Write the file.
   *
   * @param directory parent directory
   * @param name file name
   * @return path to the written file
   */
  public Path write(Path directory, String name) throws IOException {
    Path file = directory.resolve(name);
    Files.write(file, build());
    return file;
  }

  /**
   * @param records rows of values
   * @return little-endian float32 encoding of all rows
   */
  public static byte[] encodeRecords(float[][] records) {
    int count = 0;
    for (float[] record : records) {
      count += record.length;
    }
    ByteBuffer buf = ByteBuffer.allocate(count * 4);
    buf.order(ByteOrder.LITTLE_ENDIAN);
    for (float[] record : records) {
      for (float v : record) {
        buf.putFloat(v);
      }
    }
    return buf.array();
  }

  /**
   * Create records for a complete image, in row-major order.
   *
   * @param sizeX image width
   * @param sizeY image height
   * @param sizeC channel count
   * @return one record per pixel
   */
  public static float[][] grid(int sizeX, int sizeY, int sizeC) {
    float[][] records = new float[sizeX * sizeY][];
    for (int y=0; y<sizeY; y++) {
      for (int x=0; x<sizeX; x++) {
        float[] record = new float[sizeC + 3];
        record[0] = x;
        record[1] = y;
        record[2] = 0;
        for (int c=0; c<sizeC; c++) {
          record[c + 3] = value(x, y, c);
        }
        records[y * sizeX + x] = record;
      }
    }
    return records;
  }

  /**
   * @return value stored in the given pixel by {@link #grid}
   */
  public static float value(int x, int y, int c) {
    // not exactly representable in decimal, to catch precision loss
    return (x * 100 + y) / 3f + c * 1000;
  }

  private String buildXML(long[][] offsets) {
    StringBuilder xml = new StringBuilder();
    xml.append("<MCDPublic xmlns=\"http://www.fluidigm.com/IMC/" +
      "MCDPublicXMLSchema.xsd\">\n");
    xml.append("  <Slide><ID>0</ID><Description>slide</Description>" +
      "</Slide>\n");
    xml.append("  <Panorama><ID>1</ID><SlideID>0</SlideID>" +
      "<Description>Panorama_001</Description></Panorama>\n");

    for (int a=0; a<acquisitions.size(); a++) {
      Acquisition acq = acquisitions.get(a);
      int maxX = 0;
      int maxY = 0;
      for (float[] record : acq.records) {
        maxX = Math.max(maxX, (int) record[0]);
        maxY = Math.max(maxY, (int) record[1]);
      }
      xml.append("  <Acquisition>\n");
      element(xml, "ID", acq.id);
      element(xml, "Description", "ROI_" + acq.id);
      element(xml, "AblationPower", "0");
      element(xml, "DataStartOffset", String.valueOf(offsets[a][0]));
      element(xml, "DataEndOffset", String.valueOf(offsets[a][1]));
      element(xml, "MaxX", String.valueOf(maxX + 1));
      element(xml, "MaxY", String.valueOf(maxY + 1));
      element(xml, "SegmentDataFormat", acq.dataFormat);
      element(xml, "ValueBytes", String.valueOf(acq.valueBytes));
      xml.append("  </Acquisition>\n");
    }

    int channelId = 0;
    for (Acquisition acq : acquisitions) {
      List<Channel> channels = new ArrayList<Channel>();
      if (coordinateChannels) {
        channels.add(new Channel("X", "X", 0));
        channels.add(new Channel("Y", "Y", 1));
        channels.add(new Channel("Z", "Z", 2));
      }
      channels.addAll(acq.channels);
      for (Channel channel : channels) {
        xml.append("  <AcquisitionChannel>\n");
        element(xml, "ID", String.valueOf(channelId++));
        element(xml, "ChannelName", channel.name);
        element(xml, "OrderNumber", String.valueOf(channel.order));
        element(xml, "AcquisitionID", acq.id);
        if (channel.label == null) {
          xml.append("    <ChannelLabel />\n");
        }
        else {
          element(xml, "ChannelLabel", channel.label);
        }
        xml.append("  </AcquisitionChannel>\n");
      }
    }
    xml.append("</MCDPublic>");
    return xml.toString();
  }

  private static void element(StringBuilder xml, String name, String value) {
    xml.append("    <").append(name).append(">").append(value)
      .append("</").append(name).append(">\n");
  }

}
