/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import loci.common.xml.BaseHandler;
import loci.common.xml.XMLTools;
import loci.formats.FormatException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;

/**
 * Acquisitions and their channels, as defined by the MCDPublic XML.
 * The XML defines a single list of channels across all acquisitions;
 * each channel is matched to its acquisition by ID.
 */
public class AcquisitionCatalog {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(AcquisitionCatalog.class);

  static final String ACQUISITION = "Acquisition";
  static final String CHANNEL = "AcquisitionChannel";

  private final List<Acquisition> acquisitions;

  private AcquisitionCatalog(List<Acquisition> acquisitions) {
    this.acquisitions = Collections.unmodifiableList(acquisitions);
  }

  /**
   * @return every acquisition, in document order
   */
  public List<Acquisition> getAcquisitions() {
    return acquisitions;
  }

  /**
   * @param id acquisition ID
   * @return the matching acquisition, or null
   */
  public Acquisition getAcquisition(String id) {
    for (Acquisition a : acquisitions) {
      if (a.getId().equals(id)) {
        return a;
      }
    }
    return null;
  }

  /**
   * Parse the MCDPublic XML document.
   *
   * @param xml XML text, as returned by
   *            {@link FooterLocator#readFooter}
   * @return catalog of all acquisitions in the document
   * @throws FormatException if required elements are missing or invalid
   * @throws IOException if the XML cannot be parsed
   */
  public static AcquisitionCatalog parse(String xml)
    throws FormatException, IOException
  {
    MCDPublicHandler handler = new MCDPublicHandler();
    XMLTools.parseXML(xml, handler);

    // element lists are built per occurrence, so a document with a single
    // Acquisition or AcquisitionChannel still produces a one-element list
    List<Map<String, String>> acquisitionElements = handler.get(ACQUISITION);
    List<Map<String, String>> channelElements = handler.get(CHANNEL);
    LOGGER.debug("Found {} acquisitions and {} channels",
      acquisitionElements.size(), channelElements.size());

    List<AcquisitionChannel> channels = new ArrayList<AcquisitionChannel>();
    for (Map<String, String> element : channelElements) {
      channels.add(new AcquisitionChannel(
        require(element, CHANNEL, "AcquisitionID"),
        require(element, CHANNEL, "ChannelName"),
        element.get("ChannelLabel"),
        parseInt(element, CHANNEL, "OrderNumber")));
    }

    List<Acquisition> acquisitions = new ArrayList<Acquisition>();
    for (Map<String, String> element : acquisitionElements) {
      String id = require(element, ACQUISITION, "ID");

      List<AcquisitionChannel> acqChannels =
        new ArrayList<AcquisitionChannel>();
      for (AcquisitionChannel channel : channels) {
        if (channel.getAcquisitionId().equals(id) && !channel.isCoordinate()) {
          acqChannels.add(channel);
        }
      }
      // stable sort; ties keep document order
      acqChannels.sort(
        Comparator.comparingInt(AcquisitionChannel::getOrderNumber));

      String description = element.get("Description");
      acquisitions.add(new Acquisition(id,
        description == null || description.isEmpty() ? null : description,
        parseLong(element, ACQUISITION, "DataStartOffset"),
        parseLong(element, ACQUISITION, "DataEndOffset"),
        element.get("SegmentDataFormat"),
        parseInt(element, ACQUISITION, "ValueBytes"),
        acqChannels, element));
      LOGGER.debug("Acquisition {} has {} channels", id, acqChannels.size());
    }
    return new AcquisitionCatalog(acquisitions);
  }

  // -- Helper methods --

  private static String require(Map<String, String> element, String type,
    String key)
    throws FormatException
  {
    String value = element.get(key);
    if (value == null || value.isEmpty()) {
      throw new FormatException(type + " is missing required " + key +
        " (" + element + ")");
    }
    return value;
  }

  private static int parseInt(Map<String, String> element, String type,
    String key)
    throws FormatException
  {
    String value = require(element, type, key);
    try {
      return Integer.parseInt(value);
    }
    catch (NumberFormatException e) {
      throw new FormatException(
        "Invalid " + type + " " + key + ": " + value, e);
    }
  }

  private static long parseLong(Map<String, String> element, String type,
    String key)
    throws FormatException
  {
    String value = require(element, type, key);
    try {
      return Long.parseLong(value);
    }
    catch (NumberFormatException e) {
      throw new FormatException(
        "Invalid " + type + " " + key + ": " + value, e);
    }
  }

  // -- Helper class --

  /**
   * Collects each child of the root element as a generic record, mapping
   * the names of its own child elements to their text content.
   * Records are grouped by element name and kept in document order.
   */
  static class MCDPublicHandler extends BaseHandler {
    private final Map<String, List<Map<String, String>>> records =
      new HashMap<String, List<Map<String, String>>>();
    private int depth = 0;
    private Map<String, String> currentRecord = null;
    private StringBuilder value = new StringBuilder();

    @Override
    public void characters(char[] ch, int start, int length) {
      value.append(ch, start, length);
    }

    @Override
    public void startElement(String uri, String localName, String qName,
      Attributes attributes)
    {
      depth++;
      if (depth == 2) {
        currentRecord = new LinkedHashMap<String, String>();
      }
      value.setLength(0);
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
      if (depth == 2) {
        records.computeIfAbsent(qName,
          k -> new ArrayList<Map<String, String>>()).add(currentRecord);
        currentRecord = null;
      }
      else if (depth == 3 && currentRecord != null) {
        currentRecord.put(qName, value.toString().trim());
      }
      value.setLength(0);
      depth--;
    }

    /**
     * @param element record element name
     * @return every record with the given name, possibly empty
     */
    List<Map<String, String>> get(String element) {
      List<Map<String, String>> list = records.get(element);
      return list == null ? new ArrayList<Map<String, String>>() : list;
    }
  }

}
