package com.github.simbo1905.exodus;

import static com.github.simbo1905.exodus.ExodusSchema.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Lays down the part of the Exodus layout every file has: file attributes, the fixed and
/// caller-sized dimensions, coordinates, the block and side set catalogs and the time axis.
final class SchemaInitializer {

  private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

  private final Container container;
  private final ExodusFileBuilder.Config config;

  SchemaInitializer(Container container, ExodusFileBuilder.Config config) {
    this.container = container;
    this.config = config;
  }

  /// Writes the empty but complete schema. Block and side set ids start out as
  /// [ExodusSchema#UNASSIGNED_ID] so an id of zero is never mistaken for a free slot.
  void initialize() throws IOException {
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "initialize title='%s' numDims=%d numNodes=%d numElems=%d numBlocks=%d numSideSets=%d wordSize=%s",
                config.title(),
                config.numDims(),
                config.numNodes(),
                config.numElems(),
                config.numBlocks(),
                config.numSideSets(),
                config.wordSize()));
    writeAttributes();
    declareDimensions();
    createVariables();
    writeCatalogDefaults(VAR_EB_STATUS, VAR_EB_PROP1, config.numBlocks());
    if (config.numSideSets() > 0) {
      writeCatalogDefaults(VAR_SS_STATUS, VAR_SS_PROP1, config.numSideSets());
    }
  }

  private void writeAttributes() throws IOException {
    container.setAttribute(null, ATT_API_VERSION, SCHEMA_VERSION);
    container.setAttribute(null, ATT_VERSION, SCHEMA_VERSION);
    container.setAttribute(null, ATT_FLOATING_POINT_WORD_SIZE, config.wordSize().bytes());
    container.setAttribute(null, ATT_FILE_SIZE, 1);
    container.setAttribute(null, ATT_MAXIMUM_NAME_LENGTH, MAX_NAME_LENGTH);
    container.setAttribute(null, ATT_INT64_STATUS, 0);
    container.setAttribute(null, ATT_TITLE, config.title());
  }

  private void declareDimensions() throws IOException {
    container.declareDimension(DIM_LEN_STRING, LEN_STRING);
    container.declareDimension(DIM_LEN_LINE, LEN_LINE);
    container.declareDimension(DIM_FOUR, FOUR);
    container.declareDimension(DIM_LEN_NAME, LEN_NAME);
    container.declareDimension(DIM_TIME_STEP, TIME_STEPS);

    container.declareDimension(DIM_NUM_DIM, config.numDims());
    container.declareDimension(DIM_NUM_NODES, config.numNodes());
    container.declareDimension(DIM_NUM_ELEM, config.numElems());
    container.declareDimension(DIM_NUM_EL_BLK, config.numBlocks());
    if (config.numSideSets() > 0) {
      container.declareDimension(DIM_NUM_SIDE_SETS, config.numSideSets());
    }
  }

  private void createVariables() throws IOException {
    final var floats = config.wordSize().valueType;

    container.createVariable(VAR_COOR_NAMES, ValueType.CHAR, DIM_NUM_DIM, DIM_LEN_NAME);
    for (int axis = 0; axis < config.numDims(); axis++) {
      container.createVariable(VAR_COORDS[axis], floats, DIM_NUM_NODES);
    }

    createCatalog(VAR_EB_NAMES, VAR_EB_STATUS, VAR_EB_PROP1, DIM_NUM_EL_BLK);
    if (config.numSideSets() > 0) {
      createCatalog(VAR_SS_NAMES, VAR_SS_STATUS, VAR_SS_PROP1, DIM_NUM_SIDE_SETS);
    }

    container.createVariable(VAR_TIME_WHOLE, floats, DIM_TIME_STEP);
  }

  private void createCatalog(String names, String status, String prop, String dim)
      throws IOException {
    container.createVariable(names, ValueType.CHAR, dim, DIM_LEN_NAME);
    container.createVariable(status, ValueType.INT, dim);
    container.createVariable(prop, ValueType.INT, dim);
    container.setAttribute(prop, ATT_NAME, PROP_ID);
  }

  private void writeCatalogDefaults(String status, String prop, int capacity) throws IOException {
    final int[] origin = {0};
    final int[] shape = {capacity};
    container.writeInts(status, origin, shape, new int[capacity]);
    final var unassigned = new int[capacity];
    Arrays.fill(unassigned, UNASSIGNED_ID);
    container.writeInts(prop, origin, shape, unassigned);
  }
}
