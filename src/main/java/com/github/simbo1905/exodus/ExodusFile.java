package com.github.simbo1905.exodus;

import static com.github.simbo1905.exodus.ExodusSchema.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// A new Exodus II mesh and results file being written.
///
/// Instances are created with [ExodusFileBuilder] and own the underlying file until closed.
/// The file is laid out completely at creation: coordinates, the block and side set catalogs and
/// the time axis all exist before the first call returns. Blocks, side sets and variable
/// catalogs are then added one call at a time.
///
/// Ids passed to the block and side set methods are the caller's own ids. They are mapped to
/// 1-based slots internally, in allocation order.
///
/// Not thread safe. One instance is used by one thread and one process writes the file.
///
/// Validation failures throw unchecked exceptions and leave the file open and usable. An
/// [IOException] from the container leaves the file in an unknown state and every later call
/// except [#close()] fails with [IllegalStateException].
public class ExodusFile implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(ExodusFile.class.getName());

  /// Default chunk size in MiB for shifted connectivity writes.
  public static final int DEFAULT_CHUNK_SIZE_MB = 128;

  /// Lifecycle of the file handle.
  ///
  /// <ul>
  ///   <li><b>NEW</b> - constructed but the schema is not written yet</li>
  ///   <li><b>OPEN</b> - schema written and accepting calls</li>
  ///   <li><b>CLOSED</b> - closed via [#close()]</li>
  ///   <li><b>UNKNOWN</b> - an I/O failure left the file in an unknown state</li>
  /// </ul>
  enum FileState {
    NEW,
    OPEN,
    CLOSED,
    UNKNOWN
  }

  private volatile FileState state = FileState.NEW;

  @Getter private final Path path;
  @Getter private final String title;
  @Getter private final int numDims;
  @Getter private final int numNodes;
  @Getter private final int numElems;
  @Getter private final WordSize wordSize;

  private final long connectivityChunkBytes;
  private final Container container;
  private final EntityAllocator allocator;
  private final VariableRegistry variables;
  private final BulkArrayWriter bulk;

  private FixedWidthText infoRecords;
  private final FixedWidthText coordNames;

  /// Returns a new builder.
  public static ExodusFileBuilder Builder() {
    return new ExodusFileBuilder();
  }

  ExodusFile(ExodusFileBuilder.Config config) throws IOException {
    this(
        config,
        NetcdfContainer.createNew(
            config.path(), config.largeFile(), config.extraHeaderSpace()));
  }

  /// Lays out the schema in the given container. On failure the container is closed before
  /// the exception is rethrown.
  ExodusFile(ExodusFileBuilder.Config config, Container container) throws IOException {
    this.path = config.path();
    this.title = config.title();
    this.numDims = config.numDims();
    this.numNodes = config.numNodes();
    this.numElems = config.numElems();
    this.wordSize = config.wordSize();
    this.connectivityChunkBytes = config.connectivityChunkBytes();
    this.container = container;
    this.allocator =
        new EntityAllocator(container, config.numElems(), config.numBlocks(), config.numSideSets());
    this.variables = new VariableRegistry(container, allocator, wordSize, numNodes);
    this.bulk = new BulkArrayWriter(container);
    this.coordNames = new FixedWidthText(numDims, LEN_NAME);
    try {
      try {
        new SchemaInitializer(container, config).initialize();
      } catch (Exception e) {
        try {
          container.close();
        } catch (IOException closeException) {
          logger.log(
              Level.WARNING,
              "Failed to close container during constructor failure",
              closeException);
        }
        throw e;
      }
      state = FileState.OPEN;
      logger.log(Level.FINE, () -> String.format("created %s", this));
    } catch (Exception e) {
      state = FileState.UNKNOWN;
      throw e;
    }
  }

  /// Reads the default connectivity chunk size from the system property or environment
  /// variable `com.github.simbo1905.exodus.ExodusFile.CHUNK_SIZE_MB`. The property wins.
  ///
  /// @throws ValidationException if the configured value is not a positive integer
  static int getChunkSizeMbOrDefault() {
    final String key = String.format("%s.%s", ExodusFile.class.getName(), "CHUNK_SIZE_MB");
    String chunkSize =
        System.getenv(key) == null
            ? Integer.valueOf(DEFAULT_CHUNK_SIZE_MB).toString()
            : System.getenv(key);
    chunkSize = System.getProperty(key, chunkSize);
    final int chunkSizeMb;
    try {
      chunkSizeMb = Integer.parseInt(chunkSize.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException(
          String.format("%s must be a whole number of MiB, got '%s'", key, chunkSize), e);
    }
    if (chunkSizeMb <= 0) {
      throw new ValidationException(
          String.format("%s must be positive, got %d", key, chunkSizeMb));
    }
    return chunkSizeMb;
  }

  @FunctionalInterface
  private interface ContainerCall<T> {
    T run() throws IOException;
  }

  @FunctionalInterface
  private interface ContainerWrite {
    void run() throws IOException;
  }

  /// Runs a call against the container. Only I/O failures and unexpected runtime failures
  /// move the file to UNKNOWN; rejected input leaves it OPEN.
  private <T> T call(ContainerCall<T> action) throws IOException {
    ensureOpen();
    try {
      return action.run();
    } catch (ValidationException | EntityNotFoundException | CapacityExhaustedException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      state = FileState.UNKNOWN;
      throw e;
    }
  }

  private void write(ContainerWrite action) throws IOException {
    call(
        () -> {
          action.run();
          return null;
        });
  }

  private void ensureOpen() {
    if (state != FileState.OPEN) {
      throw new IllegalStateException("Exodus file is in state " + state + ", expected OPEN");
    }
  }

  /// Stores free-text information records, each at most 80 bytes. An empty list writes nothing.
  ///
  /// @throws ValidationException if a record is too long or info records were already written
  public void putInfoRecords(List<String> records) throws IOException {
    write(
        () -> {
          if (records == null || records.isEmpty()) {
            logger.log(Level.FINE, "no info records to write");
            return;
          }
          if (infoRecords != null) {
            throw new ValidationException(
                "Info records were already written (" + infoRecords.rows() + " records)");
          }
          final var lines = new FixedWidthText(records.size(), LEN_LINE);
          final var image = new byte[lines.rows() * lines.width()];
          for (int i = 0; i < records.size(); i++) {
            System.arraycopy(lines.put(i, records.get(i)), 0, image, i * lines.width(), lines.width());
          }
          container.declareDimension(DIM_NUM_INFO, lines.rows());
          container.createVariable(VAR_INFO_RECORDS, ValueType.CHAR, DIM_NUM_INFO, DIM_LEN_LINE);
          container.writeChars(
              VAR_INFO_RECORDS, new int[] {0, 0}, new int[] {lines.rows(), lines.width()}, image);
          infoRecords = lines;
          logger.log(Level.FINE, () -> String.format("wrote %d info records", lines.rows()));
        });
  }

  public List<String> getInfoRecords() {
    ensureOpen();
    return infoRecords == null ? List.of() : infoRecords.all();
  }

  /// Writes the nodal coordinates of a 2D mesh.
  public void putCoords(double[] x, double[] y) throws IOException {
    putCoords(x, y, null);
  }

  /// Writes the nodal coordinates. Each array holds one value per node; `z` must be null for a
  /// 2D mesh and present for a 3D mesh.
  ///
  /// @throws ValidationException on a missing, surplus or wrongly sized axis
  public void putCoords(double[] x, double[] y, double[] z) throws IOException {
    write(
        () -> {
          final double[][] axes = {x, y, z};
          if (numDims == 2 && z != null) {
            throw new ValidationException("A 2D mesh has no z coordinates");
          }
          for (int axis = 0; axis < numDims; axis++) {
            final var values = axes[axis];
            if (values == null || values.length != numNodes) {
              throw new ValidationException(
                  String.format(
                      "%s needs %d values, got %d",
                      VAR_COORDS[axis], numNodes, values == null ? 0 : values.length));
            }
          }
          for (int axis = 0; axis < numDims; axis++) {
            container.writeDoubles(
                VAR_COORDS[axis], new int[] {0}, new int[] {numNodes}, axes[axis]);
          }
          logger.log(Level.FINE, () -> String.format("wrote %d-D coordinates", numDims));
        });
  }

  /// Names the coordinate axes, one name per spatial dimension.
  public void putCoordNames(String... names) throws IOException {
    write(
        () -> {
          if (names == null || names.length != numDims) {
            throw new ValidationException(
                String.format(
                    "Need %d coordinate names, got %d", numDims, names == null ? 0 : names.length));
          }
          final var image = new byte[numDims * coordNames.width()];
          for (int i = 0; i < names.length; i++) {
            System.arraycopy(
                coordNames.put(i, names[i]), 0, image, i * coordNames.width(), coordNames.width());
          }
          container.writeChars(
              VAR_COOR_NAMES, new int[] {0, 0}, new int[] {numDims, coordNames.width()}, image);
        });
  }

  public List<String> getCoordNames() {
    ensureOpen();
    return coordNames.all();
  }

  /// Adds an element block in the first free block slot.
  ///
  /// @param id the caller's block id, unique among blocks
  /// @param elementType element type tag such as `TETRA` or `HEX8`
  /// @param numElements elements in the block, at most the file's element count
  /// @param nodesPerElement nodes per element
  /// @param attributesPerElement must be 0
  /// @return the allocated block with its slot
  /// @throws ValidationException on bad counts, attributes or a duplicate id
  /// @throws CapacityExhaustedException if every block slot is taken
  public ElementBlock putElemBlkInfo(
      int id, String elementType, int numElements, int nodesPerElement, int attributesPerElement)
      throws IOException {
    return call(
        () ->
            allocator.allocateBlock(
                id, elementType, numElements, nodesPerElement, attributesPerElement));
  }

  public void putElementBlockName(int id, String name) throws IOException {
    write(() -> allocator.putBlockName(id, name));
  }

  public String getElementBlockName(int id) {
    ensureOpen();
    return allocator.blockName(id);
  }

  /// Block ids in slot order.
  public List<Integer> getElementBlockIds() {
    ensureOpen();
    return allocator.blockIds();
  }

  /// Writes 1-based connectivity as given.
  public void putElemConnectivity(int id, int[] connectivity) throws IOException {
    putElemConnectivity(id, connectivity, 0);
  }

  /// Writes connectivity adding `indexShift` to every entry, e.g. 1 for 0-based input.
  public void putElemConnectivity(int id, int[] connectivity, int indexShift) throws IOException {
    write(
        () ->
            bulk.writeConnectivity(
                allocator.block(id), connectivity, indexShift, connectivityChunkBytes));
  }

  /// As [#putElemConnectivity(int, int[], int)] with a one-off chunk size in MiB.
  public void putElemConnectivity(int id, int[] connectivity, int indexShift, int chunkSizeMb)
      throws IOException {
    if (chunkSizeMb <= 0) {
      throw new ValidationException("Chunk size must be positive, got " + chunkSizeMb);
    }
    write(
        () ->
            bulk.writeConnectivity(
                allocator.block(id), connectivity, indexShift, chunkSizeMb * 1024L * 1024L));
  }

  /// Adds a side set in the first free side set slot.
  ///
  /// @throws ValidationException on non-zero distribution factors, a duplicate id or a bad count
  /// @throws CapacityExhaustedException if the declared side set capacity is filled
  public SideSet putSideSetParams(int id, int numSides, int numDistFactors) throws IOException {
    return call(() -> allocator.allocateSideSet(id, numSides, numDistFactors));
  }

  public void putSideSet(int id, int[] elements, int[] sides) throws IOException {
    putSideSet(id, elements, sides, 0);
  }

  /// Writes the element and local side lists of a side set, adding `indexShift` to both.
  public void putSideSet(int id, int[] elements, int[] sides, int indexShift) throws IOException {
    write(() -> bulk.writeSideSet(allocator.sideSet(id), elements, sides, indexShift));
  }

  public void putSideSetName(int id, String name) throws IOException {
    write(() -> allocator.putSideSetName(id, name));
  }

  public String getSideSetName(int id) {
    ensureOpen();
    return allocator.sideSetName(id);
  }

  /// Side set ids in slot order.
  public List<Integer> getSideSetIds() {
    ensureOpen();
    return allocator.sideSetIds();
  }

  /// Number of time steps, fixed at creation.
  public int getNumTimeSteps() {
    ensureOpen();
    return container.dimensionLength(DIM_TIME_STEP);
  }

  public void putTime(int step, double time) throws IOException {
    write(() -> variables.putTime(step, time));
  }

  public void setGlobalVariableNumber(int count) throws IOException {
    write(() -> variables.declare(VariableKind.GLOBAL, count));
  }

  /// Zero until [#setGlobalVariableNumber(int)] declares the catalog.
  public int getGlobalVariableNumber() {
    ensureOpen();
    return variables.count(VariableKind.GLOBAL);
  }

  public void putGlobalVariableName(String name, int index) throws IOException {
    write(() -> variables.putName(VariableKind.GLOBAL, name, index));
  }

  public List<String> getGlobalVariableNames() {
    ensureOpen();
    return variables.names(VariableKind.GLOBAL);
  }

  public void putGlobalVariableValue(String name, int step, double value) throws IOException {
    write(() -> variables.putGlobalValue(name, step, value));
  }

  public void setElementVariableNumber(int count) throws IOException {
    write(() -> variables.declare(VariableKind.ELEMENT, count));
  }

  public int getElementVariableNumber() {
    ensureOpen();
    return variables.count(VariableKind.ELEMENT);
  }

  public void putElementVariableName(String name, int index) throws IOException {
    write(() -> variables.putName(VariableKind.ELEMENT, name, index));
  }

  public List<String> getElementVariableNames() {
    ensureOpen();
    return variables.names(VariableKind.ELEMENT);
  }

  /// Writes one value per element of the block for the named element variable.
  public void putElementVariableValues(int blockId, String name, int step, double[] values)
      throws IOException {
    write(() -> variables.putElementValues(blockId, name, step, values));
  }

  public void setNodeVariableNumber(int count) throws IOException {
    write(() -> variables.declare(VariableKind.NODE, count));
  }

  public int getNodeVariableNumber() {
    ensureOpen();
    return variables.count(VariableKind.NODE);
  }

  public void putNodeVariableName(String name, int index) throws IOException {
    write(() -> variables.putName(VariableKind.NODE, name, index));
  }

  public List<String> getNodeVariableNames() {
    ensureOpen();
    return variables.names(VariableKind.NODE);
  }

  /// Writes one value per node for the named node variable.
  public void putNodeVariableValues(String name, int step, double[] values) throws IOException {
    write(() -> variables.putNodeValues(name, step, values));
  }

  public void flush() throws IOException {
    write(container::flush);
  }

  /// Closes the file. Safe to call more than once; calls after the first do nothing. A failure
  /// while closing is rethrown but the file still ends CLOSED.
  @Override
  public void close() throws IOException {
    if (state == FileState.CLOSED) {
      return;
    }
    logger.log(Level.FINE, () -> String.format("close called on %s", this));
    try {
      container.close();
    } finally {
      state = FileState.CLOSED;
    }
  }

  FileState getState() {
    return state;
  }

  @Override
  public String toString() {
    return String.format(
        "ExodusFile[path=%s, dims=%d, nodes=%d, elems=%d, blocks=%d, sideSets=%d, wordSize=%s]",
        path,
        numDims,
        numNodes,
        numElems,
        allocator.blockCapacity(),
        allocator.sideSetCapacity(),
        wordSize);
  }
}
